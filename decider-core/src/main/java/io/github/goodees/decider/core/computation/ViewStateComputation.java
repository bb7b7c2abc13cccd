package io.github.goodees.decider.core.computation;

/*-
 * #%L
 * decider
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.decider.core.HandlingException;
import io.github.goodees.decider.core.View;

import java.util.List;
import java.util.Objects;

/**
 * Projection of events into view state.
 *
 * @param <S> state type
 * @param <E> event type
 */
public class ViewStateComputation<S, E> {
    private final View<S, E> view;

    public ViewStateComputation(View<S, E> view) {
        this.view = Objects.requireNonNull(view, "View must be specified");
    }

    public View<S, E> getView() {
        return view;
    }

    public S computeNewState(S state, E event) throws HandlingException {
        try {
            return view.evolve(state == null ? view.getInitialState() : state, event);
        } catch (RuntimeException e) {
            throw HandlingException.decisionFailed(event, e);
        }
    }

    /**
     * Fold events into a state starting at the initial state of the view.
     * @param events events to fold
     * @return resulting state
     * @throws HandlingException with {@link HandlingException.Fault#DECISION} when evolve throws
     */
    public S computeState(List<E> events) throws HandlingException {
        S current = view.getInitialState();
        for (E event : events) {
            current = computeNewState(current, event);
        }
        return current;
    }
}
