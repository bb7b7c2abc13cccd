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

import io.github.goodees.decider.core.Decider;
import io.github.goodees.decider.core.HandlingException;

import java.util.List;
import java.util.Objects;

/**
 * State-stored decision: the command is decided against the stored state, and the resulting events are folded
 * into it.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class StateComputation<C, S, E> {
    protected final Decider<C, S, E> decider;

    public StateComputation(Decider<C, S, E> decider) {
        this.decider = Objects.requireNonNull(decider, "Decider must be specified");
    }

    public Decider<C, S, E> getDecider() {
        return decider;
    }

    /**
     * Compute new state.
     * @param state stored state, {@code null} for initial state
     * @param command command to decide
     * @return new state
     * @throws HandlingException with {@link HandlingException.Fault#DECISION} when decide or evolve throws
     */
    public S computeNewState(S state, C command) throws HandlingException {
        return fold(state, decide(state, command));
    }

    protected List<E> decide(S state, C command) throws HandlingException {
        try {
            return decider.decide(command, state == null ? decider.getInitialState() : state);
        } catch (RuntimeException e) {
            throw HandlingException.decisionFailed(command, e);
        }
    }

    protected S fold(S state, List<E> events) throws HandlingException {
        S current = state == null ? decider.getInitialState() : state;
        for (E event : events) {
            try {
                current = decider.evolve(current, event);
            } catch (RuntimeException e) {
                throw HandlingException.decisionFailed(event, e);
            }
        }
        return current;
    }
}
