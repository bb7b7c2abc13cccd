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
 * Event-sourced decision: the history is folded into current state, and the command is decided against it.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class EventComputation<C, S, E> {
    protected final Decider<C, S, E> decider;

    public EventComputation(Decider<C, S, E> decider) {
        this.decider = Objects.requireNonNull(decider, "Decider must be specified");
    }

    public Decider<C, S, E> getDecider() {
        return decider;
    }

    /**
     * Compute the events implied by the command.
     * @param history all events of the stream
     * @param command command to decide
     * @return new events, not including history
     * @throws HandlingException with {@link HandlingException.Fault#DECISION} when decide or evolve throws
     */
    public List<E> computeNewEvents(List<E> history, C command) throws HandlingException {
        return computeNewEvents(decider.getInitialState(), history, command);
    }

    /**
     * Compute the events implied by the command, starting from a snapshot of state.
     * @param snapshot state to fold the history into, {@code null} for initial state
     * @param history events that are not reflected in snapshot
     * @param command command to decide
     * @return new events
     * @throws HandlingException with {@link HandlingException.Fault#DECISION} when decide or evolve throws
     */
    public List<E> computeNewEvents(S snapshot, List<E> history, C command) throws HandlingException {
        try {
            S currentState = decider.fold(snapshot == null ? decider.getInitialState() : snapshot, history);
            return decider.decide(command, currentState);
        } catch (RuntimeException e) {
            throw HandlingException.decisionFailed(command, e);
        }
    }
}
