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
import io.github.goodees.decider.core.Saga;

import java.util.List;
import java.util.Objects;

/**
 * State computation that lets a saga react to the decided events and applies follow-up commands to the same state.
 * <p>The state produced by every follow-up command, including its own cascade, is the state the next follow-up
 * command is decided against, and the state of the last one is returned. A follow-up command therefore only has a
 * visible effect when the decider covers it, which is the case for combined deciders.</p>
 * <p>The same depth limit as in {@link EventOrchestratingComputation} applies.</p>
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class StateOrchestratingComputation<C, S, E> extends StateComputation<C, S, E> {
    private final Saga<E, C> saga;
    private final int maxCascadeDepth;

    public StateOrchestratingComputation(Decider<C, S, E> decider, Saga<E, C> saga) {
        this(decider, saga, EventOrchestratingComputation.UNLIMITED);
    }

    public StateOrchestratingComputation(Decider<C, S, E> decider, Saga<E, C> saga, int maxCascadeDepth) {
        super(decider);
        this.saga = Objects.requireNonNull(saga, "Saga must be specified");
        if (maxCascadeDepth < 0) {
            throw new IllegalArgumentException("Maximum cascade depth must not be negative");
        }
        this.maxCascadeDepth = maxCascadeDepth;
    }

    @Override
    public S computeNewState(S state, C command) throws HandlingException {
        return cascade(state, command, 0);
    }

    private S cascade(S state, C command, int depth) throws HandlingException {
        if (depth > maxCascadeDepth) {
            throw HandlingException.decisionFailed(command,
                new IllegalStateException("Cascade exceeded maximum depth of " + maxCascadeDepth));
        }
        List<E> events = decide(state, command);
        S newState = fold(state, events);
        for (E event : events) {
            for (C followUp : react(event)) {
                newState = cascade(newState, followUp, depth + 1);
            }
        }
        return newState;
    }

    private List<C> react(E event) throws HandlingException {
        try {
            return saga.react(event);
        } catch (RuntimeException e) {
            throw HandlingException.decisionFailed(event, e);
        }
    }
}
