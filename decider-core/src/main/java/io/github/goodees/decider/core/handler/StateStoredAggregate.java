package io.github.goodees.decider.core.handler;

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
import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.Saga;
import io.github.goodees.decider.core.computation.StateComputation;
import io.github.goodees.decider.core.computation.StateOrchestratingComputation;
import io.github.goodees.decider.core.store.StateRepository;

import java.util.Map;
import java.util.Objects;

/**
 * State-stored aggregate. The current state is fetched, the command is decided against it, the decided events are
 * applied and resulting state is saved. With a {@link StateOrchestratingComputation} the follow-up commands issued by
 * the saga are applied to the same state before it is saved.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class StateStoredAggregate<C, S, E> extends AbstractHandler<C, S> {
    private final StateComputation<C, S, E> computation;
    private final StateRepository<C, S> repository;

    public StateStoredAggregate(Decider<C, S, E> decider, StateRepository<C, S> repository) {
        this(new StateComputation<>(decider), repository);
    }

    public StateStoredAggregate(Decider<C, S, E> decider, Saga<E, C> saga, StateRepository<C, S> repository) {
        this(new StateOrchestratingComputation<>(decider, saga), repository);
    }

    public StateStoredAggregate(StateComputation<C, S, E> computation, StateRepository<C, S> repository) {
        this.computation = Objects.requireNonNull(computation, "Computation must be specified");
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public S handle(C command) throws HandlingException {
        S newState = computeNewState(command, fetch(command, () -> repository.fetchState(command)));
        return save(newState, null, () -> repository.save(newState));
    }

    public Pair<S, Map<String, Object>> handle(C command, Map<String, Object> metadata) throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        S newState = computeNewState(command, fetch(command, () -> repository.fetchState(command, metadata)));
        return save(newState, null, () -> repository.save(newState, metadata));
    }

    private S computeNewState(C command, S state) throws HandlingException {
        S newState = computation.computeNewState(state, command);
        logger.debug("Command {} changed state {} to {}", command, state, newState);
        return newState;
    }
}
