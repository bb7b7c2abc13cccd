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
import io.github.goodees.decider.core.store.StateLockingRepository;

import java.util.Map;
import java.util.Objects;

/**
 * State-stored aggregate with optimistic locking. The new state is saved against the version it was fetched with.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @param <V> version type
 */
public class StateStoredLockingAggregate<C, S, E, V> extends AbstractHandler<C, Pair<S, V>> {
    private final StateComputation<C, S, E> computation;
    private final StateLockingRepository<C, S, V> repository;

    public StateStoredLockingAggregate(Decider<C, S, E> decider, StateLockingRepository<C, S, V> repository) {
        this(new StateComputation<>(decider), repository);
    }

    public StateStoredLockingAggregate(Decider<C, S, E> decider, Saga<E, C> saga,
                                       StateLockingRepository<C, S, V> repository) {
        this(new StateOrchestratingComputation<>(decider, saga), repository);
    }

    public StateStoredLockingAggregate(StateComputation<C, S, E> computation,
                                       StateLockingRepository<C, S, V> repository) {
        this.computation = Objects.requireNonNull(computation, "Computation must be specified");
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public Pair<S, V> handle(C command) throws HandlingException {
        Pair<S, V> current = fetchVersioned(command, () -> repository.fetchState(command));
        S newState = computeNewState(current, command);
        return save(newState, null, () -> repository.save(newState, current.getSecond()));
    }

    public Pair<Pair<S, V>, Map<String, Object>> handle(C command, Map<String, Object> metadata)
            throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        Pair<S, V> current = fetchVersioned(command, () -> repository.fetchState(command, metadata));
        S newState = computeNewState(current, command);
        return save(newState, null, () -> repository.save(newState, current.getSecond(), metadata));
    }

    private S computeNewState(Pair<S, V> current, C command) throws HandlingException {
        S newState = computation.computeNewState(current.getFirst(), command);
        logger.debug("Command {} changed state {} to {}", command, current, newState);
        return newState;
    }
}
