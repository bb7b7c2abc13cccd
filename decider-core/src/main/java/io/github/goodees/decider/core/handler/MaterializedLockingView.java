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

import io.github.goodees.decider.core.HandlingException;
import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.View;
import io.github.goodees.decider.core.computation.ViewStateComputation;
import io.github.goodees.decider.core.store.ViewStateLockingRepository;

import java.util.Map;
import java.util.Objects;

/**
 * Projection kept in a repository with optimistic locking.
 *
 * @param <S> state type
 * @param <E> event type
 * @param <V> version type
 */
public class MaterializedLockingView<S, E, V> extends AbstractHandler<E, Pair<S, V>> {
    private final ViewStateComputation<S, E> computation;
    private final ViewStateLockingRepository<E, S, V> repository;

    public MaterializedLockingView(View<S, E> view, ViewStateLockingRepository<E, S, V> repository) {
        this.computation = new ViewStateComputation<>(view);
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public Pair<S, V> handle(E event) throws HandlingException {
        Pair<S, V> current = fetchVersioned(event, () -> repository.fetchState(event));
        S newState = computation.computeNewState(current.getFirst(), event);
        return save(newState, null, () -> repository.save(newState, current.getSecond()));
    }

    public Pair<Pair<S, V>, Map<String, Object>> handle(E event, Map<String, Object> metadata)
            throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        Pair<S, V> current = fetchVersioned(event, () -> repository.fetchState(event, metadata));
        S newState = computation.computeNewState(current.getFirst(), event);
        return save(newState, null, () -> repository.save(newState, current.getSecond(), metadata));
    }
}
