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
import io.github.goodees.decider.core.store.ViewStateRepository;

import java.util.Map;
import java.util.Objects;

/**
 * Projection kept in a repository. Every handled event is applied to the stored state of the view, and the new state
 * is saved.
 *
 * @param <S> state type
 * @param <E> event type
 */
public class MaterializedView<S, E> extends AbstractHandler<E, S> {
    private final ViewStateComputation<S, E> computation;
    private final ViewStateRepository<E, S> repository;

    public MaterializedView(View<S, E> view, ViewStateRepository<E, S> repository) {
        this.computation = new ViewStateComputation<>(view);
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public S handle(E event) throws HandlingException {
        S newState = computation.computeNewState(fetch(event, () -> repository.fetchState(event)), event);
        return save(newState, null, () -> repository.save(newState));
    }

    public Pair<S, Map<String, Object>> handle(E event, Map<String, Object> metadata) throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        S state = fetch(event, () -> repository.fetchState(event, metadata));
        S newState = computation.computeNewState(state, event);
        return save(newState, null, () -> repository.save(newState, metadata));
    }
}
