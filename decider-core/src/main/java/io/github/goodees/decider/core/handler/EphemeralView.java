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
import io.github.goodees.decider.core.store.EphemeralViewRepository;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Projection computed on demand. Events selected by the query are folded from the initial state of the view, and
 * the result is not stored.
 *
 * @param <S> state type
 * @param <E> event type
 * @param <Q> query type
 */
public class EphemeralView<S, E, Q> extends AbstractHandler<Q, S> {
    private final ViewStateComputation<S, E> computation;
    private final EphemeralViewRepository<E, Q> repository;

    public EphemeralView(View<S, E> view, EphemeralViewRepository<E, Q> repository) {
        this.computation = new ViewStateComputation<>(view);
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public S handle(Q query) throws HandlingException {
        List<E> events = fetch(query, () -> repository.fetchEvents(query));
        return computation.computeState(events);
    }

    /**
     * Compute the view, passing metadata to the repository.
     * @param query the query
     * @param metadata metadata of the query, passed unmodified to the repository
     * @return computed state paired with the metadata
     * @throws HandlingException when fetch or evolve fails
     */
    public Pair<S, Map<String, Object>> handle(Q query, Map<String, Object> metadata) throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        List<E> events = fetch(query, () -> repository.fetchEvents(query, metadata));
        return Pair.of(computation.computeState(events), metadata);
    }
}
