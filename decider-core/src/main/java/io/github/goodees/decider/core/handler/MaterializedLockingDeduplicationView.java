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
import io.github.goodees.decider.core.store.ViewStateLockingDeduplicationRepository;

import java.util.Map;
import java.util.Objects;

/**
 * Projection that receives every event together with its version. The event version is passed to the repository
 * on save, so that the repository can reject an event it has already applied.
 *
 * @param <S> state type
 * @param <E> event type
 * @param <EV> event version type
 * @param <SV> state version type
 */
public class MaterializedLockingDeduplicationView<S, E, EV, SV> extends AbstractHandler<Pair<E, EV>, Pair<S, SV>> {
    private final ViewStateComputation<S, E> computation;
    private final ViewStateLockingDeduplicationRepository<E, S, EV, SV> repository;

    public MaterializedLockingDeduplicationView(View<S, E> view,
                                                ViewStateLockingDeduplicationRepository<E, S, EV, SV> repository) {
        this.computation = new ViewStateComputation<>(view);
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public Pair<S, SV> handle(Pair<E, EV> versionedEvent) throws HandlingException {
        E event = versionedEvent.getFirst();
        Pair<S, SV> current = fetchVersioned(event, () -> repository.fetchState(event));
        S newState = computation.computeNewState(current.getFirst(), event);
        return save(newState, null, () -> repository.save(newState, versionedEvent.getSecond(), current.getSecond()));
    }

    public Pair<Pair<S, SV>, Map<String, Object>> handle(Pair<E, EV> versionedEvent, Map<String, Object> metadata)
            throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        E event = versionedEvent.getFirst();
        Pair<S, SV> current = fetchVersioned(event, () -> repository.fetchState(event, metadata));
        S newState = computation.computeNewState(current.getFirst(), event);
        return save(newState, null,
                () -> repository.save(newState, versionedEvent.getSecond(), current.getSecond(), metadata));
    }
}
