package io.github.goodees.decider.core.store;

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

import io.github.goodees.decider.core.Pair;

import java.util.Map;

/**
 * Storage of view state that tracks which event version the state reflects. Redelivered events are detected by
 * comparing event version with the stored state version, and are rejected with
 * {@link RepositoryException#duplicate(String, Object, Object)}.
 *
 * @param <E> event type
 * @param <S> state type
 * @param <EV> event version type
 * @param <SV> state version type
 */
public interface ViewStateLockingDeduplicationRepository<E, S, EV, SV> {

    Pair<S, SV> fetchState(E event) throws RepositoryException;

    default Pair<S, SV> fetchState(E event, Map<String, Object> metadata) throws RepositoryException {
        return fetchState(event);
    }

    Pair<S, SV> save(S state, EV eventVersion, SV currentStateVersion) throws RepositoryException;

    default Pair<Pair<S, SV>, Map<String, Object>> save(S state, EV eventVersion, SV currentStateVersion,
                                                       Map<String, Object> metadata) throws RepositoryException {
        return Pair.of(save(state, eventVersion, currentStateVersion), metadata);
    }
}
