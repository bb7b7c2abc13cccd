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
 * Storage of state with optimistic locking.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <V> version type
 */
public interface StateLockingRepository<C, S, V> {

    /**
     * Read the state with its version.
     * @param command the command
     * @return state and version. Both are {@code null} when there is no state yet
     * @throws RepositoryException when state could not be read
     */
    Pair<S, V> fetchState(C command) throws RepositoryException;

    default Pair<S, V> fetchState(C command, Map<String, Object> metadata) throws RepositoryException {
        return fetchState(command);
    }

    /**
     * Store new state, provided the stored version still matches.
     * @param state new state
     * @param currentVersion the version that was fetched
     * @return state with its new version
     * @throws RepositoryException when storing failed, including version mismatch
     */
    Pair<S, V> save(S state, V currentVersion) throws RepositoryException;

    default Pair<Pair<S, V>, Map<String, Object>> save(S state, V currentVersion, Map<String, Object> metadata)
            throws RepositoryException {
        return Pair.of(save(state, currentVersion), metadata);
    }
}
