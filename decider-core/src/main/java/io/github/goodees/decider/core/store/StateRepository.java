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
 * Storage of state for state-stored aggregates.
 *
 * @param <C> command type
 * @param <S> state type
 */
public interface StateRepository<C, S> {

    /**
     * Read the state the command is targeting.
     * @param command the command
     * @return current state or {@code null} if there is none yet
     * @throws RepositoryException when state could not be read
     */
    S fetchState(C command) throws RepositoryException;

    default S fetchState(C command, Map<String, Object> metadata) throws RepositoryException {
        return fetchState(command);
    }

    S save(S state) throws RepositoryException;

    default Pair<S, Map<String, Object>> save(S state, Map<String, Object> metadata) throws RepositoryException {
        return Pair.of(save(state), metadata);
    }
}
