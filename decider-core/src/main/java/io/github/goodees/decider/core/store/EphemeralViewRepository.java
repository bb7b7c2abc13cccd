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

import java.util.List;
import java.util.Map;

/**
 * Source of events for views computed on demand.
 *
 * @param <E> event type
 * @param <Q> query type
 */
@FunctionalInterface
public interface EphemeralViewRepository<E, Q> {

    List<E> fetchEvents(Q query) throws RepositoryException;

    default List<E> fetchEvents(Q query, Map<String, Object> metadata) throws RepositoryException {
        return fetchEvents(query);
    }
}
