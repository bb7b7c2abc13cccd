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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Storage of events for event-sourced aggregates.
 *
 * @param <C> command type
 * @param <E> event type
 */
public interface EventRepository<C, E> {

    /**
     * Read the history of the stream the command is targeting.
     * @param command the command
     * @return events in the order they were stored
     * @throws RepositoryException when events could not be read
     */
    List<E> fetchEvents(C command) throws RepositoryException;

    /**
     * Read the history of the stream, with metadata of the invocation available to the repository. Default
     * implementation ignores the metadata.
     * @param command the command
     * @param metadata metadata of the invocation
     * @return events in the order they were stored
     * @throws RepositoryException when events could not be read
     */
    default List<E> fetchEvents(C command, Map<String, Object> metadata) throws RepositoryException {
        return fetchEvents(command);
    }

    /**
     * Append single event to its stream.
     * @param event event to store
     * @return the stored event
     * @throws RepositoryException when the event could not be stored
     */
    E save(E event) throws RepositoryException;

    default List<E> save(List<E> events) throws RepositoryException {
        List<E> saved = new ArrayList<>(events.size());
        for (E event : events) {
            saved.add(save(event));
        }
        return saved;
    }

    /**
     * Store events along with metadata. Default implementation ignores the metadata when storing and pairs every
     * stored event with it.
     * @param events events to store
     * @param metadata metadata of the invocation
     * @return stored events with their metadata
     * @throws RepositoryException when the events could not be stored
     */
    default List<Pair<E, Map<String, Object>>> save(List<E> events, Map<String, Object> metadata)
            throws RepositoryException {
        List<Pair<E, Map<String, Object>>> saved = new ArrayList<>(events.size());
        for (E event : events) {
            saved.add(Pair.of(save(event), metadata));
        }
        return saved;
    }
}
