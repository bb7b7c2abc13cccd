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
 * Storage of events with optimistic locking. Every stored event is paired with the version of its stream after it
 * was appended. The version read by {@link #fetchEvents(Object)} is passed back to {@link #save(List, Object)},
 * which must reject the events with {@link RepositoryException.Fault#OPTIMISTIC_LOCK} if the stream has moved since.
 *
 * @param <C> command type
 * @param <E> event type
 * @param <V> version type
 */
public interface EventLockingRepository<C, E, V> {

    List<Pair<E, V>> fetchEvents(C command) throws RepositoryException;

    default List<Pair<E, V>> fetchEvents(C command, Map<String, Object> metadata) throws RepositoryException {
        return fetchEvents(command);
    }

    /**
     * Provider of the stream version, used when the events were not fetched before saving them, as is the case for
     * events of follow-up commands in an orchestration cascade.
     * @return the provider
     */
    LatestVersionProvider<E, V> getLatestVersionProvider();

    /**
     * Append events to the stream.
     * @param events events to store
     * @param latestVersion the version the stream was read at, {@code null} for a stream expected to be empty
     * @return stored events with their versions
     * @throws RepositoryException when storing failed, including version mismatch
     */
    List<Pair<E, V>> save(List<E> events, V latestVersion) throws RepositoryException;

    /**
     * Append events along with metadata. Default implementation ignores the metadata when storing and pairs every
     * stored event with it.
     * @param events events to store
     * @param latestVersion the version the stream was read at, {@code null} for a stream expected to be empty
     * @param metadata metadata of the invocation
     * @return stored events with their versions, each paired with the metadata
     * @throws RepositoryException when storing failed, including version mismatch
     */
    default List<Pair<Pair<E, V>, Map<String, Object>>> save(List<E> events, V latestVersion,
                                                            Map<String, Object> metadata) throws RepositoryException {
        List<Pair<E, V>> saved = save(events, latestVersion);
        List<Pair<Pair<E, V>, Map<String, Object>>> result = new ArrayList<>(saved.size());
        for (Pair<E, V> event : saved) {
            result.add(Pair.of(event, metadata));
        }
        return result;
    }
}
