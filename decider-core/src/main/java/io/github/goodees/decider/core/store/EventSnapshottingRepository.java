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

/**
 * Event repository able to skip the events already reflected in a state snapshot.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public interface EventSnapshottingRepository<C, S, E> extends EventRepository<C, E> {

    /**
     * Read the events stored after the snapshot was taken.
     * @param command the command
     * @param latestSnapshot latest snapshot, or {@code null} when there is none
     * @return events not reflected in the snapshot
     * @throws RepositoryException when events could not be read
     */
    List<E> fetchEvents(C command, S latestSnapshot) throws RepositoryException;

    /**
     * Decide whether a new snapshot should be stored after handling a command.
     * @param latestSnapshot the snapshot that was used for handling, or {@code null}
     * @param newState the state after handling
     * @return true to store {@code newState} as a snapshot
     */
    boolean shouldCreateNewSnapshot(S latestSnapshot, S newState);
}
