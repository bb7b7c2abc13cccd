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

import io.github.goodees.decider.core.Decider;
import io.github.goodees.decider.core.HandlingException;
import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.computation.EventComputation;
import io.github.goodees.decider.core.store.EventLockingRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Event-sourced aggregate with optimistic locking. The version of the last fetched event is passed to the repository
 * with the new events, and the repository refuses to save them when the stream has been appended to in the meantime.
 * Such a failure is reported with {@link HandlingException.Fault#SAVE}, and nothing is saved.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @param <V> version type
 */
public class EventSourcingLockingAggregate<C, S, E, V> extends AbstractHandler<C, List<Pair<E, V>>> {
    protected final EventComputation<C, S, E> computation;
    protected final EventLockingRepository<C, E, V> repository;

    public EventSourcingLockingAggregate(Decider<C, S, E> decider, EventLockingRepository<C, E, V> repository) {
        this(new EventComputation<>(decider), repository);
    }

    public EventSourcingLockingAggregate(EventComputation<C, S, E> computation,
                                         EventLockingRepository<C, E, V> repository) {
        this.computation = Objects.requireNonNull(computation, "Computation must be specified");
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public List<Pair<E, V>> handle(C command) throws HandlingException {
        List<Pair<E, V>> history = fetch(command, () -> repository.fetchEvents(command));
        V latestVersion = latestVersion(history);
        List<E> events = decide(history, latestVersion, command);
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        return save(events, Collections.emptyList(), () -> repository.save(events, latestVersion));
    }

    /**
     * Handle the command, passing metadata to the repository.
     * @param command the command
     * @param metadata metadata of the command, passed unmodified to the repository's fetch and save
     * @return saved events with their versions, paired with the metadata returned by the repository
     * @throws HandlingException when any step fails
     */
    public List<Pair<Pair<E, V>, Map<String, Object>>> handle(C command, Map<String, Object> metadata)
            throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        List<Pair<E, V>> history = fetch(command, () -> repository.fetchEvents(command, metadata));
        V latestVersion = latestVersion(history);
        List<E> events = decide(history, latestVersion, command);
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        return save(events, Collections.emptyList(), () -> repository.save(events, latestVersion, metadata));
    }

    private List<E> decide(List<Pair<E, V>> history, V latestVersion, C command) throws HandlingException {
        List<E> events = computation.computeNewEvents(unversioned(history), command);
        logger.debug("Command {} at version {} decided {}", command, latestVersion, events);
        return events;
    }

    static <E, V> V latestVersion(List<Pair<E, V>> history) {
        return history.isEmpty() ? null : history.get(history.size() - 1).getSecond();
    }

    static <E, V> List<E> unversioned(List<Pair<E, V>> versionedEvents) {
        List<E> result = new ArrayList<>(versionedEvents.size());
        for (Pair<E, V> versionedEvent : versionedEvents) {
            result.add(versionedEvent.getFirst());
        }
        return result;
    }
}
