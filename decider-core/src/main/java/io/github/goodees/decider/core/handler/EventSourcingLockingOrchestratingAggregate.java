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
import io.github.goodees.decider.core.Saga;
import io.github.goodees.decider.core.computation.EventOrchestratingComputation;
import io.github.goodees.decider.core.store.EventLockingRepository;
import io.github.goodees.decider.core.store.LatestVersionProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrating event-sourced aggregate with optimistic locking. The events of every command of the cascade are
 * saved together. The events of the original command are saved against the version they were decided at, so a
 * concurrent append to its stream fails the save with {@link HandlingException.Fault#SAVE} and nothing is saved.
 * Streams of follow-up commands are fetched lazily, their events are saved against the version the repository's
 * {@link LatestVersionProvider} reports at the time of saving. Events saved before a failing save are listed in the
 * exception.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @param <V> version type
 */
public class EventSourcingLockingOrchestratingAggregate<C, S, E, V> extends AbstractHandler<C, List<Pair<E, V>>> {
    private final EventOrchestratingComputation<C, S, E> orchestration;
    private final EventLockingRepository<C, E, V> repository;

    public EventSourcingLockingOrchestratingAggregate(Decider<C, S, E> decider, Saga<E, C> saga,
                                                      EventLockingRepository<C, E, V> repository) {
        this(new EventOrchestratingComputation<>(decider, saga), repository);
    }

    public EventSourcingLockingOrchestratingAggregate(EventOrchestratingComputation<C, S, E> orchestration,
                                                      EventLockingRepository<C, E, V> repository) {
        this.orchestration = Objects.requireNonNull(orchestration, "Orchestration must be specified");
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public List<Pair<E, V>> handle(C command) throws HandlingException {
        List<Pair<E, V>> history = fetch(command, () -> repository.fetchEvents(command));
        V fetchedVersion = EventSourcingLockingAggregate.latestVersion(history);
        List<List<E>> decisions = decide(history, command, null);
        LatestVersionProvider<E, V> versions = repository.getLatestVersionProvider();
        List<Pair<E, V>> saved = new ArrayList<>();
        for (int i = 0; i < decisions.size(); i++) {
            List<E> events = decisions.get(i);
            boolean original = i == 0;
            saved.addAll(save(events, saved, () -> repository.save(events,
                    original ? fetchedVersion : versions.latestVersion(events.get(0)))));
        }
        return saved;
    }

    /**
     * Handle the command, passing metadata to the repository.
     * @param command the command
     * @param metadata metadata of the command, passed unmodified to every fetch and save of the cascade
     * @return saved events with their versions, paired with the metadata returned by the repository
     * @throws HandlingException when any step fails
     */
    public List<Pair<Pair<E, V>, Map<String, Object>>> handle(C command, Map<String, Object> metadata)
            throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        List<Pair<E, V>> history = fetch(command, () -> repository.fetchEvents(command, metadata));
        V fetchedVersion = EventSourcingLockingAggregate.latestVersion(history);
        List<List<E>> decisions = decide(history, command, metadata);
        LatestVersionProvider<E, V> versions = repository.getLatestVersionProvider();
        List<Pair<Pair<E, V>, Map<String, Object>>> saved = new ArrayList<>();
        for (int i = 0; i < decisions.size(); i++) {
            List<E> events = decisions.get(i);
            boolean original = i == 0;
            saved.addAll(save(events, saved, () -> repository.save(events,
                    original ? fetchedVersion : versions.latestVersion(events.get(0)), metadata)));
        }
        return saved;
    }

    private List<List<E>> decide(List<Pair<E, V>> history, C command, Map<String, Object> metadata)
            throws HandlingException {
        List<List<E>> decisions = orchestration.computeNewEventsByCommand(
                EventSourcingLockingAggregate.unversioned(history), command,
                followUp -> fetchEvents(followUp, metadata));
        logger.debug("Command {} decided {}", command, decisions);
        return decisions;
    }

    private List<E> fetchEvents(C command, Map<String, Object> metadata) throws HandlingException {
        List<Pair<E, V>> history = fetch(command, () -> metadata == null
                ? repository.fetchEvents(command) : repository.fetchEvents(command, metadata));
        return EventSourcingLockingAggregate.unversioned(history);
    }
}
