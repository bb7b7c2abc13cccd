package io.github.goodees.decider.core.store.inmemory;

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
import io.github.goodees.decider.core.store.EventLockingRepository;
import io.github.goodees.decider.core.store.LatestVersionProvider;
import io.github.goodees.decider.core.store.RepositoryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Event repository kept in memory, versioning every stream by the number of its events. Saving with a version that
 * is not the latest version of the stream fails with optimistic lock exception.
 *
 * @param <C> command type
 * @param <E> event type
 */
public class InMemoryEventLockingRepository<C, E> implements EventLockingRepository<C, E, Long> {
    private final ConcurrentMap<String, List<Pair<E, Long>>> storage = new ConcurrentHashMap<>();
    private final Function<? super C, String> commandStream;
    private final Function<? super E, String> eventStream;

    public InMemoryEventLockingRepository(Function<? super C, String> commandStream,
                                          Function<? super E, String> eventStream) {
        this.commandStream = Objects.requireNonNull(commandStream, "Command stream function must be specified");
        this.eventStream = Objects.requireNonNull(eventStream, "Event stream function must be specified");
    }

    private List<Pair<E, Long>> streamLog(String streamId) {
        return storage.computeIfAbsent(streamId, (i) -> new ArrayList<>());
    }

    /**
     * Latest version of a stream.
     * @param streamId the stream
     * @return version of last event, {@code null} for empty stream
     */
    public Long lastVersionOf(String streamId) {
        List<Pair<E, Long>> log = streamLog(streamId);
        synchronized (log) {
            return log.isEmpty() ? null : log.get(log.size() - 1).getSecond();
        }
    }

    @Override
    public List<Pair<E, Long>> fetchEvents(C command) throws RepositoryException {
        List<Pair<E, Long>> log = streamLog(commandStream.apply(command));
        synchronized (log) {
            return new ArrayList<>(log);
        }
    }

    @Override
    public LatestVersionProvider<E, Long> getLatestVersionProvider() {
        return event -> lastVersionOf(eventStream.apply(event));
    }

    @Override
    public List<Pair<E, Long>> save(List<E> events, Long latestVersion) throws RepositoryException {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        String streamId = eventStream.apply(events.get(0));
        for (E event : events) {
            String eventStreamId = eventStream.apply(event);
            if (!streamId.equals(eventStreamId)) {
                throw RepositoryException.multipleStreams(streamId, eventStreamId);
            }
        }
        List<Pair<E, Long>> log = streamLog(streamId);
        synchronized (log) {
            Long lastVersion = log.isEmpty() ? null : log.get(log.size() - 1).getSecond();
            if (!Objects.equals(lastVersion, latestVersion)) {
                throw RepositoryException.optimisticLock(streamId, latestVersion, lastVersion);
            }
            long version = lastVersion == null ? 0 : lastVersion;
            List<Pair<E, Long>> saved = new ArrayList<>(events.size());
            for (E event : events) {
                saved.add(Pair.of(event, ++version));
            }
            log.addAll(saved);
            return saved;
        }
    }
}
