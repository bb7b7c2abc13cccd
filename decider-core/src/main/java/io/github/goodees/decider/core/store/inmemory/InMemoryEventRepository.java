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

import io.github.goodees.decider.core.store.EventRepository;
import io.github.goodees.decider.core.store.RepositoryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Append-only event repository kept in memory. Commands and events are assigned to streams by the given functions.
 *
 * @param <C> command type
 * @param <E> event type
 */
public class InMemoryEventRepository<C, E> implements EventRepository<C, E> {
    private final ConcurrentMap<String, List<E>> storage = new ConcurrentHashMap<>();
    private final Function<? super C, String> commandStream;
    private final Function<? super E, String> eventStream;

    public InMemoryEventRepository(Function<? super C, String> commandStream, Function<? super E, String> eventStream) {
        this.commandStream = Objects.requireNonNull(commandStream, "Command stream function must be specified");
        this.eventStream = Objects.requireNonNull(eventStream, "Event stream function must be specified");
    }

    private List<E> streamLog(String streamId) {
        return storage.computeIfAbsent(streamId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public List<E> fetchEvents(C command) throws RepositoryException {
        return readStream(commandStream.apply(command));
    }

    @Override
    public E save(E event) throws RepositoryException {
        streamLog(eventStream.apply(event)).add(event);
        return event;
    }

    /**
     * Copy of all events of a stream.
     * @param streamId the stream
     * @return events in order of appending
     */
    public List<E> readStream(String streamId) {
        List<E> events = streamLog(streamId);
        //ad SynchronizedList - It is imperative that the user manually synchronize on the returned list when iterating over it.
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }
}
