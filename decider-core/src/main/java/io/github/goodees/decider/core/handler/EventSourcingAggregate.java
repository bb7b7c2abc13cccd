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
import io.github.goodees.decider.core.store.EventRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Event-sourced aggregate. Handling of a command consists of following steps:
 * <ol>
 *     <li>The history of the command's stream is fetched from the repository</li>
 *     <li>The history is folded into current state, and the command is decided against it</li>
 *     <li>The new events are saved one by one, in order of decision</li>
 * </ol>
 * When save of an event fails, the exception lists the events that have been saved before.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class EventSourcingAggregate<C, S, E> extends AbstractHandler<C, List<E>> {
    protected final EventComputation<C, S, E> computation;
    protected final EventRepository<C, E> repository;

    public EventSourcingAggregate(Decider<C, S, E> decider, EventRepository<C, E> repository) {
        this(new EventComputation<>(decider), repository);
    }

    public EventSourcingAggregate(EventComputation<C, S, E> computation, EventRepository<C, E> repository) {
        this.computation = Objects.requireNonNull(computation, "Computation must be specified");
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
    }

    @Override
    public List<E> handle(C command) throws HandlingException {
        List<E> events = decide(command, null);
        List<E> saved = new ArrayList<>(events.size());
        for (E event : events) {
            saved.add(save(event, saved, () -> repository.save(event)));
        }
        return saved;
    }

    /**
     * Handle the command, passing metadata to the repository.
     * @param command the command
     * @param metadata metadata of the command, passed unmodified to
     * {@link EventRepository#fetchEvents(Object, Map)} and {@link EventRepository#save(List, Map)}
     * @return saved events paired with the metadata returned by the repository
     * @throws HandlingException when any step fails
     */
    public List<Pair<E, Map<String, Object>>> handle(C command, Map<String, Object> metadata)
            throws HandlingException {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        List<E> events = decide(command, metadata);
        List<Pair<E, Map<String, Object>>> saved = new ArrayList<>(events.size());
        for (E event : events) {
            saved.addAll(save(event, saved, () -> repository.save(Collections.singletonList(event), metadata)));
        }
        return saved;
    }

    private List<E> decide(C command, Map<String, Object> metadata) throws HandlingException {
        List<E> history = fetchEvents(command, metadata);
        List<E> events = computeNewEvents(history, command, metadata);
        logger.debug("Command {} on history of {} events decided {}", command, history.size(), events);
        return events;
    }

    /**
     * Fetch history of the command's stream.
     * @param command the command
     * @param metadata metadata of the invocation, {@code null} when handling without metadata
     * @return the history
     * @throws HandlingException with {@link HandlingException.Fault#FETCH}
     */
    protected List<E> fetchEvents(C command, Map<String, Object> metadata) throws HandlingException {
        return fetch(command, () -> metadata == null
                ? repository.fetchEvents(command) : repository.fetchEvents(command, metadata));
    }

    protected List<E> computeNewEvents(List<E> history, C command, Map<String, Object> metadata)
            throws HandlingException {
        return computation.computeNewEvents(history, command);
    }
}
