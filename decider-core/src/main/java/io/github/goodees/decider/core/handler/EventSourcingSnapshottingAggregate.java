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
import io.github.goodees.decider.core.computation.EventComputation;
import io.github.goodees.decider.core.store.EventSnapshottingRepository;
import io.github.goodees.decider.core.store.StateRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Event-sourced aggregate that keeps snapshots of its state. Handling of a command:
 * <ol>
 *     <li>fetches the latest snapshot, which may be {@code null}</li>
 *     <li>fetches only the events stored after that snapshot</li>
 *     <li>decides the command against the snapshot with those events applied</li>
 *     <li>saves the new events</li>
 *     <li>saves the new state as snapshot, if {@link EventSnapshottingRepository#shouldCreateNewSnapshot(Object, Object)}
 *     agrees</li>
 * </ol>
 * Failure of deciding about or storing the snapshot is reported with all new events listed as committed.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class EventSourcingSnapshottingAggregate<C, S, E> extends AbstractHandler<C, List<E>> {
    private final EventComputation<C, S, E> computation;
    private final EventSnapshottingRepository<C, S, E> eventRepository;
    private final StateRepository<C, S> snapshotRepository;

    public EventSourcingSnapshottingAggregate(Decider<C, S, E> decider,
                                              EventSnapshottingRepository<C, S, E> eventRepository,
                                              StateRepository<C, S> snapshotRepository) {
        this.computation = new EventComputation<>(decider);
        this.eventRepository = Objects.requireNonNull(eventRepository, "Event repository must be specified");
        this.snapshotRepository = Objects.requireNonNull(snapshotRepository, "Snapshot repository must be specified");
    }

    @Override
    public List<E> handle(C command) throws HandlingException {
        S snapshot = fetch(command, () -> snapshotRepository.fetchState(command));
        List<E> history = fetch(command, () -> eventRepository.fetchEvents(command, snapshot));
        List<E> events = computation.computeNewEvents(snapshot, history, command);
        logger.debug("Command {} on snapshot {} and {} events decided {}", command, snapshot, history.size(), events);

        List<E> saved = new ArrayList<>(events.size());
        for (E event : events) {
            saved.add(save(event, saved, () -> eventRepository.save(event)));
        }

        S newState = newState(snapshot, history, events, command);
        if (shouldCreateNewSnapshot(snapshot, newState, saved)) {
            save(newState, saved, () -> snapshotRepository.save(newState));
        }
        return saved;
    }

    private boolean shouldCreateNewSnapshot(S snapshot, S newState, List<E> saved) throws HandlingException {
        try {
            return eventRepository.shouldCreateNewSnapshot(snapshot, newState);
        } catch (RuntimeException e) {
            throw HandlingException.saveFailed(newState, saved, e);
        }
    }

    private S newState(S snapshot, List<E> history, List<E> events, C command) throws HandlingException {
        Decider<C, S, E> decider = computation.getDecider();
        try {
            S current = decider.fold(snapshot == null ? decider.getInitialState() : snapshot, history);
            return decider.fold(current, events);
        } catch (RuntimeException e) {
            throw HandlingException.decisionFailed(command, e);
        }
    }
}
