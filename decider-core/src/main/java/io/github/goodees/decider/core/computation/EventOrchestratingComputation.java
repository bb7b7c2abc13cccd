package io.github.goodees.decider.core.computation;

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
import io.github.goodees.decider.core.Saga;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Event computation that lets a saga react to the decided events, and decides the resulting follow-up commands
 * within the same unit of work.
 * <p>Every event decided for a command is passed to the saga. Each follow-up command is decided against its own
 * history, as supplied by the {@link EventFetcher}, followed by all events produced so far. Its events, including
 * those of its own follow-up commands, are appended to the result. The result therefore starts with the events of
 * the original command, followed by cascades in the order of their triggering events.</p>
 * <p>The cascade ends when no follow-up command is issued. A saga that keeps reacting to its own output never
 * terminates, unless a maximum cascade depth is set. Exceeding it fails the command at that depth with
 * {@link HandlingException.Fault#DECISION}.</p>
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class EventOrchestratingComputation<C, S, E> extends EventComputation<C, S, E> {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    private final Saga<E, C> saga;
    private final int maxCascadeDepth;

    public EventOrchestratingComputation(Decider<C, S, E> decider, Saga<E, C> saga) {
        this(decider, saga, UNLIMITED);
    }

    /**
     * Create orchestrating computation with limited depth of cascade.
     * @param decider the decider
     * @param saga saga reacting to decided events
     * @param maxCascadeDepth number of nested follow-up levels allowed. {@code 0} allows no follow-up commands
     */
    public EventOrchestratingComputation(Decider<C, S, E> decider, Saga<E, C> saga, int maxCascadeDepth) {
        super(decider);
        this.saga = Objects.requireNonNull(saga, "Saga must be specified");
        if (maxCascadeDepth < 0) {
            throw new IllegalArgumentException("Maximum cascade depth must not be negative");
        }
        this.maxCascadeDepth = maxCascadeDepth;
    }

    public Saga<E, C> getSaga() {
        return saga;
    }

    /**
     * Compute events of the command and of all follow-up commands.
     * @param history all events of the command's stream
     * @param command command to decide
     * @param fetcher supplies history for follow-up commands
     * @return events of the whole cascade
     * @throws HandlingException when a fetch, decision or reaction in the cascade fails
     */
    public List<E> computeNewEvents(List<E> history, C command, EventFetcher<C, E> fetcher)
            throws HandlingException {
        return cascade(history, command, fetcher, 0, new ArrayList<>());
    }

    /**
     * Compute events of the cascade grouped by the command that decided them. Commands deciding no events are left
     * out, therefore the first group, if any, holds the events of the original command.
     * @param history all events of the command's stream
     * @param command command to decide
     * @param fetcher supplies history for follow-up commands
     * @return non-empty lists of events, in the order of {@link #computeNewEvents(List, Object, EventFetcher)}
     * @throws HandlingException when a fetch, decision or reaction in the cascade fails
     */
    public List<List<E>> computeNewEventsByCommand(List<E> history, C command, EventFetcher<C, E> fetcher)
            throws HandlingException {
        List<List<E>> decisions = new ArrayList<>();
        cascade(history, command, fetcher, 0, decisions);
        return decisions;
    }

    private List<E> cascade(List<E> history, C command, EventFetcher<C, E> fetcher, int depth,
                            List<List<E>> decisions) throws HandlingException {
        if (depth > maxCascadeDepth) {
            throw HandlingException.decisionFailed(command,
                new IllegalStateException("Cascade exceeded maximum depth of " + maxCascadeDepth));
        }
        List<E> decided = computeNewEvents(history, command);
        if (!decided.isEmpty()) {
            decisions.add(decided);
        }
        List<E> resultingEvents = new ArrayList<>(decided);
        for (E event : decided) {
            for (C followUp : react(event)) {
                List<E> followUpHistory = new ArrayList<>(fetcher.fetchEvents(followUp));
                followUpHistory.addAll(resultingEvents);
                resultingEvents.addAll(cascade(followUpHistory, followUp, fetcher, depth + 1, decisions));
            }
        }
        return resultingEvents;
    }

    private List<C> react(E event) throws HandlingException {
        try {
            return saga.react(event);
        } catch (RuntimeException e) {
            throw HandlingException.decisionFailed(event, e);
        }
    }
}
