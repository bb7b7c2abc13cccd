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
import io.github.goodees.decider.core.Saga;
import io.github.goodees.decider.core.computation.EventOrchestratingComputation;
import io.github.goodees.decider.core.store.EventRepository;

import java.util.List;
import java.util.Map;

/**
 * Event-sourced aggregate that also handles the commands its own events cause. Every follow-up command issued by the
 * saga is decided against the history of its own stream, and all resulting events are saved in order of decision.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @see EventOrchestratingComputation
 */
public class EventSourcingOrchestratingAggregate<C, S, E> extends EventSourcingAggregate<C, S, E> {
    private final EventOrchestratingComputation<C, S, E> orchestration;

    public EventSourcingOrchestratingAggregate(Decider<C, S, E> decider, Saga<E, C> saga,
                                               EventRepository<C, E> repository) {
        this(new EventOrchestratingComputation<>(decider, saga), repository);
    }

    public EventSourcingOrchestratingAggregate(EventOrchestratingComputation<C, S, E> orchestration,
                                               EventRepository<C, E> repository) {
        super(orchestration, repository);
        this.orchestration = orchestration;
    }

    @Override
    protected List<E> computeNewEvents(List<E> history, C command, Map<String, Object> metadata)
            throws HandlingException {
        return orchestration.computeNewEvents(history, command, followUp -> fetchEvents(followUp, metadata));
    }
}
