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

import io.github.goodees.decider.core.HandlingException;
import io.github.goodees.decider.core.Saga;
import io.github.goodees.decider.core.store.ActionPublisher;
import io.github.goodees.decider.core.store.PublishException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reacts to an action result and publishes the resulting actions in order. When publishing of an action fails, the
 * remaining actions are not published, and the exception lists the ones that were.
 *
 * @param <AR> action result type
 * @param <A> action type
 */
public class SagaManager<AR, A> extends AbstractHandler<AR, List<A>> {
    private final Saga<AR, A> saga;
    private final ActionPublisher<A> publisher;

    public SagaManager(Saga<AR, A> saga, ActionPublisher<A> publisher) {
        this.saga = Objects.requireNonNull(saga, "Saga must be specified");
        this.publisher = Objects.requireNonNull(publisher, "Publisher must be specified");
    }

    @Override
    public List<A> handle(AR actionResult) throws HandlingException {
        List<A> actions;
        try {
            actions = saga.react(actionResult);
        } catch (RuntimeException e) {
            throw HandlingException.decisionFailed(actionResult, e);
        }
        logger.debug("{} caused actions {}", actionResult, actions);
        List<A> published = new ArrayList<>(actions.size());
        for (A action : actions) {
            try {
                published.add(publisher.publish(action));
            } catch (PublishException | RuntimeException e) {
                throw HandlingException.publishFailed(action, published, e);
            }
        }
        return published;
    }
}
