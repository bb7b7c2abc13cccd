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

import io.github.goodees.decider.core.HandlingException;

import java.util.List;

/**
 * Supplies the event history of the stream a command is targeting. Used by orchestration to read the history of
 * follow-up commands lazily.
 *
 * @param <C> command type
 * @param <E> event type
 */
@FunctionalInterface
public interface EventFetcher<C, E> {

    List<E> fetchEvents(C command) throws HandlingException;
}
