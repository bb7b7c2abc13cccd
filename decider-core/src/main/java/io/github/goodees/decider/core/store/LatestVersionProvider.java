package io.github.goodees.decider.core.store;

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

/**
 * Provides the version of the stream an event belongs to at the time it is saved.
 *
 * @param <E> event type
 * @param <V> version type
 */
@FunctionalInterface
public interface LatestVersionProvider<E, V> {
    /**
     * Latest version of the event's stream.
     * @param event the event to be saved
     * @return latest version, or {@code null} if stream is empty
     * @throws RepositoryException when the version could not be read
     */
    V latestVersion(E event) throws RepositoryException;
}
