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
import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.Result;
import io.github.goodees.decider.core.dispatch.PartitionHandler;
import io.github.goodees.decider.core.store.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Common entry points of all handlers. Subclasses implement {@link #handle(Object)}, which reports every failure
 * as {@link HandlingException}; the other entry points are derived from it:
 * <ul>
 *     <li>{@link #tryHandle(Object)} captures the failure into a {@link Result}</li>
 *     <li>{@link #tryHandleAll(Stream)} handles a stream of inputs, producing one result per input</li>
 *     <li>{@link #handleAsync(Object, Executor)} runs the handling on an executor</li>
 * </ul>
 * Handlers can be passed directly to {@link io.github.goodees.decider.core.dispatch.PartitionedDispatcher}.
 *
 * @param <I> input type
 * @param <O> output type
 */
public abstract class AbstractHandler<I, O> implements PartitionHandler<I, O> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * Handle single input.
     * @param input the input
     * @return outputs stored or published
     * @throws HandlingException when any step fails
     */
    @Override
    public abstract O handle(I input) throws HandlingException;

    public Result<O> tryHandle(I input) {
        try {
            return Result.success(handle(input));
        } catch (HandlingException e) {
            logger.warn("Handling of {} failed at {}", input, e.getFault(), e);
            return Result.failure(e);
        }
    }

    /**
     * Handle inputs one by one, in order of the stream. Failure of one input does not stop handling of the following
     * ones. When the source stream itself fails, one {@link HandlingException.Fault#STREAM} failure is emitted and
     * the resulting stream ends.
     * @param inputs inputs to handle
     * @return lazy stream of results, closing it closes the inputs
     */
    public Stream<Result<O>> tryHandleAll(Stream<? extends I> inputs) {
        return Result.stream(inputs, this::tryHandle);
    }

    public CompletableFuture<O> handleAsync(I input, Executor executor) {
        CompletableFuture<O> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(handle(input));
            } catch (HandlingException | RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Call to a repository.
     * @param <T> returned type
     */
    @FunctionalInterface
    protected interface RepositoryCall<T> {
        T call() throws RepositoryException;
    }

    protected <T> T fetch(Object input, RepositoryCall<T> call) throws HandlingException {
        try {
            T result = call.call();
            logger.debug("Fetched for {}: {}", input, result);
            return result;
        } catch (RepositoryException | RuntimeException e) {
            throw HandlingException.fetchFailed(input, e);
        }
    }

    /**
     * Fetch from a locking repository. A missing pair is a fetch failure, absent state is expected as a pair of
     * {@code null} values.
     */
    protected <T, V> Pair<T, V> fetchVersioned(Object input, RepositoryCall<Pair<T, V>> call) throws HandlingException {
        Pair<T, V> result = fetch(input, call);
        if (result == null) {
            throw HandlingException.fetchFailed(input,
                    new IllegalStateException("Repository returned no versioned state for " + input));
        }
        return result;
    }

    protected <T> T save(Object artifact, List<?> committed, RepositoryCall<T> call) throws HandlingException {
        try {
            T result = call.call();
            logger.debug("Saved {}", result);
            return result;
        } catch (RepositoryException | RuntimeException e) {
            throw HandlingException.saveFailed(artifact, committed, e);
        }
    }
}
