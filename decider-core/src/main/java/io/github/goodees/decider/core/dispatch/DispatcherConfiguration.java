package io.github.goodees.decider.core.dispatch;

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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dependencies and strategies for PartitionedDispatcher.
 */
public interface DispatcherConfiguration {
    int DEFAULT_QUEUE_CAPACITY = 64;

    String dispatcherName();

    /**
     * Number of partitions inputs are distributed to. Inputs of single partition are handled one at time, in order
     * of the source. Values less than {@code 1} are treated as {@code 1}.
     * @return number of workers
     */
    int workerCount();

    /**
     * Maximum number of inputs waiting for single worker. When the queue of a worker is full, routing of further
     * inputs waits until the worker completes an input.
     * @return queue capacity, at least {@code 1}
     */
    default int queueCapacity() {
        return DEFAULT_QUEUE_CAPACITY;
    }

    /**
     * The thread pool the handling of inputs should run on.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Thread pool for scheduling delayed retries. <strong>Should be different from executorService!</strong>
     * @return scheduled executor service instance
     */
    ScheduledExecutorService schedulerService();

    /**
     * Decide whether and when the input should be retried in case of failure.
     * Should return redelivery delay in milliseconds. Returning {@code 0} means to retry immediately, returning less
     * than {@code 0} means not to retry, which aborts the dispatch.
     * <p>The worker does not handle any other input until the retry completes.</p>
     * @param input the input that failed
     * @param t the throwable the handling failed with
     * @param completedAttempts number of attempts for handling that input. At least {@code 1}.
     * @return negative in order to fail the dispatch, zero to immediately retry, positive for delay in ms until next attempt
     */
    long retryDelay(Object input, Throwable t, int completedAttempts);
}
