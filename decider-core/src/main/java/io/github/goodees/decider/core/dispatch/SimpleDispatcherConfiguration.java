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

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * General Dispatcher configuration implementation, as alternative to defining own subclass. Its dependencies are
 * passed to constructor, and {@linkplain RetryStrategy retries} are delegated to a strategy represented by functional
 * interface.
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    private final String name;
    private final int workerCount;
    private final int queueCapacity;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final RetryStrategy retryStrategy;

    /**
     * Create dispatcher configuration.
     * @param name The name of the dispatcher
     * @param workerCount number of partitions
     * @param queueCapacity capacity of queue of every worker
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     * @param retryStrategy retry strategy to delegate retryDelay to
     */
    public SimpleDispatcherConfiguration(String name, int workerCount, int queueCapacity,
                                         ExecutorService executorService, ScheduledExecutorService schedulerService,
                                         RetryStrategy retryStrategy) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive, was " + queueCapacity);
        }
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.workerCount = workerCount;
        this.queueCapacity = queueCapacity;
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
    }

    public SimpleDispatcherConfiguration(String name, int workerCount, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService, RetryStrategy retryStrategy) {
        this(name, workerCount, DEFAULT_QUEUE_CAPACITY, executorService, schedulerService, retryStrategy);
    }

    /**
     * Create dispatcher configuration without retries.
     * @param name the name of the dispatcher
     * @param workerCount number of partitions
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     */
    public SimpleDispatcherConfiguration(String name, int workerCount, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService) {
        this(name, workerCount, executorService, schedulerService, noRetries());
    }

    @Override
    public String dispatcherName() {
        return this.name;
    }

    @Override
    public int workerCount() {
        return workerCount;
    }

    @Override
    public int queueCapacity() {
        return queueCapacity;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public long retryDelay(Object input, Throwable t, int completedAttempts) {
        return retryStrategy.retryDelay(input, t, completedAttempts);
    }

    /**
     * Strategy for retrying an input
     * @see DispatcherConfiguration#retryDelay(Object, Throwable, int)
     */
    @FunctionalInterface
    public interface RetryStrategy {
        long DO_NOT_RETRY = -1;
        long RETRY_NOW = 0;
        long retryDelay(Object input, Throwable t, int completedAttempts);
    }

    static final RetryStrategy NO_RETRIES = (input, t, attempts) -> RetryStrategy.DO_NOT_RETRY;

    /**
     * Retry strategy that doesn't retry any failed input.
     * @return a retry strategy
     */
    public static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Create retry strategy that allows fix number of attempts before failing, with delay of 100 milliseconds.
     * @param attempts number of attempts to allow
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts) {
        return new FixedRepeat(attempts, 100);
    }

    /**
     * Create retry strategy that allows fix number of attempts with defined retry delay.
     * @param attempts number of attempt to allow
     * @param delay delay before retrying the input
     * @param unit unit of delay
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        return new FixedRepeat(attempts, unit.toMillis(delay));
    }

    static class FixedRepeat implements RetryStrategy {
        final int attempts;
        final long delay;

        FixedRepeat(int attempts, long delay) {
            this.attempts = attempts;
            this.delay = delay;
        }

        @Override
        public long retryDelay(Object input, Throwable t, int completedAttempts) {
            return completedAttempts < attempts ? delay : DO_NOT_RETRY;
        }
    }
}
