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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.ToIntFunction;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Concurrent dispatcher of a stream of inputs. Every input is assigned to a worker by its partition key,
 * see {@link #partition(int, int)}. Inputs of single worker are handled one at time, in order of the source, while
 * different workers run concurrently on the {@linkplain DispatcherConfiguration#executorService() executor service}.
 * Workers do not occupy a thread while their queue is empty.
 * <h2>Lifecycle of a dispatch</h2>
 * <ol>
 *     <li>The inputs are routed on the calling thread. When the queue of the target worker is full, routing waits
 *     until the worker completes an input</li>
 *     <li>A failed input is retried in place according to {@link DispatcherConfiguration#retryDelay(Object, Throwable, int)}.
 *     The worker handles no other input meanwhile, so the order within the partition is kept</li>
 *     <li>When an input fails terminally, or the source fails, the dispatch is aborted. Routing stops, workers finish
 *     the input they are handling and discard the rest of their queue</li>
 *     <li>The returned future completes when all routed inputs were handled or discarded. It completes exceptionally
 *     with the first failure, if the dispatch was aborted</li>
 * </ol>
 * Outputs are passed to the output consumer one at time.
 *
 * @param <I> input type
 * @param <O> output type
 */
public class PartitionedDispatcher<I, O> {

    private final DispatcherConfiguration conf;
    private final PartitionHandler<? super I, ? extends O> handler;
    private final Logger logger;

    public PartitionedDispatcher(DispatcherConfiguration conf, PartitionHandler<? super I, ? extends O> handler) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.handler = Objects.requireNonNull(handler, "Handler must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Worker index for a partition key.
     * @param partitionKey the key, any int value
     * @param workerCount number of workers, values less than {@code 1} are treated as {@code 1}
     * @return index between {@code 0} inclusive and {@code max(workerCount, 1)} exclusive
     */
    public static int partition(int partitionKey, int workerCount) {
        return Math.abs(partitionKey % Math.max(workerCount, 1));
    }

    /**
     * Handle all inputs. Returns after all inputs were routed to workers.
     * @param inputs source of inputs
     * @param partitionKey function computing partition key of an input
     * @param output consumer of handler outputs
     * @return future completing when all inputs are handled
     */
    public CompletableFuture<Void> dispatch(Stream<? extends I> inputs, ToIntFunction<? super I> partitionKey,
                                            Consumer<? super O> output) {
        Dispatch dispatch = new Dispatch(output);
        dispatch.route(inputs.iterator(), partitionKey);
        return dispatch.completion;
    }

    public CompletableFuture<Void> dispatch(Iterable<? extends I> inputs, ToIntFunction<? super I> partitionKey,
                                            Consumer<? super O> output) {
        return dispatch(StreamSupport.stream(inputs.spliterator(), false), partitionKey, output);
    }

    /**
     * Handle all inputs and collect the outputs. Outputs of single partition are in order of their inputs.
     * @param inputs source of inputs
     * @param partitionKey function computing partition key of an input
     * @return future of all outputs
     */
    public CompletableFuture<List<O>> dispatchAndCollect(Stream<? extends I> inputs,
                                                         ToIntFunction<? super I> partitionKey) {
        List<O> outputs = new ArrayList<>();
        return dispatch(inputs, partitionKey, outputs::add).thenApply(v -> outputs);
    }

    /**
     * State of single call to dispatch.
     */
    class Dispatch {
        private final List<Worker> workers;
        private final Consumer<? super O> output;
        // routed and not yet completed inputs, plus one for the router itself
        private final AtomicInteger pending = new AtomicInteger(1);
        private final AtomicReference<Throwable> failure = new AtomicReference<>();
        private final CompletableFuture<Void> completion = new CompletableFuture<>();

        Dispatch(Consumer<? super O> output) {
            this.output = Objects.requireNonNull(output, "Output must be specified");
            int workerCount = Math.max(conf.workerCount(), 1);
            this.workers = new ArrayList<>(workerCount);
            for (int i = 0; i < workerCount; i++) {
                workers.add(new Worker(i));
            }
        }

        void route(Iterator<? extends I> inputs, ToIntFunction<? super I> partitionKey) {
            int routed = 0;
            try {
                while (failure.get() == null && inputs.hasNext()) {
                    I input = inputs.next();
                    Worker worker = workers.get(partition(partitionKey.applyAsInt(input), workers.size()));
                    worker.enqueue(input);
                    routed++;
                }
                logger.debug("Routed {} inputs to {} workers", routed, workers.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.error("Routing interrupted after {} inputs", routed, e);
                abort(e);
            } catch (RuntimeException e) {
                logger.error("Source of inputs failed after {} inputs", routed, e);
                abort(e);
            }
            completeOne();
        }

        void abort(Throwable t) {
            if (failure.compareAndSet(null, t)) {
                logger.info("Dispatch aborted, draining workers");
            } else if (failure.get() != t) {
                failure.get().addSuppressed(t);
            }
        }

        void completeOne() {
            if (pending.decrementAndGet() == 0) {
                Throwable t = failure.get();
                if (t == null) {
                    logger.debug("All inputs handled");
                    completion.complete(null);
                } else {
                    completion.completeExceptionally(t);
                }
            }
        }

        void emit(O result) {
            synchronized (output) {
                output.accept(result);
            }
        }

        /**
         * Queue of inputs of single partition. At this level we're handling the concurrency between adding new
         * input, and handling only single input at time.
         */
        class Worker implements Runnable {
            private final int index;
            private final Deque<I> queue = new ConcurrentLinkedDeque<>();
            private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
            private final Semaphore capacity = new Semaphore(conf.queueCapacity());

            Worker(int index) {
                this.index = index;
            }

            void enqueue(I input) throws InterruptedException {
                capacity.acquire();
                pending.incrementAndGet();
                queue.add(input);
                if (canStartProcessing()) {
                    conf.executorService().execute(this);
                }
            }

            private boolean canStartProcessing() {
                int queueSize = enqueuesWhileBusy.getAndIncrement();
                if (queueSize == 0) {
                    logger.debug("Will start processing queue of worker {}", index);
                    return true;
                } else {
                    return false;
                }
            }

            private boolean canStopProcessing(int observedEnqueues) {
                return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
            }

            /**
             * Process single input. Called when worker is submitted for execution and not processing, but also at
             * end of processing an input. This way even inputs that arrive during processing will be processed.
             */
            @Override
            public void run() {
                I input = nextInput();
                if (input != null) {
                    handle(input, 0);
                }
            }

            private I nextInput() {
                while (true) {
                    int enqueues = enqueuesWhileBusy.get();
                    I input = queue.poll();
                    if (input == null) {
                        // An input might have been queued between previous line and this decision point.
                        // Therefore we check if canStartProcessing was called in between, and poll the queue again.
                        if (canStopProcessing(enqueues)) {
                            logger.debug("Stopping processing of queue of worker {}", index);
                            return null;
                        }
                    } else {
                        return input;
                    }
                }
            }

            void handle(I input, int completedAttempts) {
                int attempts = completedAttempts;
                boolean retryScheduled = false;
                try {
                    while (failure.get() == null) {
                        attempts++;
                        O result;
                        try {
                            result = handler.handle(input);
                        } catch (Exception e) {
                            long delay = conf.retryDelay(input, e, attempts);
                            if (delay < 0) {
                                throw e;
                            }
                            logger.info("Retrying input {} in {} ms after {} attempts", input, delay, attempts);
                            if (delay > 0) {
                                int retriedAttempts = attempts;
                                conf.schedulerService().schedule(() -> conf.executorService()
                                        .execute(() -> handle(input, retriedAttempts)), delay, TimeUnit.MILLISECONDS);
                                retryScheduled = true;
                                return;
                            }
                            continue;
                        }
                        emit(result);
                        break;
                    }
                } catch (Throwable t) {
                    // errors of the handler, of the retry strategy and of the output are all terminal
                    logger.error("Input {} failed after {} attempts", input, attempts, t);
                    abort(t);
                } finally {
                    if (!retryScheduled) {
                        finish();
                    }
                }
            }

            private void finish() {
                capacity.release();
                conf.executorService().execute(this);
                completeOne();
            }
        }
    }
}
