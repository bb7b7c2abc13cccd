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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.goodees.decider.core.Decider;
import io.github.goodees.decider.core.HandlingException;
import io.github.goodees.decider.core.Saga;
import io.github.goodees.decider.core.example.EvenNumberCommand;
import io.github.goodees.decider.core.example.EvenNumberEvent;
import io.github.goodees.decider.core.example.NumberState;
import io.github.goodees.decider.core.handler.EventSourcingAggregate;
import io.github.goodees.decider.core.handler.EventSourcingOrchestratingAggregate;
import io.github.goodees.decider.core.store.inmemory.InMemoryEventRepository;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.goodees.decider.core.example.Numbers.addEven;
import static io.github.goodees.decider.core.example.Numbers.evenNumberDecider;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;

public class PartitionedDispatcherTest {
    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private final List<String> expectedErrors = Collections.synchronizedList(new ArrayList<>());

    @Rule
    public ErrorCollector collector = new ErrorCollector();

    @Before
    public void setUp() {
        executor = Executors.newFixedThreadPool(4);
        scheduler = Executors.newScheduledThreadPool(1);
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        // any errors logged by dispatcher are actually assertion errors
        AppenderBase<ILoggingEvent> errors = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel() == Level.ERROR) {
                    collector.addError(new AssertionError(event.getFormattedMessage()));
                }
            }
        };
        errors.start();
        ctx.getLogger(PartitionedDispatcher.class.getName() + ".Numbers").addAppender(errors);
        AppenderBase<ILoggingEvent> failures = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel() == Level.ERROR) {
                    expectedErrors.add(event.getFormattedMessage());
                }
            }
        };
        failures.start();
        ctx.getLogger(PartitionedDispatcher.class.getName() + ".Failing").addAppender(failures);
    }

    @After
    public void tearDown() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(PartitionedDispatcher.class.getName() + ".Numbers").detachAndStopAllAppenders();
        ctx.getLogger(PartitionedDispatcher.class.getName() + ".Failing").detachAndStopAllAppenders();
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private <I, O> PartitionedDispatcher<I, O> dispatcher(String name, int workers, int queueCapacity,
                                                         SimpleDispatcherConfiguration.RetryStrategy retries,
                                                         PartitionHandler<I, O> handler) {
        return new PartitionedDispatcher<>(new SimpleDispatcherConfiguration(name, workers, queueCapacity, executor,
                scheduler, retries), handler);
    }

    @Test
    public void partition_is_absolute_remainder() {
        assertThat(PartitionedDispatcher.partition(7, 3), is(1));
        assertThat(PartitionedDispatcher.partition(-7, 3), is(1));
        assertThat(PartitionedDispatcher.partition(Integer.MIN_VALUE, 3), is(2));
        assertThat(PartitionedDispatcher.partition(Integer.MIN_VALUE, 1), is(0));
        assertThat(PartitionedDispatcher.partition(Integer.MAX_VALUE, 4), is(3));
    }

    @Test
    public void missing_workers_mean_single_partition() {
        assertThat(PartitionedDispatcher.partition(5, 0), is(0));
        assertThat(PartitionedDispatcher.partition(-5, -2), is(0));
    }

    @Test
    public void inputs_of_single_key_are_handled_in_order() throws Exception {
        Map<Integer, List<Integer>> handled = new ConcurrentHashMap<>();
        Random random = new Random();
        // input is key * 1000 + sequence number
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Numbers", 3, 4,
                SimpleDispatcherConfiguration.noRetries(), input -> {
                    if (random.nextInt(10) == 0) {
                        LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
                    }
                    handled.computeIfAbsent(input / 1000, k -> Collections.synchronizedList(new ArrayList<>()))
                            .add(input % 1000);
                    return input;
                });
        List<Integer> inputs = IntStream.range(0, 500)
                .mapToObj(i -> (i % 7) * 1000 + i / 7)
                .collect(Collectors.toList());

        List<Integer> outputs = cut.dispatchAndCollect(inputs.stream(), i -> i / 1000).get(10, TimeUnit.SECONDS);

        assertThat(outputs, containsInAnyOrder(inputs.toArray(new Integer[0])));
        for (Map.Entry<Integer, List<Integer>> key : handled.entrySet()) {
            List<Integer> sorted = new ArrayList<>(key.getValue());
            Collections.sort(sorted);
            assertThat("Order of key " + key.getKey(), key.getValue(), equalTo(sorted));
        }
    }

    @Test
    public void aggregate_streams_evolve_in_command_order() throws Exception {
        InMemoryEventRepository<EvenNumberCommand, EvenNumberEvent> repository =
                new InMemoryEventRepository<>(EvenNumberCommand::description, EvenNumberEvent::description);
        EventSourcingAggregate<EvenNumberCommand, NumberState, EvenNumberEvent> aggregate =
                new EventSourcingAggregate<>(evenNumberDecider(), repository);
        PartitionedDispatcher<EvenNumberCommand, List<EvenNumberEvent>> cut = new PartitionedDispatcher<>(
                new SimpleDispatcherConfiguration("Numbers", 4, executor, scheduler), aggregate);

        Stream<EvenNumberCommand> commands = IntStream.range(0, 100).mapToObj(i -> addEven("stream" + i % 5, 2));
        cut.dispatch(commands, c -> c.description().hashCode(), events -> { }).get(10, TimeUnit.SECONDS);

        for (int s = 0; s < 5; s++) {
            List<Integer> values = repository.readStream("stream" + s).stream()
                    .map(EvenNumberEvent::value)
                    .collect(Collectors.toList());
            List<Integer> expected = IntStream.rangeClosed(1, 20).mapToObj(i -> i * 2).collect(Collectors.toList());
            assertThat(values, equalTo(expected));
        }
    }

    @Test
    public void empty_source_completes_immediately() throws Exception {
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Numbers", 2, 1,
                SimpleDispatcherConfiguration.noRetries(), input -> input);
        assertThat(cut.dispatchAndCollect(Stream.<Integer>empty(), i -> i).get(1, TimeUnit.SECONDS),
                equalTo(Collections.<Integer>emptyList()));
    }

    @Test
    public void routing_waits_for_full_queue() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Numbers", 1, 1,
                SimpleDispatcherConfiguration.noRetries(), input -> {
                    started.incrementAndGet();
                    release.await();
                    return input;
                });
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<CompletableFuture<List<Integer>>> routed = CompletableFuture.supplyAsync(
                    () -> cut.dispatchAndCollect(Stream.of(1, 2, 3), i -> 0), caller);
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(100));
            assertThat("routing returned while queue was full", routed.isDone(), is(false));
            assertThat(started.get(), lessThanOrEqualTo(1));

            release.countDown();
            assertThat(routed.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS), contains(1, 2, 3));
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    public void failed_input_is_retried_before_next_one() throws Exception {
        Map<Integer, AtomicInteger> attempts = new ConcurrentHashMap<>();
        List<Integer> handled = Collections.synchronizedList(new ArrayList<>());
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Numbers", 1, 8,
                (input, t, completed) -> completed < 3 ? SimpleDispatcherConfiguration.RetryStrategy.RETRY_NOW
                        : SimpleDispatcherConfiguration.RetryStrategy.DO_NOT_RETRY,
                input -> {
                    if (attempts.computeIfAbsent(input, k -> new AtomicInteger()).incrementAndGet() < 3) {
                        throw new IllegalStateException("Attempt failed");
                    }
                    handled.add(input);
                    return input;
                });
        assertThat(cut.dispatchAndCollect(Stream.of(1, 2, 3), i -> 0).get(5, TimeUnit.SECONDS), contains(1, 2, 3));
        assertThat(handled, contains(1, 2, 3));
        assertThat(attempts.get(2).get(), is(3));
    }

    @Test
    public void delayed_retry_is_scheduled() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Numbers", 2, 8,
                SimpleDispatcherConfiguration.fixedRetries(3, 20, TimeUnit.MILLISECONDS), input -> {
                    if (input == 2 && attempts.incrementAndGet() == 1) {
                        throw new IllegalStateException("First attempt fails");
                    }
                    return input;
                });
        long start = System.nanoTime();
        // 2 and 4 fall into different partitions
        assertThat(cut.dispatchAndCollect(Stream.of(2, 4), i -> i / 2).get(5, TimeUnit.SECONDS),
                containsInAnyOrder(2, 4));
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 20, is(true));
    }

    @Test
    public void terminal_failure_aborts_the_dispatch() throws Exception {
        HandlingException rejection = HandlingException.decisionFailed(2, new IllegalArgumentException("No twos"));
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Failing", 1, 16,
                SimpleDispatcherConfiguration.noRetries(), input -> {
                    if (input == 2) {
                        throw rejection;
                    }
                    return input;
                });
        List<Integer> outputs = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> result = cut.dispatch(Stream.of(1, 2, 3, 4, 5), i -> 0, outputs::add);
        try {
            result.get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), sameInstance(rejection));
        }
        // inputs queued behind the failed one are discarded
        assertThat(outputs, contains(1));
        assertThat(expectedErrors, hasItem(startsWith("Input 2 failed after 1 attempts")));
    }

    @Test
    public void error_of_handler_aborts_the_dispatch() throws Exception {
        Error broken = new Error("Handler broke");
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Failing", 1, 16,
                SimpleDispatcherConfiguration.fixedRetries(3, 1, TimeUnit.MILLISECONDS), input -> {
                    if (input == 2) {
                        throw broken;
                    }
                    return input;
                });
        List<Integer> outputs = Collections.synchronizedList(new ArrayList<>());
        try {
            cut.dispatch(Stream.of(1, 2, 3, 4), i -> 0, outputs::add).get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), sameInstance(broken));
        }
        assertThat(outputs, contains(1));
        assertThat(expectedErrors, hasItem(startsWith("Input 2 failed after 1 attempts")));
    }

    @Test
    public void endless_cascade_fails_the_dispatch() throws Exception {
        // every number is followed by the next one, without end
        Decider<Integer, Integer, Integer> counter = new Decider<>(
                (command, count) -> Collections.singletonList(command), (count, event) -> event, 0);
        Saga<Integer, Integer> next = new Saga<>(event -> Collections.singletonList(event + 1));
        EventSourcingOrchestratingAggregate<Integer, Integer, Integer> aggregate =
                new EventSourcingOrchestratingAggregate<>(counter, next,
                        new InMemoryEventRepository<Integer, Integer>(c -> "counter", e -> "counter"));
        PartitionedDispatcher<Integer, List<Integer>> cut = new PartitionedDispatcher<>(
                new SimpleDispatcherConfiguration("Failing", 2, executor, scheduler), aggregate);
        try {
            cut.dispatchAndCollect(Stream.of(1, 2, 3), i -> i).get(10, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(StackOverflowError.class));
        }
    }

    @Test
    public void failing_retry_strategy_aborts_the_dispatch() throws Exception {
        IllegalStateException strategyFailure = new IllegalStateException("No strategy");
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Failing", 2, 16,
                (input, t, completed) -> {
                    throw strategyFailure;
                }, input -> {
                    throw new IllegalArgumentException("Rejected " + input);
                });
        try {
            cut.dispatchAndCollect(Stream.of(1), i -> i).get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), sameInstance(strategyFailure));
        }
    }

    @Test
    public void failing_output_aborts_the_dispatch() throws Exception {
        IllegalStateException outputFailure = new IllegalStateException("Output closed");
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Failing", 1, 16,
                SimpleDispatcherConfiguration.noRetries(), input -> input);
        try {
            cut.dispatch(Stream.of(1, 2), i -> 0, output -> {
                throw outputFailure;
            }).get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), sameInstance(outputFailure));
        }
    }

    @Test
    public void failing_source_aborts_the_dispatch() throws Exception {
        PartitionedDispatcher<Integer, Integer> cut = dispatcher("Failing", 2, 16,
                SimpleDispatcherConfiguration.noRetries(), input -> input);
        Stream<Integer> source = Stream.of(1, 2, 3).map(i -> {
            if (i == 3) {
                throw new IllegalStateException("Source broke");
            }
            return i;
        });
        try {
            cut.dispatchAndCollect(source, i -> i).get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(IllegalStateException.class));
        } catch (TimeoutException e) {
            fail("Dispatch did not complete");
        }
        assertThat(expectedErrors, hasItem(startsWith("Source of inputs failed after 2 inputs")));
    }
}
