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
import io.github.goodees.decider.core.Result;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class AbstractHandlerTest {
    /**
     * Halves even numbers, refuses odd ones.
     */
    private final AbstractHandler<Integer, Integer> halving = new AbstractHandler<Integer, Integer>() {
        @Override
        public Integer handle(Integer input) throws HandlingException {
            if (input % 2 != 0) {
                throw HandlingException.decisionFailed(input, new IllegalArgumentException("Odd number"));
            }
            return input / 2;
        }
    };

    private static String describe(Result<Integer> result) {
        return result.<String>fold(String::valueOf, e -> e.getFault() + ":" + e.getInput());
    }

    @Test
    public void failure_of_single_input_does_not_stop_the_stream() {
        List<String> results = halving.tryHandleAll(Stream.of(2, 3, 4))
                .map(AbstractHandlerTest::describe)
                .collect(Collectors.toList());
        assertThat(results, contains("1", "DECISION:3", "2"));
    }

    @Test
    public void failing_source_ends_the_stream_with_stream_fault() {
        Stream<Integer> failing = Stream.of(2, 4, 6, 8).map(i -> {
            if (i == 6) {
                throw new IllegalStateException("Source broke");
            }
            return i;
        });
        List<String> results = halving.tryHandleAll(failing)
                .map(AbstractHandlerTest::describe)
                .collect(Collectors.toList());
        assertThat(results, contains("1", "2", "STREAM:null"));
    }

    @Test
    public void closing_results_closes_inputs() {
        AtomicBoolean closed = new AtomicBoolean();
        try (Stream<Result<Integer>> results = halving.tryHandleAll(Stream.of(2).onClose(() -> closed.set(true)))) {
            assertThat(results.count(), is(1L));
        }
        assertThat(closed.get(), is(true));
    }

    @Test
    public void async_handling_completes_the_future() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            assertThat(halving.handleAsync(10, executor).get(1, TimeUnit.SECONDS), is(5));
            CompletableFuture<Integer> failed = halving.handleAsync(5, executor);
            try {
                failed.get(1, TimeUnit.SECONDS);
                fail("Should have failed");
            } catch (ExecutionException e) {
                assertThat(e.getCause(), instanceOf(HandlingException.class));
            } catch (TimeoutException e) {
                fail("Handling did not complete");
            }
        } finally {
            executor.shutdown();
        }
    }
}
