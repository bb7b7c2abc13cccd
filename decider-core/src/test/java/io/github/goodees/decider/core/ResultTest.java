package io.github.goodees.decider.core;

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

import org.junit.Test;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ResultTest {

    private static Result<Integer> half(Integer i) {
        return i % 2 == 0
                ? Result.success(i / 2)
                : Result.failure(HandlingException.decisionFailed(i, new IllegalArgumentException("odd")));
    }

    @Test
    public void failure_of_one_input_does_not_stop_the_stream() {
        List<Result<Integer>> results = Result.stream(Stream.of(2, 3, 4), ResultTest::half)
                .collect(Collectors.toList());
        assertThat(results, hasSize(3));
        assertThat(results.get(0).getValue(), equalTo(1));
        assertThat(results.get(1).getError().getFault(), is(HandlingException.Fault.DECISION));
        assertThat(results.get(1).getError().getInput(), equalTo(3));
        assertThat(results.get(2).getValue(), equalTo(2));
    }

    @Test
    public void failing_source_ends_with_stream_fault() {
        Iterator<Integer> source = new Iterator<Integer>() {
            private int next = 2;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Integer next() {
                if (next > 4) {
                    throw new IllegalStateException("Source is broken");
                }
                int current = next;
                next += 2;
                return current;
            }
        };
        Stream<Integer> inputs = StreamSupport.stream(Spliterators.spliteratorUnknownSize(source, 0), false);

        List<Result<Integer>> results = Result.stream(inputs, ResultTest::half).collect(Collectors.toList());
        assertThat(results, hasSize(3));
        assertThat(results.get(1).getValue(), equalTo(2));
        HandlingException error = results.get(2).getError();
        assertThat(error.getFault(), is(HandlingException.Fault.STREAM));
        assertThat(error.getCause().getMessage(), equalTo("Source is broken"));
    }

    @Test
    public void closing_results_closes_source() {
        AtomicBoolean closed = new AtomicBoolean();
        Stream<Integer> inputs = Stream.of(2).onClose(() -> closed.set(true));
        try (Stream<Result<Integer>> results = Result.stream(inputs, ResultTest::half)) {
            assertThat(results.map(Result::getValue).collect(Collectors.toList()), contains(1));
        }
        assertTrue(closed.get());
    }

    @Test
    public void map_transforms_only_success() {
        assertThat(half(4).map(i -> i * 10).getValue(), equalTo(20));
        Result<Integer> failure = half(5).map(i -> i * 10);
        assertTrue(failure.isFailure());
        assertThat(failure.getError().getInput(), equalTo(5));
    }

    @Test
    public void or_else_throw_rethrows_the_error() {
        Result<Integer> failure = half(7);
        try {
            failure.orElseThrow();
            fail("Should have failed");
        } catch (HandlingException e) {
            assertThat(e, is(failure.getError()));
        }
        assertThat(Arrays.asList(half(2).fold(v -> "ok", e -> "ko"), half(3).fold(v -> "ok", e -> "ko")),
                contains("ok", "ko"));
    }
}
