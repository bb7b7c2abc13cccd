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

import io.github.goodees.decider.core.Decider;
import io.github.goodees.decider.core.Either;
import io.github.goodees.decider.core.HandlingException;
import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.Saga;
import io.github.goodees.decider.core.example.EvenNumberCommand;
import io.github.goodees.decider.core.example.EvenNumberEvent;
import io.github.goodees.decider.core.example.NumberState;
import io.github.goodees.decider.core.example.OddNumberCommand;
import io.github.goodees.decider.core.example.OddNumberEvent;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.goodees.decider.core.example.Numbers.addEven;
import static io.github.goodees.decider.core.example.Numbers.addOdd;
import static io.github.goodees.decider.core.example.Numbers.evenAdded;
import static io.github.goodees.decider.core.example.Numbers.numberDecider;
import static io.github.goodees.decider.core.example.Numbers.numberSaga;
import static io.github.goodees.decider.core.example.Numbers.oddAdded;
import static io.github.goodees.decider.core.example.Numbers.streamOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class EventOrchestratingComputationTest {
    private final Map<String, List<Either<EvenNumberEvent, OddNumberEvent>>> streams = new HashMap<>();

    private List<Either<EvenNumberEvent, OddNumberEvent>> fetch(Either<EvenNumberCommand, OddNumberCommand> command) {
        return streams.getOrDefault(streamOf(command), Collections.emptyList());
    }

    private EventOrchestratingComputation<Either<EvenNumberCommand, OddNumberCommand>, Pair<NumberState, NumberState>,
            Either<EvenNumberEvent, OddNumberEvent>> computation(int maxDepth) {
        return new EventOrchestratingComputation<>(numberDecider(), numberSaga(), maxDepth);
    }

    @Test
    public void follow_up_commands_are_decided_within_the_cascade() throws HandlingException {
        List<Either<EvenNumberEvent, OddNumberEvent>> events = computation(EventOrchestratingComputation.UNLIMITED)
                .computeNewEvents(Collections.emptyList(), Either.left(addEven("2", 2)), this::fetch);
        assertThat(events, contains(
                Either.<EvenNumberEvent, OddNumberEvent>left(evenAdded("2", 2)),
                Either.<EvenNumberEvent, OddNumberEvent>right(oddAdded("1", 1))));
    }

    @Test
    public void follow_up_command_is_decided_against_its_own_history() throws HandlingException {
        streams.put("odd", new ArrayList<>(Collections.singletonList(
                Either.<EvenNumberEvent, OddNumberEvent>right(oddAdded("5", 5)))));
        List<Either<EvenNumberEvent, OddNumberEvent>> events = computation(EventOrchestratingComputation.UNLIMITED)
                .computeNewEvents(Collections.emptyList(), Either.left(addEven("2", 2)), this::fetch);
        assertThat(events, contains(
                Either.<EvenNumberEvent, OddNumberEvent>left(evenAdded("2", 2)),
                Either.<EvenNumberEvent, OddNumberEvent>right(oddAdded("1", 6))));
    }

    @Test
    public void events_are_grouped_by_deciding_command() throws HandlingException {
        Decider<Integer, Integer, Integer> twice = new Decider<>((c, s) -> Arrays.asList(c, c), (s, e) -> s + e, 0);
        Saga<Integer, Integer> belowThree = new Saga<>(e -> e < 3
                ? Collections.singletonList(e + 1) : Collections.<Integer>emptyList());
        EventOrchestratingComputation<Integer, Integer, Integer> computation =
                new EventOrchestratingComputation<>(twice, belowThree);
        List<List<Integer>> decisions =
                computation.computeNewEventsByCommand(Collections.emptyList(), 1, c -> Collections.emptyList());
        // both events of 1 react with 2, each of those react twice with 3
        assertThat(decisions, contains(Arrays.asList(1, 1), Arrays.asList(2, 2), Arrays.asList(3, 3),
                Arrays.asList(3, 3), Arrays.asList(2, 2), Arrays.asList(3, 3), Arrays.asList(3, 3)));
        List<Integer> flattened = new ArrayList<>();
        decisions.forEach(flattened::addAll);
        assertThat(flattened, equalTo(
                computation.computeNewEvents(Collections.emptyList(), 1, c -> Collections.emptyList())));
    }

    @Test
    public void command_without_reaction_produces_only_its_events() throws HandlingException {
        List<Either<EvenNumberEvent, OddNumberEvent>> events = computation(0)
                .computeNewEvents(Collections.emptyList(), Either.right(addOdd("3", 3)), this::fetch);
        assertThat(events, contains(Either.<EvenNumberEvent, OddNumberEvent>right(oddAdded("3", 3))));
    }

    @Test
    public void failing_follow_up_is_reported_with_the_follow_up_command() {
        Saga<Either<EvenNumberEvent, OddNumberEvent>, Either<EvenNumberCommand, OddNumberCommand>> tooBig =
                new Saga<>(event -> event.isLeft()
                        ? Collections.singletonList(Either.<EvenNumberCommand, OddNumberCommand>right(addOdd("big", 2001)))
                        : Collections.<Either<EvenNumberCommand, OddNumberCommand>>emptyList());
        EventOrchestratingComputation<Either<EvenNumberCommand, OddNumberCommand>, Pair<NumberState, NumberState>,
                Either<EvenNumberEvent, OddNumberEvent>> computation =
                new EventOrchestratingComputation<>(numberDecider(), tooBig);
        try {
            computation.computeNewEvents(Collections.emptyList(), Either.left(addEven("2", 2)), this::fetch);
            fail("Should have failed");
        } catch (HandlingException e) {
            assertThat(e.getFault(), is(HandlingException.Fault.DECISION));
            assertThat(e.getInput(), equalTo(Either.<EvenNumberCommand, OddNumberCommand>right(addOdd("big", 2001))));
        }
    }

    @Test
    public void endless_cascade_stops_at_maximum_depth() {
        Decider<Integer, Integer, Integer> counter = new Decider<>((c, s) -> Collections.singletonList(c),
                (s, e) -> s + 1, 0);
        Saga<Integer, Integer> forever = new Saga<>(e -> Collections.singletonList(e + 1));
        EventOrchestratingComputation<Integer, Integer, Integer> computation =
                new EventOrchestratingComputation<>(counter, forever, 3);
        try {
            computation.computeNewEvents(Collections.emptyList(), 0, c -> Collections.emptyList());
            fail("Should have failed");
        } catch (HandlingException e) {
            assertThat(e.getFault(), is(HandlingException.Fault.DECISION));
            assertThat(e.getInput(), equalTo(4));
        }
    }

    @Test
    public void limited_cascade_within_depth_completes() throws HandlingException {
        Decider<Integer, Integer, Integer> countdown = new Decider<>((c, s) -> Collections.singletonList(c),
                (s, e) -> e, 0);
        Saga<Integer, Integer> decrement = new Saga<>(e -> e > 0
                ? Collections.singletonList(e - 1)
                : Collections.<Integer>emptyList());
        EventOrchestratingComputation<Integer, Integer, Integer> computation =
                new EventOrchestratingComputation<>(countdown, decrement, 3);
        assertThat(computation.computeNewEvents(Collections.emptyList(), 3, c -> Collections.emptyList()),
                contains(3, 2, 1, 0));
        assertThat(computation.getSaga().react(0), empty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negative_depth_is_rejected() {
        computation(-1);
    }
}
