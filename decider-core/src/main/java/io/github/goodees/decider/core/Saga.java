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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stateless reaction primitive. Maps an action result, typically an event, to zero or more actions, typically
 * commands of other aggregates. The reaction must depend on the action result only.
 *
 * @param <AR> action result type
 * @param <A> action type
 */
public class Saga<AR, A> {
    private final Function<AR, List<A>> react;

    /**
     * Create saga.
     * @param react the reaction. Returning {@code null} is treated as no reaction
     */
    public Saga(Function<AR, List<A>> react) {
        this.react = Objects.requireNonNull(react, "React function must be specified");
    }

    public List<A> react(AR actionResult) {
        List<A> actions = react.apply(actionResult);
        return actions == null ? Collections.<A>emptyList() : actions;
    }

    public <ARn> Saga<ARn, A> mapLeftOnActionResult(Function<? super ARn, ? extends AR> f) {
        return new Saga<ARn, A>(ar -> react(f.apply(ar)));
    }

    public <An> Saga<AR, An> mapOnAction(Function<? super A, ? extends An> f) {
        return new Saga<AR, An>(ar -> react(ar).stream().<An>map(f).collect(Collectors.<An>toList()));
    }

    /**
     * Combine with another saga into one reacting to the union of action results. Action result is passed only to
     * the saga of its branch, a {@code null} action result produces no actions.
     * @param other saga to combine with
     * @param <AR2> action result type of the other saga
     * @param <A2> action type of the other saga
     * @return combined saga
     */
    public <AR2, A2> Saga<Either<AR, AR2>, Either<A, A2>> combine(Saga<AR2, A2> other) {
        return new Saga<Either<AR, AR2>, Either<A, A2>>(
                actionResult -> actionResult == null
                        ? Collections.<Either<A, A2>>emptyList()
                        : actionResult.<List<Either<A, A2>>>fold(
                                ar -> Decider.<A, A2>lefts(react(ar)),
                                ar2 -> Decider.<A, A2>rights(other.react(ar2))));
    }

    public static <AR1, A1, AR2, A2> Saga<Either<AR1, AR2>, Either<A1, A2>> combine(Saga<AR1, A1> first,
                                                                                 Saga<AR2, A2> second) {
        return first.combine(second);
    }

    /**
     * Merge with another saga reacting to the same action results. Both sagas react to every action result,
     * the actions of this saga precede the actions of the other one.
     * @param other saga to merge with
     * @return merged saga
     */
    public Saga<AR, A> merge(Saga<? super AR, ? extends A> other) {
        return new Saga<AR, A>(ar -> {
            List<A> actions = new ArrayList<>(react(ar));
            actions.addAll(other.react(ar));
            return actions;
        });
    }
}
