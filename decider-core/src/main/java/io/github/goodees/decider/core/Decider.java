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
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pure decision and evolution primitive.
 * <p>A decider is given by three parts:</p>
 * <ul>
 *     <li>{@code decide}, which maps a command and the current state to the events implied by the command,</li>
 *     <li>{@code evolve}, which folds a single event into the state,</li>
 *     <li>the initial state.</li>
 * </ul>
 * <p>Both functions must be total and deterministic, and may depend on nothing but their arguments. Folding the whole
 * event history of an entity through {@code evolve}, starting at the initial state, yields the state {@code decide}
 * is invoked with. An empty list of events means the command has no effect. A domain rejection is expressed either as
 * a dedicated event, or by throwing, in which case the handlers report a decision failure.</p>
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class Decider<C, S, E> {
    private final BiFunction<C, S, List<E>> decide;
    private final BiFunction<S, E, S> evolve;
    private final S initialState;

    /**
     * Create a decider.
     * @param decide decision function. Returning {@code null} is treated as returning no events
     * @param evolve evolution function
     * @param initialState the state of entity without any events
     */
    public Decider(BiFunction<C, S, List<E>> decide, BiFunction<S, E, S> evolve, S initialState) {
        this.decide = Objects.requireNonNull(decide, "Decide function must be specified");
        this.evolve = Objects.requireNonNull(evolve, "Evolve function must be specified");
        this.initialState = initialState;
    }

    public List<E> decide(C command, S state) {
        List<E> events = decide.apply(command, state);
        return events == null ? Collections.<E>emptyList() : events;
    }

    public S evolve(S state, E event) {
        return evolve.apply(state, event);
    }

    public S getInitialState() {
        return initialState;
    }

    /**
     * Fold events into a state, left to right.
     * @param state the state to start from
     * @param events events to apply
     * @return resulting state
     */
    public S fold(S state, Iterable<? extends E> events) {
        S result = state;
        for (E event : events) {
            result = evolve(result, event);
        }
        return result;
    }

    /**
     * Fold events starting at initial state.
     * @param events full history of an entity
     * @return current state of the entity
     */
    public S fold(Iterable<? extends E> events) {
        return fold(initialState, events);
    }

    /**
     * Adapt the decider to a different command type.
     * @param f mapping from the new command type
     * @param <Cn> new command type
     * @return decider accepting new command type
     */
    public <Cn> Decider<Cn, S, E> mapLeftOnCommand(Function<? super Cn, ? extends C> f) {
        return new Decider<Cn, S, E>((c, s) -> decide(f.apply(c), s), evolve, initialState);
    }

    /**
     * Adapt the decider to a different event type.
     * @param fl mapping from the new event type, used when evolving
     * @param fr mapping to the new event type, used for decided events
     * @param <En> new event type
     * @return decider operating on new event type
     */
    public <En> Decider<C, S, En> dimapOnEvent(Function<? super En, ? extends E> fl,
                                               Function<? super E, ? extends En> fr) {
        return new Decider<C, S, En>(
                (c, s) -> decide(c, s).stream().<En>map(fr).collect(Collectors.<En>toList()),
                (s, e) -> evolve(s, fl.apply(e)),
                initialState);
    }

    /**
     * Adapt the decider to a different state type.
     * @param fl mapping from the new state type
     * @param fr mapping to the new state type
     * @param <Sn> new state type
     * @return decider operating on new state type
     */
    public <Sn> Decider<C, Sn, E> dimapOnState(Function<? super Sn, ? extends S> fl,
                                               Function<? super S, ? extends Sn> fr) {
        return new Decider<C, Sn, E>(
                (c, s) -> decide(c, fl.apply(s)),
                (s, e) -> fr.apply(evolve(fl.apply(s), e)),
                fr.apply(initialState));
    }

    /**
     * Combine this decider with another one. The resulting decider operates on the pair of both states, and on the
     * union of commands and events. A command or event is handled only by the decider of its branch, the state
     * component of the other decider is left untouched. A {@code null} command yields no events, a {@code null}
     * event leaves the state unchanged.
     *
     * @param other decider to combine with
     * @param <C2> command type of other decider
     * @param <S2> state type of other decider
     * @param <E2> event type of other decider
     * @return combined decider
     */
    public <C2, S2, E2> Decider<Either<C, C2>, Pair<S, S2>, Either<E, E2>> combine(Decider<C2, S2, E2> other) {
        return new Decider<Either<C, C2>, Pair<S, S2>, Either<E, E2>>(
                (command, state) -> command == null
                        ? Collections.<Either<E, E2>>emptyList()
                        : command.<List<Either<E, E2>>>fold(
                                c -> lefts(decide(c, state.getFirst())),
                                c2 -> rights(other.decide(c2, state.getSecond()))),
                (state, event) -> event == null
                        ? state
                        : event.<Pair<S, S2>>fold(
                                e -> state.withFirst(evolve(state.getFirst(), e)),
                                e2 -> state.withSecond(other.evolve(state.getSecond(), e2))),
                Pair.of(initialState, other.getInitialState()));
    }

    public static <C1, S1, E1, C2, S2, E2> Decider<Either<C1, C2>, Pair<S1, S2>, Either<E1, E2>> combine(
            Decider<C1, S1, E1> first, Decider<C2, S2, E2> second) {
        return first.combine(second);
    }

    static <A, B> List<Either<A, B>> lefts(List<? extends A> values) {
        List<Either<A, B>> result = new ArrayList<>(values.size());
        for (A value : values) {
            result.add(Either.<A, B>left(value));
        }
        return result;
    }

    static <A, B> List<Either<A, B>> rights(List<? extends B> values) {
        List<Either<A, B>> result = new ArrayList<>(values.size());
        for (B value : values) {
            result.add(Either.<A, B>right(value));
        }
        return result;
    }
}
