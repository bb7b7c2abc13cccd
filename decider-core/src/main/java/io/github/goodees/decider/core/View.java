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

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Pure projection primitive. Folds events into a state, the same way {@link Decider} does, without deciding.
 *
 * @param <S> state type
 * @param <E> event type
 */
public class View<S, E> {
    private final BiFunction<S, E, S> evolve;
    private final S initialState;

    public View(BiFunction<S, E, S> evolve, S initialState) {
        this.evolve = Objects.requireNonNull(evolve, "Evolve function must be specified");
        this.initialState = initialState;
    }

    public S evolve(S state, E event) {
        return evolve.apply(state, event);
    }

    public S getInitialState() {
        return initialState;
    }

    public S fold(S state, Iterable<? extends E> events) {
        S result = state;
        for (E event : events) {
            result = evolve(result, event);
        }
        return result;
    }

    public S fold(Iterable<? extends E> events) {
        return fold(initialState, events);
    }

    public <En> View<S, En> mapLeftOnEvent(Function<? super En, ? extends E> f) {
        return new View<S, En>((s, e) -> evolve(s, f.apply(e)), initialState);
    }

    public <Sn> View<Sn, E> dimapOnState(Function<? super Sn, ? extends S> fl, Function<? super S, ? extends Sn> fr) {
        return new View<Sn, E>((s, e) -> fr.apply(evolve(fl.apply(s), e)), fr.apply(initialState));
    }

    /**
     * Combine with another view into one operating on the pair of states and union of events. An event only evolves
     * the state component of its branch, a {@code null} event leaves the state unchanged.
     * @param other view to combine with
     * @param <S2> state type of the other view
     * @param <E2> event type of the other view
     * @return combined view
     */
    public <S2, E2> View<Pair<S, S2>, Either<E, E2>> combine(View<S2, E2> other) {
        return new View<Pair<S, S2>, Either<E, E2>>(
                (state, event) -> event == null
                        ? state
                        : event.<Pair<S, S2>>fold(
                                e -> state.withFirst(evolve(state.getFirst(), e)),
                                e2 -> state.withSecond(other.evolve(state.getSecond(), e2))),
                Pair.of(initialState, other.getInitialState()));
    }

    public static <S1, E1, S2, E2> View<Pair<S1, S2>, Either<E1, E2>> combine(View<S1, E1> first,
                                                                           View<S2, E2> second) {
        return first.combine(second);
    }
}
