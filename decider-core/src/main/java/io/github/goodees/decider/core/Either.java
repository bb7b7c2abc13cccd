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
import java.util.Optional;
import java.util.function.Function;

/**
 * Tagged union of two types. Combined deciders, views and sagas accept and produce values of this type, and every
 * consumer has to handle both branches through {@link #fold(Function, Function)}.
 *
 * @param <L> type of the left branch
 * @param <R> type of the right branch
 */
public abstract class Either<L, R> {

    private Either() {
    }

    public static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    public static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    public abstract boolean isLeft();

    public boolean isRight() {
        return !isLeft();
    }

    /**
     * Apply the function matching the branch of this value.
     * @param onLeft function applied to left value
     * @param onRight function applied to right value
     * @param <T> result type
     * @return result of the applied function
     */
    public abstract <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight);

    public Optional<L> getLeft() {
        return fold(l -> Optional.<L>of(l), r -> Optional.<L>empty());
    }

    public Optional<R> getRight() {
        return fold(l -> Optional.<R>empty(), r -> Optional.<R>of(r));
    }

    public <L2> Either<L2, R> mapLeft(Function<? super L, ? extends L2> f) {
        return fold(l -> Either.<L2, R>left(f.apply(l)), r -> Either.<L2, R>right(r));
    }

    public <R2> Either<L, R2> mapRight(Function<? super R, ? extends R2> f) {
        return fold(l -> Either.<L, R2>left(l), r -> Either.<L, R2>right(f.apply(r)));
    }

    static final class Left<L, R> extends Either<L, R> {
        private final L value;

        Left(L value) {
            this.value = Objects.requireNonNull(value, "Left value must not be null");
        }

        @Override
        public boolean isLeft() {
            return true;
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onLeft.apply(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Left && value.equals(((Left<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return 31 * value.hashCode();
        }

        @Override
        public String toString() {
            return "Left(" + value + ")";
        }
    }

    static final class Right<L, R> extends Either<L, R> {
        private final R value;

        Right(R value) {
            this.value = Objects.requireNonNull(value, "Right value must not be null");
        }

        @Override
        public boolean isLeft() {
            return false;
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onRight.apply(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Right && value.equals(((Right<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return 37 * value.hashCode();
        }

        @Override
        public String toString() {
            return "Right(" + value + ")";
        }
    }
}
