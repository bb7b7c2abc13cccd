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

import java.util.Iterator;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Outcome of handling a single input: either the produced value, or the {@link HandlingException} describing the
 * failed step.
 *
 * @param <T> type of the value
 */
public abstract class Result<T> {

    private Result() {
    }

    public static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    public static <T> Result<T> failure(HandlingException error) {
        return new Failure<>(error);
    }

    public abstract boolean isSuccess();

    public boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Value of successful result.
     * @return the value
     * @throws IllegalStateException if this is a failure
     */
    public abstract T getValue();

    /**
     * Error of failed result.
     * @return the error
     * @throws IllegalStateException if this is a success
     */
    public abstract HandlingException getError();

    public abstract <U> U fold(Function<? super T, ? extends U> onSuccess,
                               Function<? super HandlingException, ? extends U> onFailure);

    public <U> Result<U> map(Function<? super T, ? extends U> f) {
        return fold(v -> Result.<U>success(f.apply(v)), Result::<U>failure);
    }

    public T orElseThrow() throws HandlingException {
        if (isSuccess()) {
            return getValue();
        }
        throw getError();
    }

    /**
     * Handle a stream of inputs, producing one result per input. A failure of a single input does not end the
     * stream. When the source stream itself fails, a single {@link HandlingException.Fault#STREAM} failure is the
     * last element.
     *
     * @param inputs source of inputs
     * @param handler handling of single input
     * @param <I> input type
     * @param <O> output type
     * @return lazy stream of results
     */
    public static <I, O> Stream<Result<O>> stream(Stream<? extends I> inputs,
                                                  Function<? super I, Result<O>> handler) {
        Iterator<? extends I> source = inputs.iterator();
        Spliterator<Result<O>> results = new Spliterators.AbstractSpliterator<Result<O>>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            private boolean ended;

            @Override
            public boolean tryAdvance(Consumer<? super Result<O>> action) {
                if (ended) {
                    return false;
                }
                I input;
                try {
                    if (!source.hasNext()) {
                        ended = true;
                        return false;
                    }
                    input = source.next();
                } catch (RuntimeException e) {
                    ended = true;
                    action.accept(Result.<O>failure(HandlingException.streamFailed(e)));
                    return true;
                }
                action.accept(handler.apply(input));
                return true;
            }
        };
        return StreamSupport.stream(results, false).onClose(inputs::close);
    }

    static final class Success<T> extends Result<T> {
        private final T value;

        Success(T value) {
            this.value = value;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public HandlingException getError() {
            throw new IllegalStateException("Successful result has no error");
        }

        @Override
        public <U> U fold(Function<? super T, ? extends U> onSuccess,
                          Function<? super HandlingException, ? extends U> onFailure) {
            return onSuccess.apply(value);
        }

        @Override
        public String toString() {
            return "Success(" + value + ")";
        }
    }

    static final class Failure<T> extends Result<T> {
        private final HandlingException error;

        Failure(HandlingException error) {
            this.error = Objects.requireNonNull(error, "Error must be specified");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Failed result has no value", error);
        }

        @Override
        public HandlingException getError() {
            return error;
        }

        @Override
        public <U> U fold(Function<? super T, ? extends U> onSuccess,
                          Function<? super HandlingException, ? extends U> onFailure) {
            return onFailure.apply(error);
        }

        @Override
        public String toString() {
            return "Failure(" + error.getFault() + ": " + error.getMessage() + ")";
        }
    }
}
