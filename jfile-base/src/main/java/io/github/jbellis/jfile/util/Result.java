/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jfile.util;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Holds either a success value or an error, never both.
 * <p>
 * Results are returned by every fallible operation in jfile in place of checked exceptions. The
 * discriminant is fixed at construction; callers branch on {@link #isOk()} or {@link #isError()}
 * before calling {@link #value()} or {@link #error()}. Asking a result for the side it does not
 * hold is a programming error and throws {@link IllegalStateException}.
 * <p>
 * Operations with nothing to return use {@code Result<Void, E>}, built with {@link #ok()}; its
 * {@link #value()} returns null.
 * <p>
 * Results are immutable. The only two subclasses are private, so the hierarchy is closed.
 *
 * @param <T> the success type
 * @param <E> the error type
 */
public abstract class Result<T, E> {
    private static final Result<Void, ?> VOID_OK = new Ok<>(null);

    private Result() {
    }

    /**
     * @return a successful result holding {@code value}
     */
    public static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * @return the successful result of an operation that produces no value
     */
    @SuppressWarnings("unchecked")
    public static <E> Result<Void, E> ok() {
        return (Result<Void, E>) VOID_OK;
    }

    /**
     * @param error the error, must not be null
     * @return a failed result holding {@code error}
     */
    public static <T, E> Result<T, E> error(E error) {
        return new Err<>(Objects.requireNonNull(error, "error"));
    }

    public abstract boolean isOk();

    public final boolean isError() {
        return !isOk();
    }

    /**
     * @return the success value, null for a {@code Result<Void, E>}
     * @throws IllegalStateException if this result holds an error
     */
    public abstract T value();

    /**
     * @return the error
     * @throws IllegalStateException if this result holds a value
     */
    public abstract E error();

    /**
     * Re-types a failed result so it can be returned from a method with a different success type.
     *
     * @throws IllegalStateException if this result holds a value
     */
    public abstract <U> Result<U, E> propagate();

    public abstract <U> Result<U, E> map(Function<? super T, ? extends U> mapper);

    public abstract <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper);

    public abstract <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper);

    public abstract T orElse(T other);

    /**
     * Returns the value, or throws the exception built from the error.
     */
    public abstract <X extends Throwable> T orElseThrow(Function<? super E, ? extends X> exceptionSupplier) throws X;

    public void ifOk(Consumer<? super T> action) {
        if (isOk()) {
            action.accept(value());
        }
    }

    private static final class Ok<T, E> extends Result<T, E> {
        private final T value;

        private Ok(T value) {
            this.value = value;
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T value() {
            return value;
        }

        @Override
        public E error() {
            throw new IllegalStateException("error() called on a successful result: " + this);
        }

        @Override
        public <U> Result<U, E> propagate() {
            throw new IllegalStateException("Cannot propagate a successful result as an error: " + this);
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
            return Objects.requireNonNull(mapper.apply(value));
        }

        @Override
        @SuppressWarnings("unchecked")
        public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
            // no error to map, and the success side is unchanged
            return (Result<T, F>) this;
        }

        @Override
        public T orElse(T other) {
            return value;
        }

        @Override
        public <X extends Throwable> T orElseThrow(Function<? super E, ? extends X> exceptionSupplier) {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Ok)) {
                return false;
            }
            return Objects.equals(value, ((Ok<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hashCode(value) + 1;
        }

        @Override
        public String toString() {
            return "Ok[" + value + "]";
        }
    }

    private static final class Err<T, E> extends Result<T, E> {
        private final E error;

        private Err(E error) {
            this.error = error;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("value() called on a failed result: " + this);
        }

        @Override
        public E error() {
            return error;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Result<U, E> propagate() {
            return (Result<U, E>) this;
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            return propagate();
        }

        @Override
        public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
            return propagate();
        }

        @Override
        public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
            return new Err<>(Objects.requireNonNull(mapper.apply(error)));
        }

        @Override
        public T orElse(T other) {
            return other;
        }

        @Override
        public <X extends Throwable> T orElseThrow(Function<? super E, ? extends X> exceptionSupplier) throws X {
            throw exceptionSupplier.apply(error);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Err)) {
                return false;
            }
            return error.equals(((Err<?, ?>) o).error);
        }

        @Override
        public int hashCode() {
            return 31 * error.hashCode() + 2;
        }

        @Override
        public String toString() {
            return "Err[" + error + "]";
        }
    }
}
