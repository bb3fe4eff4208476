package org.javai.reattempt;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The four-state result of a remote operation: not yet requested, in flight, succeeded
 * with data, or failed with a {@link RequestError}.
 *
 * <p>The retry engine only reacts to {@link Failed}; the other states pass through it untouched.
 *
 * @param <T> The type of the data carried by a successful result
 */
public sealed interface Result<T> permits Result.NotRequested, Result.Pending, Result.Succeeded, Result.Failed {

    /**
     * The operation has not been issued yet.
     */
    record NotRequested<T>() implements Result<T> {

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new NotRequested<>();
        }

        @Override
        public Result<T> mapError(Function<? super RequestError, ? extends RequestError> mapper) {
            return this;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("result has not been requested");
        }
    }

    /**
     * The operation is in flight.
     */
    record Pending<T>() implements Result<T> {

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Pending<>();
        }

        @Override
        public Result<T> mapError(Function<? super RequestError, ? extends RequestError> mapper) {
            return this;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("result is still pending");
        }
    }

    /**
     * The operation completed and produced data.
     *
     * @param data the decoded data, may be null for operations without a body
     */
    record Succeeded<T>(T data) implements Result<T> {

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Succeeded<>(mapper.apply(data));
        }

        @Override
        public Result<T> mapError(Function<? super RequestError, ? extends RequestError> mapper) {
            return this;
        }

        @Override
        public T getOrThrow() {
            return data;
        }
    }

    /**
     * The operation failed.
     *
     * @param error what went wrong
     */
    record Failed<T>(RequestError error) implements Result<T> {

        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failed<>(error);
        }

        @Override
        public Result<T> mapError(Function<? super RequestError, ? extends RequestError> mapper) {
            Objects.requireNonNull(mapper);
            return new Failed<>(mapper.apply(error));
        }

        @Override
        public T getOrThrow() {
            throw new ResultFailedException(error);
        }
    }

    // Queries
    default boolean isNotRequested() {
        return this instanceof NotRequested;
    }

    default boolean isPending() {
        return this instanceof Pending;
    }

    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * Returns the error of a failed result. {@link Failed#error()} reads it directly.
     *
     * @return the error, or empty for every other state
     */
    default Optional<RequestError> failure() {
        return this instanceof Failed<T> failed ? Optional.of(failed.error()) : Optional.empty();
    }

    /**
     * Returns the data of a succeeded result, or {@code defaultValue} for every other state.
     */
    default T withDefault(T defaultValue) {
        return this instanceof Succeeded<T> succeeded ? succeeded.data() : defaultValue;
    }

    // Transformations
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    Result<T> mapError(Function<? super RequestError, ? extends RequestError> mapper);

    /**
     * Returns the data of a succeeded result.
     *
     * @throws ResultFailedException for a failed result
     * @throws IllegalStateException for a result that is not requested or pending
     */
    T getOrThrow();

    // Static factories
    static <T> Result<T> notRequested() {
        return new NotRequested<>();
    }

    static <T> Result<T> pending() {
        return new Pending<>();
    }

    static <T> Result<T> succeeded(T data) {
        return new Succeeded<>(data);
    }

    static <T> Result<T> failed(RequestError error) {
        return new Failed<>(error);
    }
}
