package com.tandemsystems;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Typed outcome of an actor operation.
 * Sealed to ensure exhaustive matching.
 *
 * @param <T> the success value type; {@link Void} for no-wait operations
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value. The value is null for no-wait operations.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public Optional<OperationError> error() {
            return Optional.empty();
        }
    }

    /**
     * Failed result containing the operation failure.
     */
    record Failure<T>(OperationException cause) implements Result<T> {
        public Failure {
            Objects.requireNonNull(cause, "cause cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw cause;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public Optional<OperationError> error() {
            return Optional.of(cause.error());
        }
    }

    // Common operations
    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    /**
     * @return the failure kind, empty on success
     */
    Optional<OperationError> error();

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            return new Success<>(fn.apply(success.value()));
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    default <U> Result<U> flatMap(Function<T, Result<U>> fn) {
        if (this instanceof Success<T> success) {
            return fn.apply(success.value());
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<OperationException> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.cause());
        }
    }

    // Factory methods
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(OperationException error) {
        return new Failure<>(error);
    }

    static <T> Result<T> failure(OperationError error, String message) {
        return new Failure<>(new OperationException(error, message));
    }
}
