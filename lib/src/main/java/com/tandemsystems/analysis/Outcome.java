package com.tandemsystems.analysis;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a build-time stage: either the accepted value or a rejection.
 * Sealed to ensure exhaustive handling.
 *
 * @param <T> the accepted value type
 */
public sealed interface Outcome<T> permits Outcome.Accepted, Outcome.Rejected {

    record Accepted<T>(T value) implements Outcome<T> {
        public Accepted {
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    record Rejected<T>(Rejection rejection) implements Outcome<T> {
        public Rejected {
            Objects.requireNonNull(rejection, "rejection cannot be null");
        }
    }

    static <T> Outcome<T> accepted(T value) {
        return new Accepted<>(value);
    }

    static <T> Outcome<T> rejected(RejectionReason reason, String subject, String message) {
        return new Rejected<>(new Rejection(reason, subject, message));
    }

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    /**
     * Continues with the next stage when accepted, propagates the rejection otherwise.
     */
    default <U> Outcome<U> flatMap(Function<T, Outcome<U>> next) {
        if (this instanceof Accepted<T> accepted) {
            return next.apply(accepted.value());
        }
        return new Rejected<>(((Rejected<T>) this).rejection());
    }

    default <U> Outcome<U> map(Function<T, U> fn) {
        return flatMap(value -> accepted(fn.apply(value)));
    }
}
