package com.tandemsystems;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The caller's half of a wait-form operation.
 * Provides three tiers of API:
 * 1. Simple: get() - blocks and returns the value or throws
 * 2. Safe: await() - blocks and returns a Result
 * 3. Advanced: future() - access the underlying CompletableFuture
 *
 * <p>No timeout is applied unless the caller asks for one. A handler that never replies
 * and never finishes leaves {@link #await()} blocked.
 */
public interface Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the reply is available and returns the value.
     *
     * @throws OperationException if the operation failed
     */
    T get();

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the reply is available and returns a Result.
     */
    Result<T> await();

    /**
     * Blocks until the reply is available or the timeout expires.
     * The reply stays pending after a timeout; the worker is not affected.
     *
     * @throws TimeoutException if the timeout expires first
     */
    Result<T> await(Duration timeout) throws TimeoutException;

    /**
     * Non-blocking check if the reply is available.
     * Returns empty Optional if not yet complete.
     */
    Optional<Result<T>> poll();

    // ========== TIER 3: ADVANCED API ==========

    /**
     * Access the underlying CompletableFuture for composition.
     * The future fails with an {@link OperationException}.
     */
    CompletableFuture<T> future();

    /**
     * Stops listening. A reply written afterwards is dropped without affecting the worker.
     *
     * @return true if the reply was still pending
     */
    boolean cancel();

    /**
     * Transform the reply value when it arrives.
     */
    <U> Reply<U> map(Function<T, U> fn);

    /**
     * Register callbacks for success and failure. Non-blocking.
     */
    void onComplete(Consumer<T> onSuccess, Consumer<OperationException> onFailure);

    // ========== FACTORY METHODS ==========

    static <T> Reply<T> from(CompletableFuture<T> future) {
        return new PendingReply<>(future);
    }

    static <T> Reply<T> completed(T value) {
        return new PendingReply<>(CompletableFuture.completedFuture(value));
    }

    static <T> Reply<T> failed(OperationException error) {
        return new PendingReply<>(CompletableFuture.failedFuture(error));
    }
}
