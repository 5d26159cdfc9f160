package com.tandemsystems;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Implementation of Reply backed by CompletableFuture.
 */
record PendingReply<T>(CompletableFuture<T> future) implements Reply<T> {

    @Override
    public T get() {
        return await().getOrThrow();
    }

    @Override
    public Result<T> await() {
        try {
            return Result.success(future.join());
        } catch (RuntimeException e) {
            return Result.failure(OperationException.from(e));
        }
    }

    @Override
    public Result<T> await(Duration timeout) throws TimeoutException {
        try {
            return Result.success(future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (ExecutionException e) {
            return Result.failure(OperationException.from(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(new OperationException(OperationError.MAILBOX_CLOSED_OR_ABANDONED,
                    "Interrupted while waiting for reply", e));
        } catch (RuntimeException e) {
            return Result.failure(OperationException.from(e));
        }
    }

    @Override
    public Optional<Result<T>> poll() {
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    @Override
    public boolean cancel() {
        return future.cancel(false);
    }

    @Override
    public <U> Reply<U> map(Function<T, U> fn) {
        return new PendingReply<>(future.thenApply(fn));
    }

    @Override
    public void onComplete(Consumer<T> onSuccess, Consumer<OperationException> onFailure) {
        future.whenComplete((value, error) -> {
            if (error != null) {
                onFailure.accept(OperationException.from(error));
            } else {
                onSuccess.accept(value);
            }
        });
    }
}
