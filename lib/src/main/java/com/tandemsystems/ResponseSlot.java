package com.tandemsystems;

import java.util.concurrent.CompletableFuture;

/**
 * Single-use cell that carries one reply from the worker to one waiting caller.
 * The worker fills it with {@link #send(Object)}; the caller reads it through the
 * {@link Reply} returned by the wait-form operation.
 *
 * <p>Writes after the first one, and writes after the caller cancelled, are ignored.
 * A slot created for a known reply type refuses values of any other type.
 *
 * @param <T> the reply type
 */
public final class ResponseSlot<T> {

    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final Class<?> type;

    ResponseSlot() {
        this(Object.class);
    }

    ResponseSlot(Class<?> type) {
        this.type = type;
    }

    /**
     * Delivers the reply.
     *
     * @param value the reply value
     * @return true if this call delivered it, false if the slot was already resolved or the caller went away
     * @throws ClassCastException if the value is not of the operation's reply type
     */
    public boolean send(T value) {
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException("Reply of type " + value.getClass().getName()
                    + " where " + type.getName() + " is expected");
        }
        return future.complete(value);
    }

    /**
     * @return true once a value was sent, the slot was abandoned, or the caller cancelled
     */
    public boolean isResolved() {
        return future.isDone();
    }

    /**
     * Fails the caller with {@link OperationError#MAILBOX_CLOSED_OR_ABANDONED} unless already resolved.
     *
     * @param reason why no reply will come
     * @return true if the slot was still open
     */
    boolean abandon(String reason) {
        return future.completeExceptionally(
                new OperationException(OperationError.MAILBOX_CLOSED_OR_ABANDONED, reason));
    }

    @SuppressWarnings("unchecked")
    <R> Reply<R> reply() {
        return (Reply<R>) Reply.from(future);
    }
}
