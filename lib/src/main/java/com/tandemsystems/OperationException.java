package com.tandemsystems;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Unchecked exception describing a failed actor operation.
 * Carried by {@link Result.Failure}; thrown only from the explicitly throwing accessors
 * such as {@link Result#getOrThrow()} and {@link Reply#get()}.
 */
public class OperationException extends RuntimeException {

    private final OperationError error;

    public OperationException(OperationError error, String message) {
        super(message);
        this.error = error;
    }

    public OperationException(OperationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    /**
     * @return the kind of failure
     */
    public OperationError error() {
        return error;
    }

    /**
     * Converts whatever completed a reply exceptionally into an OperationException.
     * Anything that is not already one means the reply will never be delivered.
     *
     * @param throwable the failure, possibly wrapped in a CompletionException
     * @return the matching OperationException
     */
    static OperationException from(Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
        if (cause instanceof OperationException operationException) {
            return operationException;
        }
        if (cause instanceof CancellationException) {
            return new OperationException(OperationError.MAILBOX_CLOSED_OR_ABANDONED, "Reply was cancelled", cause);
        }
        return new OperationException(OperationError.MAILBOX_CLOSED_OR_ABANDONED, "Reply failed", cause);
    }
}
