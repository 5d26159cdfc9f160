package com.tandemsystems;

/**
 * Call-time failures of an actor operation. Always returned to the caller inside a
 * {@link Result.Failure}, never thrown by the handle.
 */
public enum OperationError {
    /**
     * The message was built from a variant other than the one the operation belongs to.
     * Nothing was sent.
     */
    WRONG_VARIANT,

    /**
     * No operation with the given name exists on the handle. Nothing was sent.
     */
    UNKNOWN_OPERATION,

    /**
     * The mailbox was closed before the message could be enqueued.
     * Only a new actor can accept calls again.
     */
    SEND_FAILED,

    /**
     * The message was enqueued but no reply will ever arrive: the handler finished
     * without replying, failed, or the worker stopped first.
     */
    MAILBOX_CLOSED_OR_ABANDONED
}
