package com.tandemsystems;

/**
 * What a worker does when its handler fails.
 */
public enum SupervisionStrategy {
    /**
     * Log the failure and continue with the next call.
     */
    RESUME,

    /**
     * Stop the worker: the mailbox closes, queued calls are abandoned and later sends fail.
     */
    STOP
}
