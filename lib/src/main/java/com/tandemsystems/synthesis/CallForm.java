package com.tandemsystems.synthesis;

/**
 * How an operation talks to the worker.
 */
public enum CallForm {
    /**
     * The caller sends a response slot and waits for the handler's reply.
     */
    WAIT,

    /**
     * The caller returns as soon as the call is enqueued.
     */
    NO_WAIT
}
