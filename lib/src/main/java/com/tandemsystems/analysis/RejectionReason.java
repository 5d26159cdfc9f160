package com.tandemsystems.analysis;

/**
 * Build-time reasons for refusing to generate an actor.
 */
public enum RejectionReason {
    /** Zero or several processor/message pairings. */
    AMBIGUOUS_OR_MISSING_PAIR,
    /** No asynchronous {@code process} member taking the message exclusively. */
    MISSING_HANDLER,
    /** The message type declares no variant. */
    EMPTY_MESSAGE_TYPE,
    /** A variant lacks its single {@code resp} field. */
    MISSING_RESPONSE_FIELD,
    /** Two variants derive the same operation name. */
    DUPLICATE_OPERATION_NAME
}
