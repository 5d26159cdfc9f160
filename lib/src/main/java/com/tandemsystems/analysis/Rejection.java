package com.tandemsystems.analysis;

import java.util.Objects;

/**
 * Why a unit was refused, and which type or variant to fix.
 *
 * @param reason  the rule that failed
 * @param subject the type or variant name the failure is about
 * @param message human readable detail
 */
public record Rejection(RejectionReason reason, String subject, String message) {

    public Rejection {
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(subject, "subject cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    @Override
    public String toString() {
        return reason + "(" + subject + "): " + message;
    }
}
