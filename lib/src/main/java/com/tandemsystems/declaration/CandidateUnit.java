package com.tandemsystems.declaration;

import java.util.Objects;

/**
 * A processor, its message type and its handler, as accepted by the eligibility analysis.
 */
public record CandidateUnit(ProcessorDeclaration processor, MessageDeclaration message, HandlerBinding handler) {

    public CandidateUnit {
        Objects.requireNonNull(processor, "processor cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
    }
}
