package com.tandemsystems.declaration;

import java.util.Objects;

/**
 * Points at the member of a processor that handles its messages.
 */
public record HandlerBinding(String processorName, MemberDeclaration handler) {

    public HandlerBinding {
        Objects.requireNonNull(processorName, "processorName cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
    }
}
