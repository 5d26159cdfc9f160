package com.tandemsystems.synthesis;

import com.tandemsystems.declaration.TypeRef;

import java.util.Objects;

/**
 * The channel between handles and worker: many producers, one consumer.
 *
 * @param elementType {@code Call<Message>}
 * @param bounded     false unless a capacity is configured at spawn time
 */
public record MailboxWiring(TypeRef elementType, boolean bounded) {

    static final String CALL_TYPE = "Call";

    public MailboxWiring {
        Objects.requireNonNull(elementType, "elementType cannot be null");
    }

    public static MailboxWiring unboundedFor(String messageTypeName) {
        return new MailboxWiring(TypeRef.of(CALL_TYPE, TypeRef.of(messageTypeName)), false);
    }
}
