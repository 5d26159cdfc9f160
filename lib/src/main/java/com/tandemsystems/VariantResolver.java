package com.tandemsystems;

/**
 * Reads the variant tag of a message value.
 *
 * @param <M> the message type
 */
@FunctionalInterface
public interface VariantResolver<M> {

    String variantOf(M message);

    /**
     * Tags a message with the simple name of its class, which matches the variant names read
     * from sealed interfaces with record variants.
     */
    static <M> VariantResolver<M> simpleClassName() {
        return message -> message.getClass().getSimpleName();
    }
}
