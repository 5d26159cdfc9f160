package com.tandemsystems.declaration;

import java.util.List;
import java.util.Objects;

/**
 * A tagged message type with its variants in declaration order.
 */
public record MessageDeclaration(String name, List<VariantDeclaration> variants) implements Declaration {

    public MessageDeclaration {
        Objects.requireNonNull(name, "name cannot be null");
        variants = List.copyOf(variants);
    }
}
