package com.tandemsystems.declaration;

import java.util.Objects;

/**
 * A named, typed field of a processor or of a message variant.
 */
public record FieldDeclaration(String name, TypeRef type) {

    public FieldDeclaration {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }
}
