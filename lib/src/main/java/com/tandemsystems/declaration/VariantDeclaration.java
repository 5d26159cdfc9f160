package com.tandemsystems.declaration;

import java.util.List;
import java.util.Objects;

/**
 * One alternative shape of a message type.
 */
public record VariantDeclaration(String name, List<FieldDeclaration> fields) {

    public VariantDeclaration {
        Objects.requireNonNull(name, "name cannot be null");
        fields = List.copyOf(fields);
    }

    public List<FieldDeclaration> fieldsNamed(String fieldName) {
        return fields.stream()
                .filter(field -> field.name().equals(fieldName))
                .toList();
    }
}
