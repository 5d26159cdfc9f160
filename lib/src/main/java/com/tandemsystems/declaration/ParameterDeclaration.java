package com.tandemsystems.declaration;

import java.util.Objects;

public record ParameterDeclaration(String name, TypeRef type, PassingMode passing) {

    public ParameterDeclaration {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(passing, "passing cannot be null");
    }
}
