package com.tandemsystems.declaration;

import java.util.List;
import java.util.Objects;

/**
 * A method-like member of a processor.
 *
 * @param name         member name
 * @param parameters   parameters in declaration order, excluding the receiver
 * @param asynchronous whether the member completes asynchronously
 */
public record MemberDeclaration(String name, List<ParameterDeclaration> parameters, boolean asynchronous) {

    public MemberDeclaration {
        Objects.requireNonNull(name, "name cannot be null");
        parameters = List.copyOf(parameters);
    }
}
