package com.tandemsystems.synthesis;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The caller-facing side of a synthesized actor.
 *
 * @param name            {@code Actor<Processor>}
 * @param messageTypeName the message type every operation accepts
 * @param operations      two operations per variant, in variant declaration order
 */
public record HandleDefinition(String name, String messageTypeName, List<OperationDefinition> operations) {

    public HandleDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(messageTypeName, "messageTypeName cannot be null");
        operations = List.copyOf(operations);
    }

    public Optional<OperationDefinition> operation(String operationName) {
        return operations.stream()
                .filter(operation -> operation.name().equals(operationName))
                .findFirst();
    }

    public List<String> operationNames() {
        return operations.stream().map(OperationDefinition::name).toList();
    }
}
