package com.tandemsystems.synthesis;

import java.util.Objects;

/**
 * The consumer side of a synthesized actor: owns the processor and runs its handler sequentially.
 *
 * @param name          {@code <Processor>Worker}
 * @param processorName the processor the worker owns
 * @param handlerName   the handler member invoked once per call
 */
public record WorkerDefinition(String name, String processorName, String handlerName) {

    public WorkerDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(processorName, "processorName cannot be null");
        Objects.requireNonNull(handlerName, "handlerName cannot be null");
    }
}
