package com.tandemsystems.contract;

import com.tandemsystems.declaration.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * The public call pair derived from one message variant.
 *
 * @param variantName         the variant this contract belongs to
 * @param operationName       wait-form operation name
 * @param noWaitOperationName no-wait operation name
 * @param responseType        the reply type, already unwrapped from any optional wrapper
 */
public record VariantContract(String variantName,
                              String operationName,
                              String noWaitOperationName,
                              TypeRef responseType) {

    static final String RESULT_TYPE = "Result";

    public VariantContract {
        Objects.requireNonNull(variantName, "variantName cannot be null");
        Objects.requireNonNull(operationName, "operationName cannot be null");
        Objects.requireNonNull(noWaitOperationName, "noWaitOperationName cannot be null");
        Objects.requireNonNull(responseType, "responseType cannot be null");
    }

    /**
     * @return {@code operationName(message) -> Result<T>}
     */
    public OperationSignature waitSignature() {
        return new OperationSignature(operationName, TypeRef.of(RESULT_TYPE, responseType.boxed()));
    }

    /**
     * @return {@code noWaitOperationName(message) -> Result<Void>}
     */
    public OperationSignature noWaitSignature() {
        return new OperationSignature(noWaitOperationName, TypeRef.of(RESULT_TYPE, TypeRef.of("Void")));
    }

    public List<String> operationNames() {
        return List.of(operationName, noWaitOperationName);
    }
}
