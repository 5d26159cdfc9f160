package com.tandemsystems.synthesis;

import com.tandemsystems.declaration.TypeRef;

import java.util.Objects;

/**
 * One method of a synthesized handle.
 *
 * @param name         the operation name callers use
 * @param variantName  the message variant this operation accepts
 * @param responseType the reply type of the variant; the no-wait form still records it
 * @param form         wait or no-wait
 */
public record OperationDefinition(String name, String variantName, TypeRef responseType, CallForm form) {

    public OperationDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(variantName, "variantName cannot be null");
        Objects.requireNonNull(responseType, "responseType cannot be null");
        Objects.requireNonNull(form, "form cannot be null");
    }

    /**
     * @return the type the caller receives inside {@code Result}: the boxed response type, or {@code Void}
     */
    public TypeRef resultValueType() {
        return form == CallForm.WAIT ? responseType.boxed() : TypeRef.of("Void");
    }
}
