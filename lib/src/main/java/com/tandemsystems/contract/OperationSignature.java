package com.tandemsystems.contract;

import com.tandemsystems.declaration.TypeRef;

/**
 * Name and return type of one public operation, e.g. {@code msg_one -> Result<Integer>}.
 */
public record OperationSignature(String name, TypeRef returnType) {

    @Override
    public String toString() {
        return name + "(message) -> " + returnType.render();
    }
}
