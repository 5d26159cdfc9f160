package com.tandemsystems.declaration;

/**
 * How a member receives an argument.
 */
public enum PassingMode {
    /** A copy or a moved value. */
    VALUE,
    /** A reference the callee may read but not keep to itself. */
    SHARED_REFERENCE,
    /** A reference the callee owns exclusively for the duration of the call. */
    EXCLUSIVE_REFERENCE
}
