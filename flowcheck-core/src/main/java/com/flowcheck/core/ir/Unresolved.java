package com.flowcheck.core.ir;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Placeholder for a value that is not a compile-time literal, such as a variable
 * reference or function call in a node configuration.
 */
public enum Unresolved {
    EXPRESSION;

    @JsonValue
    @Override
    public String toString() {
        return "<expression>";
    }
}
