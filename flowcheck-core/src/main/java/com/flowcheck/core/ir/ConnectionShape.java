package com.flowcheck.core.ir;

/**
 * Argument shape of an {@code add_connection} call.
 */
public enum ConnectionShape {
    /** {@code add_connection(source, output, target, input)}. */
    FOUR_ARGUMENT,
    /** Deprecated {@code add_connection(source, target)}. */
    TWO_ARGUMENT,
    /** Any other argument count. */
    INVALID_ARITY
}
