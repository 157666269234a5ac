package com.flowcheck.core.validator.impl;

/**
 * Decides whether a connection field name looks wrong.
 *
 * <p>Field names are not statically typed, so a positive answer only produces a
 * warning ({@code CON006} for outputs, {@code CON007} for inputs).</p>
 */
@FunctionalInterface
public interface FieldNameHeuristic {

    /**
     * @param fieldName output or input field name as written in the connection
     * @return true when the name deserves a warning
     */
    boolean isSuspicious(String fieldName);
}
