package com.flowcheck.core.ir;

/**
 * A value passed to a cycle builder method such as {@code max_iterations(50)}.
 *
 * @param value literal value, or {@link Unresolved#EXPRESSION}; null when the call had no argument
 * @param line call line
 */
public record CycleSetting(Object value, int line) {

    public boolean isLiteral() {
        return value != Unresolved.EXPRESSION;
    }
}
