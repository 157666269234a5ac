package com.flowcheck.core.ir;

/**
 * A {@code NodeParameter(...)} declared in a custom node's {@code get_parameters}.
 *
 * @param name parameter name, null when it cannot be determined
 * @param type type tag as written ({@code "str"}, {@code "dict"}), null when missing
 * @param required value of {@code required=}, false when absent
 * @param defaultValue evaluated {@code default=} value, may be null
 * @param line declaration line
 */
public record ParameterDeclaration(
    String name,
    String type,
    boolean required,
    Object defaultValue,
    int line
) {
    public boolean hasType() {
        return type != null;
    }
}
