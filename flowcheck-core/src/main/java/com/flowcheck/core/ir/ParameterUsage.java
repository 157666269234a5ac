package com.flowcheck.core.ir;

import java.util.Objects;

/**
 * A parameter read inside a custom node's {@code run}/{@code execute} method,
 * e.g. {@code kwargs.get("text")}.
 *
 * @param name parameter name
 * @param line line of the read
 */
public record ParameterUsage(String name, int line) {
    public ParameterUsage {
        Objects.requireNonNull(name, "name must not be null");
    }
}
