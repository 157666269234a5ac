package com.flowcheck.core.registry;

import java.util.List;
import java.util.Objects;

/**
 * Signature of a known node type: its class name and the configuration keys it requires.
 *
 * @param name node class name, e.g. {@code HTTPRequestNode}
 * @param requiredParameters required configuration keys in declaration order
 */
public record NodeTypeSignature(String name, List<String> requiredParameters) {
    public NodeTypeSignature {
        Objects.requireNonNull(name, "name must not be null");
        requiredParameters = requiredParameters != null ? List.copyOf(requiredParameters) : List.of();
    }
}
