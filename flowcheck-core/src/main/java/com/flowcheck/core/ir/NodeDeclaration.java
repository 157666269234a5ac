package com.flowcheck.core.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node declared with {@code add_node(class_name, id, config)}.
 *
 * <p>{@code config} keeps insertion order. Values that are not literals are stored as
 * {@link Unresolved#EXPRESSION}. When the configuration itself is not a dict display
 * (a variable, a call, a {@code **} unpacking) {@code configResolved} is false and the
 * known keys are incomplete.</p>
 *
 * @param id node identifier
 * @param className node class name, last segment of a dotted reference
 * @param config configuration entries
 * @param configResolved true when every configuration key is known statically
 * @param line declaration line
 */
public record NodeDeclaration(
    String id,
    String className,
    Map<String, Object> config,
    boolean configResolved,
    int line
) {
    public NodeDeclaration {
        Objects.requireNonNull(id, "id must not be null");
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public boolean hasClassName() {
        return className != null;
    }
}
