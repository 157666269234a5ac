package com.flowcheck.core.registry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of known node types.
 *
 * <p>The set of node classes is open: callers inject their own registry or extend the
 * bundled one with {@link #withAdditional(Map)} instead of changing validator code.
 * Implementations must be immutable and safe to share between threads.</p>
 *
 * @see StaticNodeTypeRegistry
 */
public interface NodeTypeRegistry {

    /**
     * Looks up a node type by class name.
     *
     * @param nodeType node class name
     * @return signature, or empty for unknown types
     */
    Optional<NodeTypeSignature> lookup(String nodeType);

    /**
     * Returns every registered signature.
     *
     * @return signatures keyed by name
     */
    Map<String, NodeTypeSignature> signatures();

    default boolean isKnown(String nodeType) {
        return lookup(nodeType).isPresent();
    }

    default List<String> requiredParameters(String nodeType) {
        return lookup(nodeType).map(NodeTypeSignature::requiredParameters).orElse(List.of());
    }

    /**
     * Returns a registry that adds or overrides entries.
     *
     * @param nodeTypes extra node types mapped to their required parameters
     * @return combined registry
     */
    default NodeTypeRegistry withAdditional(Map<String, List<String>> nodeTypes) {
        if (nodeTypes == null || nodeTypes.isEmpty()) {
            return this;
        }
        Map<String, List<String>> combined = new LinkedHashMap<>();
        signatures().forEach((name, signature) -> combined.put(name, signature.requiredParameters()));
        combined.putAll(nodeTypes);
        return of(combined);
    }

    /**
     * Creates a registry from a plain map.
     *
     * @param nodeTypes node type names mapped to their required parameters
     * @return registry
     */
    static NodeTypeRegistry of(Map<String, List<String>> nodeTypes) {
        return new StaticNodeTypeRegistry(nodeTypes);
    }

    /**
     * Returns the bundled registry of built-in node types.
     *
     * @return default registry
     */
    static NodeTypeRegistry defaults() {
        return StaticNodeTypeRegistry.bundled();
    }
}
