package com.flowcheck.core.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flat, typed extraction of the workflow constructs found in one source unit.
 *
 * <p>Node ids in {@code nodes} are unique; later declarations that reuse an id are kept
 * in {@code duplicateNodes}. All lists preserve source order.</p>
 *
 * @param nodes node declarations, first declaration per id
 * @param duplicateNodes declarations that repeat an earlier id
 * @param connections {@code add_connection} call sites
 * @param cycles cycle definitions
 * @param customClasses node classes defined in the source
 * @param imports imported names
 * @param usedNames identifiers read anywhere, mapped to the first line they are read on
 * @param localNames identifiers bound by assignments, definitions and parameters
 */
public record WorkflowIr(
    List<NodeDeclaration> nodes,
    List<NodeDeclaration> duplicateNodes,
    List<ConnectionDeclaration> connections,
    List<CycleDefinition> cycles,
    List<CustomNodeClass> customClasses,
    List<ImportDeclaration> imports,
    Map<String, Integer> usedNames,
    Set<String> localNames
) {
    public WorkflowIr {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        duplicateNodes = duplicateNodes != null ? List.copyOf(duplicateNodes) : List.of();
        connections = connections != null ? List.copyOf(connections) : List.of();
        cycles = cycles != null ? List.copyOf(cycles) : List.of();
        customClasses = customClasses != null ? List.copyOf(customClasses) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
        usedNames = usedNames != null ? Collections.unmodifiableMap(new LinkedHashMap<>(usedNames)) : Map.of();
        localNames = localNames != null ? Collections.unmodifiableSet(new LinkedHashSet<>(localNames)) : Set.of();
    }

    /**
     * IR of a source unit without any workflow constructs.
     *
     * @return empty IR
     */
    public static WorkflowIr empty() {
        return new WorkflowIr(null, null, null, null, null, null, null, null);
    }

    public Optional<NodeDeclaration> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    public Optional<CustomNodeClass> customClass(String name) {
        return customClasses.stream().filter(custom -> custom.name().equals(name)).findFirst();
    }

    public boolean isUsed(String name) {
        return usedNames.containsKey(name);
    }

    /**
     * True when the source declares no nodes, connections or cycles.
     *
     * @return true for non-workflow source
     */
    public boolean hasNoWorkflow() {
        return nodes.isEmpty() && connections.isEmpty() && cycles.isEmpty();
    }
}
