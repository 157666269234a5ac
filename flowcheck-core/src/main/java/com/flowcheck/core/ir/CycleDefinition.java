package com.flowcheck.core.ir;

import java.util.List;
import java.util.Objects;

/**
 * A cycle declared through {@code workflow.create_cycle(name)} and its builder calls.
 *
 * <p>Settings are null when the corresponding builder method was never called.</p>
 *
 * @param name cycle name, or the builder variable when the name is not a literal
 * @param edges {@code connect} calls in source order
 * @param maxIterations {@code max_iterations} setting, may be null
 * @param convergeWhen {@code converge_when} setting, may be null
 * @param timeout {@code timeout} setting, may be null
 * @param built true when {@code build()} was called
 * @param line {@code create_cycle} line
 */
public record CycleDefinition(
    String name,
    List<CycleEdge> edges,
    CycleSetting maxIterations,
    CycleSetting convergeWhen,
    CycleSetting timeout,
    boolean built,
    int line
) {
    public CycleDefinition {
        Objects.requireNonNull(name, "name must not be null");
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
