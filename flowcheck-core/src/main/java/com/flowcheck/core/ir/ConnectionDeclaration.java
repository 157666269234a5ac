package com.flowcheck.core.ir;

import java.util.Objects;

/**
 * An {@code add_connection} call site.
 *
 * <p>Endpoint fields are null when the corresponding argument is missing or is not a
 * string literal. A connection flagged with the legacy {@code cycle=True} keyword is a
 * cycle edge and is exempt from the acyclicity check.</p>
 *
 * @param sourceNode source node id
 * @param sourceOutput source output field
 * @param targetNode target node id
 * @param targetInput target input field
 * @param shape argument shape
 * @param argumentCount number of endpoint arguments given
 * @param cycleEdge true when the call carries {@code cycle=...}
 * @param line call line
 */
public record ConnectionDeclaration(
    String sourceNode,
    String sourceOutput,
    String targetNode,
    String targetInput,
    ConnectionShape shape,
    int argumentCount,
    boolean cycleEdge,
    int line
) {
    public ConnectionDeclaration {
        Objects.requireNonNull(shape, "shape must not be null");
    }

    /**
     * Ordinary connections take part in endpoint resolution and cycle detection.
     *
     * @return true for a four-argument connection that is not a cycle edge
     */
    public boolean isOrdinary() {
        return shape == ConnectionShape.FOUR_ARGUMENT && !cycleEdge;
    }

    public boolean hasLiteralEndpoints() {
        return sourceNode != null && targetNode != null;
    }
}
