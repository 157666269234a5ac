package com.flowcheck.core.ir;

/**
 * A {@code connect(source, target, mapping=...)} call on a cycle builder.
 *
 * @param source source node id, null when not a string literal
 * @param target target node id, null when not a string literal
 * @param mapping evaluated mapping argument, {@link Unresolved#EXPRESSION} when not a literal
 * @param mappingGiven true when a mapping argument was passed
 * @param line call line
 */
public record CycleEdge(String source, String target, Object mapping, boolean mappingGiven, int line) {
}
