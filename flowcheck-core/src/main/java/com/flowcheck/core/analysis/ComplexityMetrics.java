package com.flowcheck.core.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Size and shape metrics of one workflow.
 *
 * <p>Scores are rounded to two decimals. {@code complexityScore} is
 * {@code nodes*2 + connections*1.5 + cycles*10 + depth*3 + distinctTypes*2}.</p>
 *
 * @param nodeCount declared nodes
 * @param connectionCount {@code add_connection} call sites
 * @param cycleCount cycle definitions plus legacy cycle edges
 * @param workflowDepth longest simple path in nodes
 * @param complexityScore weighted structural score
 * @param patternType dominant shape
 * @param parallelismScore extra fan-out edges over {@code nodes - 1}
 * @param nodeTypes node count per class name
 * @param maxCycleDepth most edges in a single cycle
 * @param configurationComplexity mean config size per node, nested values counted thrice
 * @param connectionComplexity mean per-connection weight
 * @param maintenanceComplexityScore blend of the three complexity figures
 */
public record ComplexityMetrics(
    int nodeCount,
    int connectionCount,
    int cycleCount,
    int workflowDepth,
    double complexityScore,
    PatternType patternType,
    double parallelismScore,
    Map<String, Integer> nodeTypes,
    int maxCycleDepth,
    double configurationComplexity,
    double connectionComplexity,
    double maintenanceComplexityScore
) {
    public ComplexityMetrics {
        Objects.requireNonNull(patternType, "patternType must not be null");
        nodeTypes = nodeTypes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(nodeTypes))
            : Map.of();
    }

    public static ComplexityMetrics empty() {
        return new ComplexityMetrics(0, 0, 0, 0, 0.0, PatternType.EMPTY, 0.0, Map.of(), 0, 0.0, 0.0, 0.0);
    }

    public boolean hasCycles() {
        return cycleCount > 0;
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("node_count", nodeCount);
        wire.put("connection_count", connectionCount);
        wire.put("cycle_count", cycleCount);
        wire.put("workflow_depth", workflowDepth);
        wire.put("complexity_score", complexityScore);
        wire.put("pattern_type", patternType.wireName());
        wire.put("parallelism_score", parallelismScore);
        wire.put("node_types", nodeTypes);
        wire.put("has_cycles", hasCycles());
        wire.put("max_cycle_depth", maxCycleDepth);
        wire.put("configuration_complexity", configurationComplexity);
        wire.put("connection_complexity", connectionComplexity);
        wire.put("maintenance_complexity_score", maintenanceComplexityScore);
        return wire;
    }
}
