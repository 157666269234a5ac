package com.flowcheck.core.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fan-out based view of how well a workflow scales out.
 *
 * @param horizontalScalingPotential share of nodes that fan out, capped at 1
 * @param loadDistributionScore average over maximum fan-out, capped at 1
 * @param hasLoadBalancer true when a balancer node type is present
 * @param workerNodeCount nodes whose type names a worker or processor
 * @param bottleneckCount nodes with a fan-out above five
 * @param scalabilityScore mean of the two scores
 */
public record ScalabilityAnalysis(
    double horizontalScalingPotential,
    double loadDistributionScore,
    boolean hasLoadBalancer,
    int workerNodeCount,
    int bottleneckCount,
    double scalabilityScore
) {

    public static ScalabilityAnalysis none() {
        return new ScalabilityAnalysis(0.0, 0.0, false, 0, 0, 0.0);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("horizontal_scaling_potential", horizontalScalingPotential);
        wire.put("load_distribution_score", loadDistributionScore);
        wire.put("has_load_balancer", hasLoadBalancer);
        wire.put("worker_node_count", workerNodeCount);
        wire.put("bottleneck_count", bottleneckCount);
        wire.put("scalability_score", scalabilityScore);
        return wire;
    }
}
