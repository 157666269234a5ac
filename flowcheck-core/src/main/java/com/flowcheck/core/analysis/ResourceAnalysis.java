package com.flowcheck.core.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rough resource estimate derived from node types.
 *
 * @param memoryIntensiveNodes nodes of memory-heavy types
 * @param cpuIntensiveNodes nodes of CPU-heavy types
 * @param estimatedMemoryMb estimated memory in megabytes
 * @param estimatedCpuCores estimated cores
 * @param resourceEfficiencyScore ratio in {@code [0, 1]}
 */
public record ResourceAnalysis(
    int memoryIntensiveNodes,
    int cpuIntensiveNodes,
    int estimatedMemoryMb,
    int estimatedCpuCores,
    double resourceEfficiencyScore
) {

    public static ResourceAnalysis none() {
        return new ResourceAnalysis(0, 0, 0, 1, 0.0);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("memory_intensive_nodes", memoryIntensiveNodes);
        wire.put("cpu_intensive_nodes", cpuIntensiveNodes);
        wire.put("estimated_memory_usage", estimatedMemoryMb);
        wire.put("estimated_cpu_cores", estimatedCpuCores);
        wire.put("resource_efficiency_score", resourceEfficiencyScore);
        return wire;
    }
}
