package com.flowcheck.core.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Performance bottleneck or error risk spotted by the complexity analyzer.
 *
 * @param type finding kind, e.g. {@code "sequential_llm_calls"}
 * @param severity {@code "high"}, {@code "medium"} or {@code "low"}
 * @param description what was found
 * @param suggestion how to address it
 * @param affectedNodes node ids involved
 */
public record WorkflowFinding(
    String type,
    String severity,
    String description,
    String suggestion,
    List<String> affectedNodes
) {
    public WorkflowFinding {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        affectedNodes = affectedNodes != null ? List.copyOf(affectedNodes) : List.of();
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type);
        wire.put("severity", severity);
        wire.put("description", description);
        wire.put("suggestion", suggestion);
        wire.put("affected_nodes", affectedNodes);
        return wire;
    }
}
