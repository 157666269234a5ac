package com.flowcheck.core.analysis;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structural optimisation the workflow could benefit from.
 *
 * @param type hint kind, e.g. {@code "add_caching"}
 * @param priority {@code "high"}, {@code "medium"} or {@code "low"}
 * @param description what triggered the hint
 * @param suggestion what to change
 * @param potentialImprovement rough expected gain
 */
public record OptimizationHint(
    String type,
    String priority,
    String description,
    String suggestion,
    String potentialImprovement
) {
    public OptimizationHint {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type);
        wire.put("priority", priority);
        wire.put("description", description);
        wire.put("suggestion", suggestion);
        wire.put("potential_improvement", potentialImprovement);
        return wire;
    }
}
