package com.flowcheck.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of checking source for one family of error patterns.
 *
 * @param hasPattern true when at least one match was found
 * @param matches the matches in diagnostic order
 */
public record PatternCheckResult(boolean hasPattern, List<PatternMatch> matches) {

    public PatternCheckResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static PatternCheckResult none() {
        return new PatternCheckResult(false, List.of());
    }

    public static PatternCheckResult of(List<PatternMatch> matches) {
        return new PatternCheckResult(!matches.isEmpty(), matches);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("has_pattern", hasPattern);
        wire.put("matches", matches.stream().map(PatternMatch::toWire).toList());
        return wire;
    }
}
