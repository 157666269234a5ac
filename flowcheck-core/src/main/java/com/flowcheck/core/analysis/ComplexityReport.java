package com.flowcheck.core.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of {@code analyzeComplexity}.
 *
 * <p>When the source cannot be parsed, {@code analyzed} is false, {@code error} holds the
 * syntax error message and every other part is empty.</p>
 *
 * @param analyzed true when the source was analysed
 * @param error failure message, null on success
 * @param metrics structural metrics
 * @param optimizationSuggestions optimisation hints
 * @param bottlenecks performance bottlenecks
 * @param errorRisks patterns likely to fail at run time
 * @param resourceAnalysis resource estimate
 * @param scalability scalability estimate
 */
public record ComplexityReport(
    boolean analyzed,
    String error,
    ComplexityMetrics metrics,
    List<OptimizationHint> optimizationSuggestions,
    List<WorkflowFinding> bottlenecks,
    List<WorkflowFinding> errorRisks,
    ResourceAnalysis resourceAnalysis,
    ScalabilityAnalysis scalability
) {
    public ComplexityReport {
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(resourceAnalysis, "resourceAnalysis must not be null");
        Objects.requireNonNull(scalability, "scalability must not be null");
        optimizationSuggestions = optimizationSuggestions != null ? List.copyOf(optimizationSuggestions) : List.of();
        bottlenecks = bottlenecks != null ? List.copyOf(bottlenecks) : List.of();
        errorRisks = errorRisks != null ? List.copyOf(errorRisks) : List.of();
    }

    /**
     * Report for source that could not be analysed.
     *
     * @param error failure message
     * @return failed report
     */
    public static ComplexityReport failed(String error) {
        return new ComplexityReport(false, error, ComplexityMetrics.empty(), List.of(), List.of(), List.of(),
            ResourceAnalysis.none(), ScalabilityAnalysis.none());
    }

    /**
     * Report for source without workflow constructs.
     *
     * @return empty report
     */
    public static ComplexityReport empty() {
        return new ComplexityReport(true, null, ComplexityMetrics.empty(), List.of(), List.of(), List.of(),
            ResourceAnalysis.none(), ScalabilityAnalysis.none());
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("has_analysis", analyzed);
        if (error != null) {
            wire.put("error", error);
        }
        wire.put("metrics", metrics.toWire());
        wire.put("optimization_suggestions", optimizationSuggestions.stream().map(OptimizationHint::toWire).toList());
        wire.put("bottlenecks", bottlenecks.stream().map(WorkflowFinding::toWire).toList());
        wire.put("error_risks", errorRisks.stream().map(WorkflowFinding::toWire).toList());
        if (analyzed) {
            wire.put("resource_analysis", resourceAnalysis.toWire());
            wire.put("scalability", scalability.toWire());
        }
        return wire;
    }
}
