package com.flowcheck.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Result of a validation operation.
 *
 * <p>{@code errors} holds error-severity diagnostics; {@code warnings} holds the
 * warning and informational ones. Both lists keep the aggregator's order.</p>
 *
 * @param hasErrors true when at least one diagnostic has error severity
 * @param errors error diagnostics
 * @param warnings warning and info diagnostics
 * @param suggestions one suggestion per distinct code
 */
public record ValidationResponse(
    boolean hasErrors,
    List<Diagnostic> errors,
    List<Diagnostic> warnings,
    List<Suggestion> suggestions
) {
    public ValidationResponse {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    /**
     * Response for source with no findings.
     *
     * @return empty response
     */
    public static ValidationResponse empty() {
        return new ValidationResponse(false, List.of(), List.of(), List.of());
    }

    /**
     * All diagnostics, errors first then warnings.
     *
     * @return combined list
     */
    public List<Diagnostic> diagnostics() {
        return Stream.concat(errors.stream(), warnings.stream()).toList();
    }

    /**
     * Distinct codes reported, in the order they appear in {@link #diagnostics()}.
     *
     * @return codes
     */
    public List<String> codes() {
        return diagnostics().stream().map(Diagnostic::code).distinct().toList();
    }

    /**
     * Converts to the wire map {@code {has_errors, errors, warnings, suggestions}}.
     *
     * @return ordered wire representation
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("has_errors", hasErrors);
        wire.put("errors", errors.stream().map(Diagnostic::toWire).toList());
        wire.put("warnings", warnings.stream().map(Diagnostic::toWire).toList());
        wire.put("suggestions", suggestions.stream().map(Suggestion::toWire).toList());
        return wire;
    }
}
