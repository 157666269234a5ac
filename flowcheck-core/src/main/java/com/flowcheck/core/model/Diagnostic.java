package com.flowcheck.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A single validator finding.
 *
 * <p>Diagnostics are immutable. The {@code context} map keeps insertion order so the
 * wire form is stable; well-known keys are {@link #NODE_ID}, {@link #NODE_TYPE} and
 * {@link #PARAMETER}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Diagnostic diagnostic = Diagnostic.of(
 *     DiagnosticCode.PAR004,
 *     "Node 'agent' (LLMAgentNode) is missing required parameter 'model'",
 *     4,
 *     Map.of(Diagnostic.NODE_ID, "agent", Diagnostic.PARAMETER, "model"));
 * }</pre>
 *
 * @param code stable diagnostic code, e.g. {@code "CON005"}
 * @param message human-readable description
 * @param severity severity level
 * @param line 1-based source line, or null when the finding has no location
 * @param context additional structured data about the finding
 */
public record Diagnostic(
    String code,
    String message,
    Severity severity,
    Integer line,
    Map<String, Object> context
) {
    public static final String NODE_ID = "node_id";
    public static final String NODE_TYPE = "node_type";
    public static final String PARAMETER = "parameter";

    private static final Set<String> RESERVED_WIRE_KEYS = Set.of("code", "message", "severity", "line");

    public Diagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        context = context != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
            : Map.of();
    }

    /**
     * Creates a diagnostic with the catalog severity of {@code code}.
     *
     * @param code catalog code
     * @param message message text
     * @param line source line, may be null
     * @param context structured context, may be null
     * @return new diagnostic
     */
    public static Diagnostic of(DiagnosticCode code, String message, Integer line, Map<String, Object> context) {
        return new Diagnostic(code.name(), message, code.defaultSeverity(), line, context);
    }

    /**
     * Creates a diagnostic without context.
     *
     * @param code catalog code
     * @param message message text
     * @param line source line, may be null
     * @return new diagnostic
     */
    public static Diagnostic of(DiagnosticCode code, String message, Integer line) {
        return of(code, message, line, Map.of());
    }

    /**
     * Resolves this diagnostic's code against the closed catalog.
     *
     * @return catalog code, empty for foreign codes supplied by callers
     */
    public Optional<DiagnosticCode> knownCode() {
        return DiagnosticCode.lookup(code);
    }

    public DiagnosticCategory category() {
        return DiagnosticCategory.ofCode(code);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Returns a context value as a string.
     *
     * @param key context key
     * @return value, or null when absent
     */
    public String contextValue(String key) {
        Object value = context.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Converts to the flat wire map: {@code code}, {@code message}, {@code severity},
     * optional {@code line}, then every context entry.
     *
     * @return ordered wire representation
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("code", code);
        wire.put("message", message);
        wire.put("severity", severity.wireName());
        if (line != null) {
            wire.put("line", line);
        }
        context.forEach((key, value) -> {
            if (!RESERVED_WIRE_KEYS.contains(key) && value != null) {
                wire.put(key, value);
            }
        });
        return wire;
    }

    /**
     * Reads a diagnostic from its wire map. Missing fields fall back to empty values
     * so that caller-supplied diagnostics never fail to load.
     *
     * @param wire wire map
     * @return diagnostic
     */
    public static Diagnostic fromWire(Map<String, ?> wire) {
        Objects.requireNonNull(wire, "wire must not be null");
        Object code = wire.get("code");
        Object message = wire.get("message");
        Object line = wire.get("line");

        Map<String, Object> context = new LinkedHashMap<>();
        wire.forEach((key, value) -> {
            if (!RESERVED_WIRE_KEYS.contains(key) && value != null) {
                context.put(key, value);
            }
        });

        return new Diagnostic(
            code != null ? code.toString() : "",
            message != null ? message.toString() : "",
            Severity.fromWire(wire.get("severity") != null ? wire.get("severity").toString() : null),
            line instanceof Number number ? Integer.valueOf(number.intValue()) : null,
            context
        );
    }
}
