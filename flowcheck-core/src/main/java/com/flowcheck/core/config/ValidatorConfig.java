package com.flowcheck.core.config;

import com.flowcheck.core.diagnostic.TieBreak;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration for FlowCheck.
 *
 * <p>Loaded from {@code flowcheck.yaml}. Every section is optional; missing sections and
 * values fall back to the defaults returned by {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * cycles:
 *   maxIterationsWarning: 1000
 *
 * connections:
 *   knownFieldNames: [summary, embedding]
 *
 * registry:
 *   nodeTypes:
 *     MyCompanyNode: [endpoint, api_key]
 *
 * analysis:
 *   timeoutSeconds: 10
 *
 * output:
 *   tieBreak: CODE
 * }</pre>
 *
 * @param cycles cycle rule settings
 * @param connections connection rule settings
 * @param registry node-type registry extensions
 * @param analysis pipeline settings
 * @param output diagnostic ordering settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidatorConfig(
    @JsonProperty("cycles") CycleSettings cycles,
    @JsonProperty("connections") ConnectionSettings connections,
    @JsonProperty("registry") RegistrySettings registry,
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("output") OutputSettings output
) {
    public static final int DEFAULT_MAX_ITERATIONS_WARNING = 1000;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public ValidatorConfig {
        cycles = cycles != null ? cycles : new CycleSettings(null);
        connections = connections != null ? connections : new ConnectionSettings(null);
        registry = registry != null ? registry : new RegistrySettings(null);
        analysis = analysis != null ? analysis : new AnalysisSettings(null);
        output = output != null ? output : new OutputSettings(null);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ValidatorConfig defaults() {
        return new ValidatorConfig(null, null, null, null, null);
    }

    /**
     * Cycle rule settings.
     *
     * @param maxIterationsWarning {@code max_iterations} values above this produce a warning
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CycleSettings(
        @JsonProperty("maxIterationsWarning") Integer maxIterationsWarning
    ) {
        public int maxIterationsWarningOrDefault() {
            return maxIterationsWarning != null ? maxIterationsWarning : DEFAULT_MAX_ITERATIONS_WARNING;
        }
    }

    /**
     * Connection rule settings.
     *
     * @param knownFieldNames extra field names accepted by the field-name heuristic
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConnectionSettings(
        @JsonProperty("knownFieldNames") List<String> knownFieldNames
    ) {
        public ConnectionSettings {
            knownFieldNames = knownFieldNames != null ? List.copyOf(knownFieldNames) : List.of();
        }
    }

    /**
     * Node types added to the bundled registry.
     *
     * @param nodeTypes node class names mapped to their required parameters
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegistrySettings(
        @JsonProperty("nodeTypes") Map<String, List<String>> nodeTypes
    ) {
        public RegistrySettings {
            nodeTypes = nodeTypes != null ? Map.copyOf(nodeTypes) : Map.of();
        }
    }

    /**
     * Pipeline settings.
     *
     * @param timeoutSeconds wall-clock limit per validation, 0 disables the limit
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public int timeoutSecondsOrDefault() {
            return timeoutSeconds != null ? Math.max(0, timeoutSeconds) : DEFAULT_TIMEOUT_SECONDS;
        }
    }

    /**
     * Output settings.
     *
     * @param tieBreak ordering among diagnostics on the same line with the same severity
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("tieBreak") TieBreak tieBreak
    ) {
        public OutputSettings {
            tieBreak = tieBreak != null ? tieBreak : TieBreak.CODE;
        }
    }
}
