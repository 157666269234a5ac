package com.flowcheck.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Human-readable remediation derived from a diagnostic code.
 *
 * @param errorCode the code this suggestion addresses
 * @param description what is wrong
 * @param fix one-line fix
 * @param codeExample corrected code
 * @param explanation why the fix is needed
 */
public record Suggestion(
    String errorCode,
    String description,
    String fix,
    String codeExample,
    String explanation
) {
    public Suggestion {
        Objects.requireNonNull(errorCode, "errorCode must not be null");
        description = description != null ? description : "";
        fix = fix != null ? fix : "";
        codeExample = codeExample != null ? codeExample : "";
        explanation = explanation != null ? explanation : "";
    }

    /**
     * Converts to the wire map {@code {error_code, description, fix, code_example, explanation}}.
     *
     * @return ordered wire representation
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("error_code", errorCode);
        wire.put("description", description);
        wire.put("fix", fix);
        wire.put("code_example", codeExample);
        wire.put("explanation", explanation);
        return wire;
    }
}
