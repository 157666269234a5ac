package com.flowcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Static reference entry describing a recommended workflow pattern.
 *
 * @param name pattern identifier, e.g. {@code "basic_workflow"}
 * @param description what the pattern shows
 * @param codeExample example source
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationPattern(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("code_example") String codeExample
) {
    public ValidationPattern {
        Objects.requireNonNull(name, "name must not be null");
        description = description != null ? description : "";
        codeExample = codeExample != null ? codeExample : "";
    }
}
