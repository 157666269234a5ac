package com.flowcheck.core.registry;

import com.flowcheck.core.model.ValidationPattern;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Recommended workflow patterns bundled in {@code flowcheck/validation-patterns.yaml}.
 */
public final class ValidationPatternCatalog {

    private static final Logger log = LoggerFactory.getLogger(ValidationPatternCatalog.class);
    static final String RESOURCE = "flowcheck/validation-patterns.yaml";

    private ValidationPatternCatalog() {
        // Utility class - no instantiation
    }

    /**
     * Returns the bundled patterns in file order.
     *
     * @return immutable pattern list
     */
    public static List<ValidationPattern> patterns() {
        return Holder.PATTERNS;
    }

    private static List<ValidationPattern> load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = ValidationPatternCatalog.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource: " + RESOURCE);
            }
            PatternsDocument document = mapper.readValue(in, PatternsDocument.class);
            List<ValidationPattern> patterns = document.patterns() != null ? List.copyOf(document.patterns()) : List.of();
            log.debug("Loaded {} validation patterns", patterns.size());
            return patterns;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled resource: " + RESOURCE, e);
        }
    }

    private static final class Holder {
        private static final List<ValidationPattern> PATTERNS = load();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PatternsDocument(@JsonProperty("patterns") List<ValidationPattern> patterns) {
    }
}
