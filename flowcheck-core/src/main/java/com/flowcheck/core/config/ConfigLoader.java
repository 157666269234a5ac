package com.flowcheck.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the optional {@code flowcheck.yaml} that tunes cycle limits, known field names,
 * extra node types, the pipeline timeout and diagnostic ordering.
 *
 * <p>Configuration never blocks validation: a missing, unreadable, empty or malformed
 * file yields {@link ValidatorConfig#defaults()}. Unknown keys are ignored, so a file
 * written for a newer release still loads.</p>
 *
 * <pre>{@code
 * ValidatorConfig config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_FILE_NAME));
 * WorkflowValidator validator = new WorkflowValidator(config);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "flowcheck.yaml";

    /**
     * @param configPath location of the YAML file, may be null
     * @return the parsed settings, or defaults when the file cannot be used
     */
    public static ValidatorConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("No FlowCheck config at {}, validating with built-in settings", configPath);
            return ValidatorConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("FlowCheck config {} is not a readable file, validating with built-in settings", configPath);
            return ValidatorConfig.defaults();
        }

        try {
            ValidatorConfig config = YAML_MAPPER.readValue(configPath.toFile(), ValidatorConfig.class);
            if (config == null) {
                log.warn("FlowCheck config {} is empty, validating with built-in settings", configPath);
                return ValidatorConfig.defaults();
            }
            log.info("Using FlowCheck config {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Ignoring FlowCheck config {}: {}", configPath, e.getMessage());
            return ValidatorConfig.defaults();
        }
    }
}
