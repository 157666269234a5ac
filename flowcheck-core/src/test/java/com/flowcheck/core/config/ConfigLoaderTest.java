package com.flowcheck.core.config;

import com.flowcheck.core.diagnostic.TieBreak;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("flowcheck.yaml");
        Files.writeString(configFile, """
            cycles:
              maxIterationsWarning: 250

            connections:
              knownFieldNames: [invalid_rows, embedding]

            registry:
              nodeTypes:
                BillingNode: [account_id, currency]

            analysis:
              timeoutSeconds: 5

            output:
              tieBreak: EMISSION
            """);

        ValidatorConfig config = ConfigLoader.load(configFile);

        assertThat(config.cycles().maxIterationsWarningOrDefault()).isEqualTo(250);
        assertThat(config.connections().knownFieldNames()).containsExactly("invalid_rows", "embedding");
        assertThat(config.registry().nodeTypes()).containsEntry("BillingNode", List.of("account_id", "currency"));
        assertThat(config.analysis().timeoutSecondsOrDefault()).isEqualTo(5);
        assertThat(config.output().tieBreak()).isEqualTo(TieBreak.EMISSION);
    }

    @Test
    void load_partialYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowcheck.yaml");
        Files.writeString(configFile, """
            cycles:
              maxIterationsWarning: 50
            """);

        ValidatorConfig config = ConfigLoader.load(configFile);

        assertThat(config.cycles().maxIterationsWarningOrDefault()).isEqualTo(50);
        assertThat(config.connections().knownFieldNames()).isEmpty();
        assertThat(config.registry().nodeTypes()).isEmpty();
        assertThat(config.analysis().timeoutSecondsOrDefault()).isEqualTo(ValidatorConfig.DEFAULT_TIMEOUT_SECONDS);
        assertThat(config.output().tieBreak()).isEqualTo(TieBreak.CODE);
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("flowcheck.yaml");
        Files.writeString(configFile, """
            project:
              name: something
            cycles:
              maxIterationsWarning: 10
              flavour: strict
            """);

        ValidatorConfig config = ConfigLoader.load(configFile);

        assertThat(config.cycles().maxIterationsWarningOrDefault()).isEqualTo(10);
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ValidatorConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowcheck.yaml");
        Files.writeString(configFile, """
            cycles: [unclosed
              maxIterationsWarning: : :
            """);

        ValidatorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowcheck.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void defaults_negativeTimeout_isClampedToZero() {
        ValidatorConfig.AnalysisSettings settings = new ValidatorConfig.AnalysisSettings(-3);

        assertThat(settings.timeoutSecondsOrDefault()).isZero();
    }
}
