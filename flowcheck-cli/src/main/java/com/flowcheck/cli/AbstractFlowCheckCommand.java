package com.flowcheck.cli;

import com.flowcheck.core.WireFormat;
import com.flowcheck.core.WorkflowValidator;
import com.flowcheck.core.config.ConfigLoader;
import com.flowcheck.core.config.ValidatorConfig;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.Suggestion;
import com.flowcheck.core.model.ValidationResponse;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Shared options and output handling for FlowCheck commands.
 *
 * <p>Exit codes: {@value #EXIT_OK} when nothing is wrong, {@value #EXIT_FINDINGS} when
 * errors are reported, {@value #EXIT_IO_FAILURE} when an input cannot be read.</p>
 */
public abstract class AbstractFlowCheckCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_IO_FAILURE = 2;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Spec
    protected CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: flowcheck.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "TEXT"
    )
    protected OutputFormat format;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage());
            err().println("✗ Failed to read input: " + e.getMessage());
            return EXIT_IO_FAILURE;
        }
    }

    /**
     * Runs the command.
     *
     * @return exit code
     * @throws IOException if an input file cannot be read or parsed
     */
    protected abstract int execute() throws IOException;

    protected WorkflowValidator createValidator() {
        log.debug("Loading configuration from: {}", configPath);
        ValidatorConfig config = ConfigLoader.load(configPath);
        return new WorkflowValidator(config);
    }

    protected String readFile(Path file) throws IOException {
        log.info("Reading {}", file);
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    protected void printJson(Object wire) throws IOException {
        out().println(WireFormat.toJson(wire));
        out().flush();
    }

    /**
     * Prints a validation response in the selected format.
     *
     * @param response response to print
     * @return exit code derived from the response
     * @throws IOException if JSON serialization fails
     */
    protected int report(ValidationResponse response) throws IOException {
        if (format == OutputFormat.JSON) {
            printJson(response.toWire());
        } else {
            printText(response);
        }
        return response.hasErrors() ? EXIT_FINDINGS : EXIT_OK;
    }

    private void printText(ValidationResponse response) {
        PrintWriter out = out();
        if (response.errors().isEmpty() && response.warnings().isEmpty()) {
            out.println("✓ No problems found");
            out.flush();
            return;
        }

        response.errors().forEach(diagnostic -> out.println(formatDiagnostic(diagnostic)));
        response.warnings().forEach(diagnostic -> out.println(formatDiagnostic(diagnostic)));

        if (!response.suggestions().isEmpty()) {
            out.println();
            out.println("Suggestions:");
            response.suggestions().forEach(suggestion -> printSuggestion(out, suggestion));
        }

        out.println();
        out.printf("%d error(s), %d warning(s)%n", response.errors().size(), response.warnings().size());
        out.flush();
    }

    protected static String formatDiagnostic(Diagnostic diagnostic) {
        String location = diagnostic.line() != null ? "line " + diagnostic.line() : "-";
        String marker = diagnostic.isError() ? "✗" : "⚠";
        return String.format("%s %-7s %-8s %s", marker, diagnostic.code(), location, diagnostic.message());
    }

    protected static void printSuggestion(PrintWriter out, Suggestion suggestion) {
        out.printf("  • [%s] %s%n", suggestion.errorCode(), suggestion.description());
        out.printf("    Fix: %s%n", suggestion.fix());
    }
}
