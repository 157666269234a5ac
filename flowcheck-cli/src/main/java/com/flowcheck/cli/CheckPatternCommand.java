package com.flowcheck.cli;

import com.flowcheck.core.ErrorPatternType;
import com.flowcheck.core.model.PatternCheckResult;
import com.flowcheck.core.model.PatternMatch;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Looks for one family of error patterns.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowcheck check-pattern workflow.py --type circular_deps
 * }</pre>
 */
@Command(
    name = "check-pattern",
    description = "Look for one family of error patterns",
    mixinStandardHelpOptions = true
)
public class CheckPatternCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "Python source file")
    private Path sourceFile;

    @Option(
        names = {"-t", "--type"},
        required = true,
        description = "Pattern family: connection_syntax, parameter_declaration, circular_deps, "
            + "cycle_configuration, imports, execution_pattern"
    )
    private String patternType;

    @Override
    protected int execute() throws IOException {
        if (ErrorPatternType.fromWire(patternType).isEmpty()) {
            log.warn("Unknown pattern type '{}'. Known types: {}", patternType,
                Arrays.stream(ErrorPatternType.values()).map(ErrorPatternType::wireName).toList());
        }

        String source = readFile(sourceFile);
        PatternCheckResult result = createValidator().checkErrorPattern(source, patternType);

        if (format == OutputFormat.JSON) {
            printJson(result.toWire());
        } else {
            PrintWriter out = out();
            if (!result.hasPattern()) {
                out.println("✓ No " + patternType + " problems found");
            }
            for (PatternMatch match : result.matches()) {
                String location = match.line() != null ? "line " + match.line() : "-";
                out.printf("✗ %-7s %-8s %s%n", match.pattern(), location, match.suggestion());
            }
            out.flush();
        }
        return result.hasPattern() ? EXIT_FINDINGS : EXIT_OK;
    }
}
