package com.flowcheck;

import com.flowcheck.cli.CheckParamsCommand;
import com.flowcheck.cli.CheckPatternCommand;
import com.flowcheck.cli.ComplexityCommand;
import com.flowcheck.cli.ConnectionsCommand;
import com.flowcheck.cli.GoldCommand;
import com.flowcheck.cli.ImportsCommand;
import com.flowcheck.cli.PatternsCommand;
import com.flowcheck.cli.SuggestCommand;
import com.flowcheck.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for FlowCheck.
 *
 * <p>FlowCheck statically validates Python workflow definitions built with
 * {@code WorkflowBuilder} and reports missing parameters, malformed connections,
 * unbounded cycles, import problems and deprecated execution patterns.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Run every check on a workflow file</li>
 *   <li>{@code check-params} - Check node parameter declarations only</li>
 *   <li>{@code connections} - Validate a JSON list of connections</li>
 *   <li>{@code gold} - Check gold-standard execution patterns</li>
 *   <li>{@code imports} - Check imports only</li>
 *   <li>{@code check-pattern} - Look for one family of error patterns</li>
 *   <li>{@code suggest} - Suggest fixes for a JSON list of diagnostics</li>
 *   <li>{@code patterns} - Print recommended workflow patterns</li>
 *   <li>{@code complexity} - Analyse workflow complexity</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate a workflow
 * flowcheck validate workflow.py
 *
 * # Machine-readable output
 * flowcheck validate workflow.py --format json
 *
 * # Only look for cycle problems
 * flowcheck check-pattern workflow.py --type cycle_configuration
 * }</pre>
 */
@Command(
    name = "flowcheck",
    mixinStandardHelpOptions = true,
    version = "FlowCheck 1.0.0-SNAPSHOT",
    description = "Static validator for Python workflow definitions",
    subcommands = {
        ValidateCommand.class,
        CheckParamsCommand.class,
        ConnectionsCommand.class,
        GoldCommand.class,
        ImportsCommand.class,
        CheckPatternCommand.class,
        SuggestCommand.class,
        PatternsCommand.class,
        ComplexityCommand.class
    }
)
public class FlowCheckCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FlowCheckCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("FlowCheck - Static validator for Python workflow definitions");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'flowcheck --help' to see available commands");
        System.out.println("Use 'flowcheck <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        FlowCheckCLI cli = new FlowCheckCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
