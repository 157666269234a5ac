package com.flowcheck.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Checks custom node classes and {@code add_node} configurations for parameter problems.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowcheck check-params nodes.py
 * }</pre>
 */
@Command(
    name = "check-params",
    description = "Check node parameter declarations only",
    mixinStandardHelpOptions = true
)
public class CheckParamsCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "Python source file")
    private Path sourceFile;

    @Override
    protected int execute() throws IOException {
        String source = readFile(sourceFile);
        return report(createValidator().checkNodeParameters(source));
    }
}
