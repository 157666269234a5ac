package com.flowcheck.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Check imports only.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowcheck imports workflow.py --format json
 * }</pre>
 */
@Command(
    name = "imports",
    description = "Check imports only",
    mixinStandardHelpOptions = true
)
public class ImportsCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "Python source file")
    private Path sourceFile;

    @Override
    protected int execute() throws IOException {
        String source = readFile(sourceFile);
        return report(createValidator().validateImports(source));
    }
}
