package com.flowcheck.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Run every check on a workflow file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Validate a workflow
 * flowcheck validate workflow.py
 *
 * # Use a project configuration
 * flowcheck validate workflow.py -c ci/flowcheck.yaml
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Run every check on a workflow file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "Python source file")
    private Path sourceFile;

    @Override
    protected int execute() throws IOException {
        String source = readFile(sourceFile);
        return report(createValidator().validateWorkflow(source));
    }
}
