package com.flowcheck.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Checks for deprecated execution and builder-call patterns.
 */
@Command(
    name = "gold",
    description = "Check gold-standard execution patterns",
    mixinStandardHelpOptions = true
)
public class GoldCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "Python source file")
    private Path sourceFile;

    @Override
    protected int execute() throws IOException {
        String source = readFile(sourceFile);
        return report(createValidator().validateGoldStandards(source));
    }
}
