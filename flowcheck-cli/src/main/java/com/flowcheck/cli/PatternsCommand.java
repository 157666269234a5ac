package com.flowcheck.cli;

import com.flowcheck.core.model.ValidationPattern;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prints the recommended workflow patterns.
 */
@Command(
    name = "patterns",
    description = "Print recommended workflow patterns",
    mixinStandardHelpOptions = true
)
public class PatternsCommand extends AbstractFlowCheckCommand {

    @Override
    protected int execute() throws IOException {
        List<ValidationPattern> patterns = createValidator().getValidationPatterns();

        if (format == OutputFormat.JSON) {
            printJson(patterns.stream().map(PatternsCommand::toWire).toList());
            return EXIT_OK;
        }

        PrintWriter out = out();
        for (ValidationPattern pattern : patterns) {
            out.printf("• %s - %s%n", pattern.name(), pattern.description());
            out.println();
            out.println(pattern.codeExample().indent(4).stripTrailing());
            out.println();
        }
        out.flush();
        return EXIT_OK;
    }

    private static Map<String, Object> toWire(ValidationPattern pattern) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("name", pattern.name());
        wire.put("description", pattern.description());
        wire.put("code_example", pattern.codeExample());
        return wire;
    }
}
