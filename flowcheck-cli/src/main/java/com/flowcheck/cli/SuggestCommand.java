package com.flowcheck.cli;

import com.flowcheck.core.WireFormat;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.Suggestion;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Suggests fixes for diagnostics given as a JSON array in wire form.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowcheck validate workflow.py --format json | jq '.errors' > errors.json
 * flowcheck suggest errors.json
 * }</pre>
 */
@Command(
    name = "suggest",
    description = "Suggest fixes for a JSON array of diagnostics",
    mixinStandardHelpOptions = true
)
public class SuggestCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "JSON file with the diagnostic array")
    private Path diagnosticsFile;

    @Override
    protected int execute() throws IOException {
        List<Diagnostic> diagnostics = WireFormat.readDiagnostics(readFile(diagnosticsFile));
        List<Suggestion> suggestions = createValidator().suggestFixes(diagnostics);

        if (format == OutputFormat.JSON) {
            printJson(suggestions.stream().map(Suggestion::toWire).toList());
            return EXIT_OK;
        }

        PrintWriter out = out();
        for (Suggestion suggestion : suggestions) {
            out.printf("[%s] %s%n", suggestion.errorCode(), suggestion.description());
            out.printf("Fix: %s%n", suggestion.fix());
            out.println();
            out.println(suggestion.codeExample());
            out.println();
            out.println(suggestion.explanation());
            out.println();
        }
        out.flush();
        return EXIT_OK;
    }
}
