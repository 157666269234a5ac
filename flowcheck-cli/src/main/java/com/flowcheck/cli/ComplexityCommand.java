package com.flowcheck.cli;

import com.flowcheck.core.analysis.ComplexityMetrics;
import com.flowcheck.core.analysis.ComplexityReport;
import com.flowcheck.core.analysis.OptimizationHint;
import com.flowcheck.core.analysis.WorkflowFinding;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;

/**
 * Analyses workflow size, shape and likely bottlenecks.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowcheck complexity workflow.py
 * }</pre>
 */
@Command(
    name = "complexity",
    description = "Analyse workflow complexity and suggest optimisations",
    mixinStandardHelpOptions = true
)
public class ComplexityCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "Python source file")
    private Path sourceFile;

    @Override
    protected int execute() throws IOException {
        ComplexityReport report = createValidator().analyzeComplexity(readFile(sourceFile));

        if (format == OutputFormat.JSON) {
            printJson(report.toWire());
        } else {
            printText(report);
        }
        return report.analyzed() ? EXIT_OK : EXIT_FINDINGS;
    }

    private void printText(ComplexityReport report) {
        PrintWriter out = out();
        if (!report.analyzed()) {
            out.println("✗ " + report.error());
            out.flush();
            return;
        }

        ComplexityMetrics metrics = report.metrics();
        out.println("Workflow Complexity");
        out.printf("  Nodes:            %d%n", metrics.nodeCount());
        out.printf("  Connections:      %d%n", metrics.connectionCount());
        out.printf("  Cycles:           %d%n", metrics.cycleCount());
        out.printf("  Depth:            %d%n", metrics.workflowDepth());
        out.printf("  Pattern:          %s%n", metrics.patternType().wireName());
        out.printf("  Complexity score: %.2f%n", metrics.complexityScore());
        out.printf("  Parallelism:      %.2f%n", metrics.parallelismScore());

        if (!report.bottlenecks().isEmpty()) {
            out.println();
            out.println("Bottlenecks:");
            report.bottlenecks().forEach(finding -> printFinding(out, finding));
        }
        if (!report.errorRisks().isEmpty()) {
            out.println();
            out.println("Error risks:");
            report.errorRisks().forEach(finding -> printFinding(out, finding));
        }
        if (!report.optimizationSuggestions().isEmpty()) {
            out.println();
            out.println("Optimisations:");
            for (OptimizationHint hint : report.optimizationSuggestions()) {
                out.printf("  • [%s] %s - %s%n", hint.priority(), hint.description(), hint.suggestion());
            }
        }
        out.flush();
    }

    private static void printFinding(PrintWriter out, WorkflowFinding finding) {
        out.printf("  • [%s] %s - %s%n", finding.severity(), finding.description(), finding.suggestion());
    }
}
