package com.flowcheck.core.validator.impl;

import com.flowcheck.core.ir.ConnectionDeclaration;
import com.flowcheck.core.ir.CycleDefinition;
import com.flowcheck.core.ir.CycleEdge;
import com.flowcheck.core.ir.CycleSetting;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCategory;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.validator.AbstractRuleValidator;
import com.flowcheck.core.validator.ValidationContext;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates declared cycles independently of the acyclicity check on ordinary connections.
 *
 * <ul>
 *   <li>{@code CYC001} legacy {@code cycle=} keyword on {@code add_connection}</li>
 *   <li>{@code CYC002} neither {@code max_iterations} nor {@code converge_when}</li>
 *   <li>{@code CYC003} invalid convergence expression</li>
 *   <li>{@code CYC004} cycle without edges</li>
 *   <li>{@code CYC005} edge mapping that is not a dict of field names</li>
 *   <li>{@code CYC006} {@code max_iterations} above the configured warning level</li>
 *   <li>{@code CYC007} timeout that is not a positive number</li>
 *   <li>{@code CYC008} edge endpoint that names an undeclared node</li>
 * </ul>
 */
public class CycleValidator extends AbstractRuleValidator {

    static final String CYCLE_NAME = "cycle_name";

    @Override
    public String getId() {
        return "cycles";
    }

    @Override
    public String getDisplayName() {
        return "Cycle Validator";
    }

    @Override
    public DiagnosticCategory getCategory() {
        return DiagnosticCategory.CYCLE;
    }

    @Override
    protected List<Diagnostic> check(ValidationContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (ConnectionDeclaration connection : context.ir().connections()) {
            if (connection.cycleEdge()) {
                diagnostics.add(diagnostic(DiagnosticCode.CYC001,
                    "Deprecated 'cycle=True' parameter detected. Use workflow.create_cycle() API instead",
                    connection.line(),
                    context("source", connection.sourceNode(), "target", connection.targetNode())));
            }
        }

        int maxIterationsWarning = context.config().cycles().maxIterationsWarningOrDefault();
        for (CycleDefinition cycle : context.ir().cycles()) {
            checkConfiguration(cycle, maxIterationsWarning, diagnostics);
            checkEdges(cycle, context, diagnostics);
        }
        return diagnostics;
    }

    private void checkConfiguration(CycleDefinition cycle, int maxIterationsWarning, List<Diagnostic> diagnostics) {
        String name = cycle.name();

        if (cycle.maxIterations() == null && cycle.convergeWhen() == null) {
            diagnostics.add(diagnostic(DiagnosticCode.CYC002,
                "Cycle '" + name + "' missing required configuration: must have either max_iterations() or converge_when()",
                cycle.line(),
                context(CYCLE_NAME, name)));
        }

        CycleSetting convergeWhen = cycle.convergeWhen();
        if (convergeWhen != null) {
            if (!(convergeWhen.value() instanceof String condition)) {
                diagnostics.add(diagnostic(DiagnosticCode.CYC003,
                    "Cycle '" + name + "' has invalid convergence condition syntax",
                    convergeWhen.line(),
                    context(CYCLE_NAME, name)));
            } else if (!ConvergenceExpressionChecker.isValid(condition)) {
                diagnostics.add(diagnostic(DiagnosticCode.CYC003,
                    "Cycle '" + name + "' has invalid convergence condition: '" + condition + "'",
                    convergeWhen.line(),
                    context(CYCLE_NAME, name, "condition", condition)));
            }
        }

        CycleSetting timeout = cycle.timeout();
        if (timeout != null) {
            if (!isNumber(timeout.value())) {
                diagnostics.add(diagnostic(DiagnosticCode.CYC007,
                    "Cycle '" + name + "' has invalid timeout value",
                    timeout.line(),
                    context(CYCLE_NAME, name)));
            } else if (signum((Number) timeout.value()) <= 0) {
                diagnostics.add(diagnostic(DiagnosticCode.CYC007,
                    "Cycle '" + name + "' has invalid timeout value: must be positive",
                    timeout.line(),
                    context(CYCLE_NAME, name, "timeout", timeout.value())));
            }
        }

        CycleSetting maxIterations = cycle.maxIterations();
        if (maxIterations != null && isNumber(maxIterations.value())
            && exceeds((Number) maxIterations.value(), maxIterationsWarning)) {
            diagnostics.add(diagnostic(DiagnosticCode.CYC006,
                "Cycle '" + name + "' has high max_iterations (" + maxIterations.value()
                    + "). Consider using converge_when() for better performance",
                maxIterations.line(),
                context(CYCLE_NAME, name, "max_iterations", maxIterations.value())));
        }
    }

    private void checkEdges(CycleDefinition cycle, ValidationContext context, List<Diagnostic> diagnostics) {
        String name = cycle.name();
        if (cycle.edges().isEmpty()) {
            diagnostics.add(diagnostic(DiagnosticCode.CYC004,
                "Cycle '" + name + "' has no connections defined",
                cycle.line(),
                context(CYCLE_NAME, name)));
            return;
        }

        for (CycleEdge edge : cycle.edges()) {
            if (edge.mappingGiven() && !isFieldMapping(edge.mapping())) {
                diagnostics.add(diagnostic(DiagnosticCode.CYC005,
                    "Cycle '" + name + "' connection has invalid mapping format: must be a dictionary",
                    edge.line(),
                    context(CYCLE_NAME, name)));
            }
            for (String endpoint : new String[] {edge.source(), edge.target()}) {
                if (endpoint != null && !context.graph().containsNode(endpoint)) {
                    diagnostics.add(diagnostic(DiagnosticCode.CYC008,
                        "Cycle '" + name + "' references non-existent node '" + endpoint + "'",
                        edge.line(),
                        context(CYCLE_NAME, name, "node_name", endpoint, Diagnostic.NODE_ID, endpoint)));
                }
            }
        }
    }

    private static boolean isFieldMapping(Object mapping) {
        if (!(mapping instanceof Map<?, ?> map)) {
            return false;
        }
        return map.entrySet().stream()
            .allMatch(entry -> entry.getKey() instanceof String && entry.getValue() instanceof String);
    }

    private static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    private static boolean exceeds(Number number, int limit) {
        if (number instanceof BigInteger big) {
            return big.compareTo(BigInteger.valueOf(limit)) > 0;
        }
        if (number instanceof Double d) {
            return d > limit;
        }
        return number.longValue() > limit;
    }

    private static int signum(Number number) {
        if (number instanceof BigInteger big) {
            return big.signum();
        }
        if (number instanceof Double d) {
            return d.isNaN() ? 0 : (int) Math.signum(d);
        }
        return Long.signum(number.longValue());
    }
}
