package com.flowcheck.core.validator.impl;

import com.flowcheck.core.graph.DanglingEndpoint;
import com.flowcheck.core.graph.EndpointRole;
import com.flowcheck.core.graph.GraphCycle;
import com.flowcheck.core.ir.ConnectionDeclaration;
import com.flowcheck.core.ir.ConnectionShape;
import com.flowcheck.core.ir.NodeDeclaration;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCategory;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.validator.AbstractRuleValidator;
import com.flowcheck.core.validator.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks connection declarations and the shape of the workflow graph.
 *
 * <ul>
 *   <li>{@code CON001} connection with an argument count other than 2 or 4</li>
 *   <li>{@code CON002} deprecated two-argument connection</li>
 *   <li>{@code CON003}/{@code CON004} endpoint naming an undeclared node</li>
 *   <li>{@code CON005} circular dependency among ordinary connections, once per cycle</li>
 *   <li>{@code CON006}/{@code CON007} suspicious output/input field name (warnings)</li>
 *   <li>{@code CON008} node id declared twice</li>
 * </ul>
 */
public class ConnectionValidator extends AbstractRuleValidator {

    private final FieldNameHeuristic fixedHeuristic;

    /**
     * Uses {@link AllowListFieldNameHeuristic} extended with the configured field names.
     */
    public ConnectionValidator() {
        this.fixedHeuristic = null;
    }

    /**
     * Uses a fixed heuristic regardless of configuration.
     *
     * @param heuristic field-name heuristic
     */
    public ConnectionValidator(FieldNameHeuristic heuristic) {
        this.fixedHeuristic = Objects.requireNonNull(heuristic, "heuristic must not be null");
    }

    @Override
    public String getId() {
        return "connections";
    }

    @Override
    public String getDisplayName() {
        return "Connection Validator";
    }

    @Override
    public DiagnosticCategory getCategory() {
        return DiagnosticCategory.CONNECTION;
    }

    @Override
    protected List<Diagnostic> check(ValidationContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        FieldNameHeuristic heuristic = fixedHeuristic != null
            ? fixedHeuristic
            : new AllowListFieldNameHeuristic(context.config().connections().knownFieldNames());

        for (NodeDeclaration duplicate : context.ir().duplicateNodes()) {
            int firstLine = context.graph().node(duplicate.id()).map(NodeDeclaration::line).orElse(0);
            diagnostics.add(diagnostic(DiagnosticCode.CON008,
                "Node id '" + duplicate.id() + "' is already declared on line " + firstLine,
                duplicate.line(),
                context(Diagnostic.NODE_ID, duplicate.id(), Diagnostic.NODE_TYPE, duplicate.className())));
        }

        for (ConnectionDeclaration connection : context.ir().connections()) {
            checkConnection(connection, heuristic, diagnostics);
        }

        for (DanglingEndpoint endpoint : context.graph().danglingEndpoints()) {
            boolean source = endpoint.role() == EndpointRole.SOURCE;
            diagnostics.add(diagnostic(source ? DiagnosticCode.CON003 : DiagnosticCode.CON004,
                "Connection references non-existent " + (source ? "source" : "target")
                    + " node '" + endpoint.nodeId() + "'",
                endpoint.connection().line(),
                context(source ? "source" : "target", endpoint.nodeId(), Diagnostic.NODE_ID, endpoint.nodeId())));
        }

        for (GraphCycle cycle : context.graph().cycles()) {
            diagnostics.add(diagnostic(DiagnosticCode.CON005,
                "Circular dependency detected in workflow connections: " + cycle.describe(),
                cycle.line(),
                context(Diagnostic.NODE_ID, cycle.anchor(), "cycle_nodes", cycle.members())));
        }
        return diagnostics;
    }

    private void checkConnection(ConnectionDeclaration connection, FieldNameHeuristic heuristic, List<Diagnostic> diagnostics) {
        if (connection.shape() == ConnectionShape.TWO_ARGUMENT) {
            String source = display(connection.sourceNode(), "source");
            String target = display(connection.targetNode(), "target");
            diagnostics.add(diagnostic(DiagnosticCode.CON002,
                "Connection uses old 2-parameter syntax. Use: add_connection('" + source
                    + "', 'output', '" + target + "', 'input')",
                connection.line(),
                context("source", connection.sourceNode(), "target", connection.targetNode())));
            return;
        }
        if (connection.shape() == ConnectionShape.INVALID_ARITY) {
            diagnostics.add(diagnostic(DiagnosticCode.CON001,
                "Invalid connection: expected 4 parameters (source, output, target, input), got "
                    + connection.argumentCount(),
                connection.line(),
                context("arg_count", connection.argumentCount())));
            return;
        }

        if (heuristic.isSuspicious(connection.sourceOutput())) {
            diagnostics.add(diagnostic(DiagnosticCode.CON006,
                "Connection uses suspicious output field '" + connection.sourceOutput()
                    + "' - check if this field exists on source node",
                connection.line(),
                context("source", connection.sourceNode(), "output", connection.sourceOutput())));
        }
        if (heuristic.isSuspicious(connection.targetInput())) {
            diagnostics.add(diagnostic(DiagnosticCode.CON007,
                "Connection uses suspicious input field '" + connection.targetInput()
                    + "' - check if this field exists on target node",
                connection.line(),
                context("target", connection.targetNode(), "input", connection.targetInput())));
        }
    }

    private static String display(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
