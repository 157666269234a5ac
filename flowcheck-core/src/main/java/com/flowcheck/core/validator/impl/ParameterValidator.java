package com.flowcheck.core.validator.impl;

import com.flowcheck.core.ir.CustomNodeClass;
import com.flowcheck.core.ir.NodeDeclaration;
import com.flowcheck.core.ir.ParameterDeclaration;
import com.flowcheck.core.ir.ParameterUsage;
import com.flowcheck.core.ir.WorkflowIr;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCategory;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.validator.AbstractRuleValidator;
import com.flowcheck.core.validator.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks parameter declarations of custom node classes and required configuration of
 * known node types.
 *
 * <ul>
 *   <li>{@code PAR001} custom node class without {@code get_parameters}</li>
 *   <li>{@code PAR002} parameter read in {@code run}/{@code execute} but never declared</li>
 *   <li>{@code PAR003} {@code NodeParameter} without a type</li>
 *   <li>{@code PAR004} known node type missing a required configuration key</li>
 * </ul>
 *
 * <p>Undeclared parameters are dropped by the runtime before {@code run} is called, so
 * {@code PAR002} is an error rather than a style hint. {@code PAR004} is skipped for
 * classes defined in the same source and for nodes whose configuration is built
 * dynamically.</p>
 */
public class ParameterValidator extends AbstractRuleValidator {

    @Override
    public String getId() {
        return "parameters";
    }

    @Override
    public String getDisplayName() {
        return "Parameter Validator";
    }

    @Override
    public DiagnosticCategory getCategory() {
        return DiagnosticCategory.PARAMETER;
    }

    @Override
    protected List<Diagnostic> check(ValidationContext context) {
        WorkflowIr ir = context.ir();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (CustomNodeClass nodeClass : ir.customClasses()) {
            checkClass(nodeClass, ir, diagnostics);
        }
        for (NodeDeclaration node : ir.nodes()) {
            checkRequiredParameters(node, context, diagnostics);
        }
        return diagnostics;
    }

    private void checkClass(CustomNodeClass nodeClass, WorkflowIr ir, List<Diagnostic> diagnostics) {
        String nodeId = ir.nodes().stream()
            .filter(node -> nodeClass.name().equals(node.className()))
            .map(NodeDeclaration::id)
            .findFirst()
            .orElse(null);

        if (!nodeClass.declaresParameters()) {
            diagnostics.add(diagnostic(DiagnosticCode.PAR001,
                "Node class '" + nodeClass.name() + "' missing get_parameters() method",
                nodeClass.line(),
                context(Diagnostic.NODE_TYPE, nodeClass.name(), Diagnostic.NODE_ID, nodeId)));
            return;
        }

        for (ParameterUsage usage : nodeClass.usages()) {
            if (!nodeClass.declares(usage.name())) {
                diagnostics.add(diagnostic(DiagnosticCode.PAR002,
                    "Parameter '" + usage.name() + "' used in " + nodeClass.name()
                        + " but not declared in get_parameters()",
                    usage.line(),
                    context(Diagnostic.NODE_TYPE, nodeClass.name(),
                        Diagnostic.NODE_ID, nodeId,
                        Diagnostic.PARAMETER, usage.name())));
            }
        }

        for (ParameterDeclaration parameter : nodeClass.parameters()) {
            if (!parameter.hasType()) {
                diagnostics.add(diagnostic(DiagnosticCode.PAR003,
                    "NodeParameter in " + nodeClass.name() + " missing required 'type' field",
                    parameter.line(),
                    context(Diagnostic.NODE_TYPE, nodeClass.name(), Diagnostic.PARAMETER, parameter.name())));
            }
        }
    }

    private void checkRequiredParameters(NodeDeclaration node, ValidationContext context, List<Diagnostic> diagnostics) {
        if (!node.hasClassName() || !node.configResolved()) {
            return;
        }
        if (context.ir().customClass(node.className()).isPresent()) {
            return;
        }
        for (String required : context.registry().requiredParameters(node.className())) {
            if (!node.config().containsKey(required)) {
                diagnostics.add(diagnostic(DiagnosticCode.PAR004,
                    "Node '" + node.id() + "' missing required parameter '" + required + "'",
                    node.line(),
                    context(Diagnostic.NODE_TYPE, node.className(),
                        Diagnostic.NODE_ID, node.id(),
                        Diagnostic.PARAMETER, required)));
            }
        }
    }
}
