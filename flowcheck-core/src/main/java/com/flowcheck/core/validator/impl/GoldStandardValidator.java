package com.flowcheck.core.validator.impl;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCategory;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.parser.ast.AstWalker;
import com.flowcheck.core.parser.ast.PythonAst;
import com.flowcheck.core.parser.ast.PythonAst.Call;
import com.flowcheck.core.parser.ast.PythonAst.Expr;
import com.flowcheck.core.parser.ast.PythonAst.Name;
import com.flowcheck.core.validator.AbstractRuleValidator;
import com.flowcheck.core.validator.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Matches known anti-patterns against call expressions.
 *
 * <p>Patterns are entries of {@link #PATTERNS}; adding a check means adding an entry.</p>
 */
public class GoldStandardValidator extends AbstractRuleValidator {

    private static final Map<String, String> SNAKE_CASE_METHODS = Map.of(
        "addNode", "add_node",
        "addConnection", "add_connection",
        "createCycle", "create_cycle"
    );

    static final List<GoldStandardPattern> PATTERNS = List.of(
        new GoldStandardPattern(
            DiagnosticCode.GOLD002,
            "execution-pattern",
            "Execute workflows through the runtime: runtime.execute(workflow.build())",
            GoldStandardValidator::isInvertedExecution,
            call -> "Use 'runtime.execute(workflow.build())' not '"
                + callee(call) + "(" + runtimeArgument(call) + ")'"),
        new GoldStandardPattern(
            DiagnosticCode.GOLD003,
            "naming-convention",
            "Builder methods use snake_case names",
            call -> call.methodName() != null && SNAKE_CASE_METHODS.containsKey(call.methodName()),
            call -> "Use '" + SNAKE_CASE_METHODS.get(call.methodName()) + "()' not '"
                + call.methodName() + "()' (snake_case convention)")
    );

    @Override
    public String getId() {
        return "gold-standards";
    }

    @Override
    public String getDisplayName() {
        return "Gold Standard Validator";
    }

    @Override
    public DiagnosticCategory getCategory() {
        return DiagnosticCategory.GOLD_STANDARD;
    }

    @Override
    protected List<Diagnostic> check(ValidationContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Call call : AstWalker.collect(context.module(), Call.class)) {
            for (GoldStandardPattern pattern : PATTERNS) {
                if (pattern.matches(call)) {
                    diagnostics.add(diagnostic(pattern.code(), pattern.message().apply(call), call.line(),
                        context("gold_standard", pattern.name())));
                }
            }
        }
        return diagnostics;
    }

    /**
     * {@code workflow.execute(runtime)}: an {@code execute} call whose only argument is a
     * runtime while the receiver is not one.
     */
    private static boolean isInvertedExecution(Call call) {
        if (!"execute".equals(call.methodName()) || call.args().size() != 1) {
            return false;
        }
        if (isRuntime(call.receiver())) {
            return false;
        }
        return isRuntime(call.args().get(0));
    }

    private static boolean isRuntime(Expr expr) {
        if (expr instanceof Name name) {
            return name.id().toLowerCase(Locale.ROOT).contains("runtime");
        }
        if (expr instanceof Call call) {
            String function = call.functionName() != null ? call.functionName() : call.methodName();
            return function != null && function.endsWith("Runtime");
        }
        String dotted = PythonAst.dottedName(expr);
        return dotted != null && dotted.toLowerCase(Locale.ROOT).contains("runtime");
    }

    private static String callee(Call call) {
        String dotted = PythonAst.dottedName(call.func());
        return dotted != null ? dotted : "workflow.execute";
    }

    private static String runtimeArgument(Call call) {
        String dotted = PythonAst.dottedName(call.args().get(0));
        return dotted != null ? dotted : "runtime";
    }
}
