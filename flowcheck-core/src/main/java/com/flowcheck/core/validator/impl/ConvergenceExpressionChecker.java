package com.flowcheck.core.validator.impl;

import com.flowcheck.core.parser.PythonParser;
import com.flowcheck.core.parser.PythonSyntaxException;
import com.flowcheck.core.parser.ast.AstWalker;
import com.flowcheck.core.parser.ast.PythonAst.Attribute;
import com.flowcheck.core.parser.ast.PythonAst.BinOp;
import com.flowcheck.core.parser.ast.PythonAst.BoolOp;
import com.flowcheck.core.parser.ast.PythonAst.Call;
import com.flowcheck.core.parser.ast.PythonAst.Compare;
import com.flowcheck.core.parser.ast.PythonAst.Constant;
import com.flowcheck.core.parser.ast.PythonAst.ConstantKind;
import com.flowcheck.core.parser.ast.PythonAst.Expr;
import com.flowcheck.core.parser.ast.PythonAst.IfExp;
import com.flowcheck.core.parser.ast.PythonAst.Keyword;
import com.flowcheck.core.parser.ast.PythonAst.ListExpr;
import com.flowcheck.core.parser.ast.PythonAst.Name;
import com.flowcheck.core.parser.ast.PythonAst.Node;
import com.flowcheck.core.parser.ast.PythonAst.SetExpr;
import com.flowcheck.core.parser.ast.PythonAst.Subscript;
import com.flowcheck.core.parser.ast.PythonAst.TupleExpr;
import com.flowcheck.core.parser.ast.PythonAst.UnaryOp;

import java.util.Set;

/**
 * Lightweight grammar check for {@code converge_when} expressions.
 *
 * <p>The expression must parse as a single Python expression built only from names,
 * literals, attribute and subscript access, function calls, and comparison, logical,
 * arithmetic or bitwise operators. Assignment expressions, lambdas, comprehensions,
 * {@code await} and {@code yield} are rejected, as is a bare number or string.</p>
 */
public final class ConvergenceExpressionChecker {

    private static final Set<Class<? extends Node>> ALLOWED = Set.of(
        Name.class, Constant.class, Attribute.class, Subscript.class, Call.class, Keyword.class,
        Compare.class, BoolOp.class, UnaryOp.class, BinOp.class, IfExp.class,
        ListExpr.class, TupleExpr.class, SetExpr.class
    );

    private ConvergenceExpressionChecker() {
        // Utility class - no instantiation
    }

    /**
     * @param expression condition text
     * @return true when the text is an acceptable boolean expression
     */
    public static boolean isValid(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        Expr parsed;
        try {
            parsed = PythonParser.parseExpression(expression);
        } catch (PythonSyntaxException e) {
            return false;
        }
        if (parsed instanceof TupleExpr) {
            return false;
        }
        if (parsed instanceof Constant constant
            && constant.kind() != ConstantKind.BOOLEAN) {
            return false;
        }
        boolean[] valid = {true};
        AstWalker.walk(parsed, node -> {
            if (!ALLOWED.contains(node.getClass())) {
                valid[0] = false;
            }
        });
        return valid[0];
    }
}
