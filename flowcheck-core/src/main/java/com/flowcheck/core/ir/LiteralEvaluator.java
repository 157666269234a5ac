package com.flowcheck.core.ir;

import com.flowcheck.core.parser.ast.PythonAst.Constant;
import com.flowcheck.core.parser.ast.PythonAst.DictExpr;
import com.flowcheck.core.parser.ast.PythonAst.Expr;
import com.flowcheck.core.parser.ast.PythonAst.ListExpr;
import com.flowcheck.core.parser.ast.PythonAst.SetExpr;
import com.flowcheck.core.parser.ast.PythonAst.TupleExpr;
import com.flowcheck.core.parser.ast.PythonAst.UnaryOp;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates literal expressions the way Python's {@code ast.literal_eval} does.
 *
 * <p>Strings, numbers, booleans, {@code None}, and lists, tuples, sets and dicts of
 * those evaluate to Java values ({@link String}, {@link Long}, {@link BigInteger},
 * {@link Double}, {@link Boolean}, null, {@link List}, {@link Map}). Anything else
 * evaluates to {@link Unresolved#EXPRESSION}.</p>
 */
public final class LiteralEvaluator {

    private LiteralEvaluator() {
        // Utility class - no instantiation
    }

    /**
     * Evaluates an expression.
     *
     * @param expr expression, may be null
     * @return literal value, or {@link Unresolved#EXPRESSION}
     */
    public static Object evaluate(Expr expr) {
        if (expr instanceof Constant constant) {
            return switch (constant.kind()) {
                case STRING, INTEGER, FLOAT, BOOLEAN, NONE -> constant.value();
                default -> Unresolved.EXPRESSION;
            };
        }
        if (expr instanceof UnaryOp unary && (unary.op().equals("-") || unary.op().equals("+"))) {
            Object operand = evaluate(unary.operand());
            if (operand instanceof Number number && !(operand instanceof Boolean)) {
                return unary.op().equals("-") ? negate(number) : number;
            }
            return Unresolved.EXPRESSION;
        }
        if (expr instanceof ListExpr list) {
            return evaluateAll(list.elements());
        }
        if (expr instanceof TupleExpr tuple) {
            return evaluateAll(tuple.elements());
        }
        if (expr instanceof SetExpr set) {
            return evaluateAll(set.elements());
        }
        if (expr instanceof DictExpr dict) {
            Map<Object, Object> result = new LinkedHashMap<>();
            for (int i = 0; i < dict.keys().size(); i++) {
                Expr keyExpr = dict.keys().get(i);
                if (keyExpr == null) {
                    return Unresolved.EXPRESSION;
                }
                Object key = evaluate(keyExpr);
                Object value = evaluate(dict.values().get(i));
                if (key == Unresolved.EXPRESSION || value == Unresolved.EXPRESSION) {
                    return Unresolved.EXPRESSION;
                }
                result.put(key, value);
            }
            return result;
        }
        return Unresolved.EXPRESSION;
    }

    /**
     * Evaluates a dict display entry by entry. Non-literal values become
     * {@link Unresolved#EXPRESSION}; entries whose key is not a string literal are skipped.
     *
     * @param dict dict display
     * @return ordered map of string keys to values
     */
    public static Map<String, Object> evaluateEntries(DictExpr dict) {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (int i = 0; i < dict.keys().size(); i++) {
            Object key = evaluate(dict.keys().get(i));
            if (key instanceof String name) {
                entries.putIfAbsent(name, evaluate(dict.values().get(i)));
            }
        }
        return entries;
    }

    public static boolean isLiteral(Expr expr) {
        return evaluate(expr) != Unresolved.EXPRESSION;
    }

    /**
     * Returns the value of a string literal argument.
     *
     * @param expr expression
     * @return string value, or null when the expression is not a string literal
     */
    public static String string(Expr expr) {
        return evaluate(expr) instanceof String value ? value : null;
    }

    private static Object evaluateAll(List<Expr> elements) {
        List<Object> values = new ArrayList<>();
        for (Expr element : elements) {
            Object value = evaluate(element);
            if (value == Unresolved.EXPRESSION) {
                return Unresolved.EXPRESSION;
            }
            values.add(value);
        }
        return values;
    }

    private static Number negate(Number number) {
        if (number instanceof Long value) {
            return value == Long.MIN_VALUE ? BigInteger.valueOf(value).negate() : -value;
        }
        if (number instanceof BigInteger value) {
            return value.negate();
        }
        return -number.doubleValue();
    }
}
