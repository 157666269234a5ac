package com.flowcheck.core.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AST node types for Python source code.
 *
 * <p>This class contains immutable record types for the statements and expressions
 * produced by {@link com.flowcheck.core.parser.PythonParser}. The shapes follow Python's
 * own {@code ast} module closely enough that workflow call sites can be matched
 * structurally: {@code workflow.add_node("LLMAgentNode", "agent", {...})} is a
 * {@link Call} whose {@code func} is an {@link Attribute}.</p>
 *
 * <p>Every node reports its 1-based {@code line} and its direct {@code children()} so that
 * {@link AstWalker} can traverse a tree without recursion.</p>
 *
 * @see com.flowcheck.core.parser.PythonParser
 * @since 1.0.0
 */
public final class PythonAst {

    private PythonAst() {
        // Utility class - no instantiation
    }

    /**
     * Any AST node.
     */
    public interface Node {
        int line();

        List<Node> children();
    }

    /**
     * Statement node.
     */
    public interface Stmt extends Node {
    }

    /**
     * Expression node.
     */
    public interface Expr extends Node {
    }

    private static List<Node> nodes(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Node node) {
                        result.add(node);
                    }
                }
            }
        }
        return result;
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }

    // ----------------------------------------------------------------- module

    /**
     * Parsed source file.
     *
     * @param body top-level statements
     */
    public record Module(List<Stmt> body) implements Node {
        public Module {
            body = copy(body);
        }

        @Override
        public int line() {
            return 1;
        }

        @Override
        public List<Node> children() {
            return nodes(body);
        }
    }

    // ------------------------------------------------------------- statements

    /**
     * Function definition, {@code def} or {@code async def}.
     *
     * @param name function name
     * @param arguments formal parameters
     * @param body function body
     * @param decorators decorator expressions
     * @param returns return annotation, may be null
     * @param async true for {@code async def}
     * @param line definition line
     */
    public record FunctionDef(
        String name,
        Arguments arguments,
        List<Stmt> body,
        List<Expr> decorators,
        Expr returns,
        boolean async,
        int line
    ) implements Stmt {
        public FunctionDef {
            Objects.requireNonNull(name, "name must not be null");
            arguments = arguments != null ? arguments : new Arguments(List.of());
            body = copy(body);
            decorators = copy(decorators);
        }

        @Override
        public List<Node> children() {
            return nodes(decorators, arguments, returns, body);
        }
    }

    /**
     * Class definition.
     *
     * <p>Example:
     * <pre>{@code
     * class SummaryNode(Node):
     *     def get_parameters(self): ...
     * }</pre>
     *
     * @param name class name
     * @param bases base class expressions
     * @param keywords class keywords such as {@code metaclass=...}
     * @param body class body
     * @param decorators decorator expressions
     * @param line definition line
     */
    public record ClassDef(
        String name,
        List<Expr> bases,
        List<Keyword> keywords,
        List<Stmt> body,
        List<Expr> decorators,
        int line
    ) implements Stmt {
        public ClassDef {
            Objects.requireNonNull(name, "name must not be null");
            bases = copy(bases);
            keywords = copy(keywords);
            body = copy(body);
            decorators = copy(decorators);
        }

        @Override
        public List<Node> children() {
            return nodes(decorators, bases, keywords, body);
        }

        /**
         * Finds a method defined directly in the class body.
         *
         * @param methodName method name
         * @return the definition, or null when absent
         */
        public FunctionDef method(String methodName) {
            return body.stream()
                .filter(FunctionDef.class::isInstance)
                .map(FunctionDef.class::cast)
                .filter(def -> def.name().equals(methodName))
                .findFirst()
                .orElse(null);
        }
    }

    public record Return(Expr value, int line) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    /**
     * Assignment; {@code a = b = value} has two targets.
     *
     * @param targets assignment targets
     * @param value assigned value
     * @param line statement line
     */
    public record Assign(List<Expr> targets, Expr value, int line) implements Stmt {
        public Assign {
            targets = copy(targets);
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public List<Node> children() {
            return nodes(targets, value);
        }
    }

    public record AugAssign(Expr target, String op, Expr value, int line) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(target, value);
        }
    }

    public record AnnAssign(Expr target, Expr annotation, Expr value, int line) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(target, annotation, value);
        }
    }

    public record ExprStmt(Expr value, int line) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record If(Expr test, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt {
        public If {
            body = copy(body);
            orElse = copy(orElse);
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    public record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, boolean async, int line)
        implements Stmt {
        public For {
            body = copy(body);
            orElse = copy(orElse);
        }

        @Override
        public List<Node> children() {
            return nodes(target, iter, body, orElse);
        }
    }

    public record While(Expr test, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt {
        public While {
            body = copy(body);
            orElse = copy(orElse);
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    /**
     * {@code with} statement.
     *
     * @param items context managers with optional targets
     * @param body block
     * @param async true for {@code async with}
     * @param line statement line
     */
    public record With(List<WithItem> items, List<Stmt> body, boolean async, int line) implements Stmt {
        public With {
            items = copy(items);
            body = copy(body);
        }

        @Override
        public List<Node> children() {
            return nodes(items, body);
        }
    }

    public record WithItem(Expr context, Expr target, int line) implements Node {
        @Override
        public List<Node> children() {
            return nodes(context, target);
        }
    }

    public record Try(
        List<Stmt> body,
        List<ExceptHandler> handlers,
        List<Stmt> orElse,
        List<Stmt> finalBody,
        int line
    ) implements Stmt {
        public Try {
            body = copy(body);
            handlers = copy(handlers);
            orElse = copy(orElse);
            finalBody = copy(finalBody);
        }

        @Override
        public List<Node> children() {
            return nodes(body, handlers, orElse, finalBody);
        }
    }

    /**
     * {@code except Type as name:} clause.
     *
     * @param type exception type, null for a bare {@code except:}
     * @param name bound name, may be null
     * @param body handler block
     * @param line clause line
     */
    public record ExceptHandler(Expr type, String name, List<Stmt> body, int line) implements Node {
        public ExceptHandler {
            body = copy(body);
        }

        @Override
        public List<Node> children() {
            return nodes(type, body);
        }
    }

    public record Raise(Expr exception, Expr cause, int line) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(exception, cause);
        }
    }

    /**
     * {@code import a.b as c}.
     *
     * @param names imported modules
     * @param line statement line
     */
    public record Import(List<Alias> names, int line) implements Stmt {
        public Import {
            names = copy(names);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * {@code from ..module import name as alias}.
     *
     * @param module module path without leading dots, may be null for {@code from . import x}
     * @param names imported names; {@code "*"} for a star import
     * @param level number of leading dots
     * @param line statement line
     */
    public record ImportFrom(String module, List<Alias> names, int level, int line) implements Stmt {
        public ImportFrom {
            names = copy(names);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * Imported name with optional alias.
     *
     * @param name dotted name as written
     * @param asName alias, may be null
     */
    public record Alias(String name, String asName) {
        public Alias {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * {@code global} or {@code nonlocal} declaration.
     *
     * @param names declared names
     * @param nonlocal true for {@code nonlocal}
     * @param line statement line
     */
    public record Global(List<String> names, boolean nonlocal, int line) implements Stmt {
        public Global {
            names = copy(names);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public record Delete(List<Expr> targets, int line) implements Stmt {
        public Delete {
            targets = copy(targets);
        }

        @Override
        public List<Node> children() {
            return nodes(targets);
        }
    }

    public record Assert(Expr test, Expr message, int line) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(test, message);
        }
    }

    public record Pass(int line) implements Stmt {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public record Break(int line) implements Stmt {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public record Continue(int line) implements Stmt {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    // ------------------------------------------------------------- parameters

    /**
     * Formal parameter kinds.
     */
    public enum ParameterKind {
        POSITIONAL,
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD
    }

    /**
     * One formal parameter of a {@code def} or {@code lambda}.
     *
     * @param name parameter name
     * @param kind parameter kind
     * @param annotation type annotation, may be null
     * @param defaultValue default value, may be null
     * @param line parameter line
     */
    public record Parameter(String name, ParameterKind kind, Expr annotation, Expr defaultValue, int line)
        implements Node {
        public Parameter {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public List<Node> children() {
            return nodes(annotation, defaultValue);
        }
    }

    public record Arguments(List<Parameter> parameters) implements Node {
        public Arguments {
            parameters = copy(parameters);
        }

        @Override
        public int line() {
            return parameters.isEmpty() ? 0 : parameters.get(0).line();
        }

        @Override
        public List<Node> children() {
            return nodes(parameters);
        }

        public List<String> names() {
            return parameters.stream().map(Parameter::name).toList();
        }
    }

    // ------------------------------------------------------------ expressions

    public record Name(String id, int line) implements Expr {
        public Name {
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * Literal constant kinds.
     */
    public enum ConstantKind {
        STRING,
        BYTES,
        INTEGER,
        FLOAT,
        COMPLEX,
        BOOLEAN,
        NONE,
        ELLIPSIS
    }

    /**
     * Literal constant. {@code value} is a {@link String}, {@link Long},
     * {@link java.math.BigInteger}, {@link Double} or {@link Boolean}, or null for
     * {@code None} and {@code ...}.
     *
     * @param value literal value
     * @param kind literal kind
     * @param line literal line
     */
    public record Constant(Object value, ConstantKind kind, int line) implements Expr {
        public Constant {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        public boolean isString() {
            return kind == ConstantKind.STRING;
        }

        public boolean isNumber() {
            return kind == ConstantKind.INTEGER || kind == ConstantKind.FLOAT;
        }
    }

    /**
     * f-string; {@code values} alternates literal {@link Constant} parts and embedded expressions.
     *
     * @param values parts
     * @param line literal line
     */
    public record JoinedStr(List<Expr> values, int line) implements Expr {
        public JoinedStr {
            values = copy(values);
        }

        @Override
        public List<Node> children() {
            return nodes(values);
        }
    }

    public record Attribute(Expr value, String attr, int line) implements Expr {
        public Attribute {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(attr, "attr must not be null");
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record Subscript(Expr value, Expr slice, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value, slice);
        }
    }

    public record Slice(Expr lower, Expr upper, Expr step, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(lower, upper, step);
        }
    }

    /**
     * Call expression.
     *
     * @param func called expression
     * @param args positional arguments, {@link Starred} for {@code *args}
     * @param keywords keyword arguments, with a null name for {@code **kwargs}
     * @param line call line
     */
    public record Call(Expr func, List<Expr> args, List<Keyword> keywords, int line) implements Expr {
        public Call {
            Objects.requireNonNull(func, "func must not be null");
            args = copy(args);
            keywords = copy(keywords);
        }

        @Override
        public List<Node> children() {
            return nodes(func, args, keywords);
        }

        /**
         * Method name for attribute calls such as {@code workflow.add_node(...)}.
         *
         * @return attribute name, or null when {@code func} is not an attribute
         */
        public String methodName() {
            return func instanceof Attribute attribute ? attribute.attr() : null;
        }

        /**
         * Name of a plain function call such as {@code NodeParameter(...)}.
         *
         * @return called name, or null when {@code func} is not a bare name
         */
        public String functionName() {
            return func instanceof Name name ? name.id() : null;
        }

        /**
         * Receiver of an attribute call.
         *
         * @return receiver, or null for plain calls
         */
        public Expr receiver() {
            return func instanceof Attribute attribute ? attribute.value() : null;
        }

        /**
         * Finds a keyword argument by name.
         *
         * @param name keyword name
         * @return the value, or null when not given
         */
        public Expr keyword(String name) {
            return keywords.stream()
                .filter(keyword -> name.equals(keyword.name()))
                .map(Keyword::value)
                .findFirst()
                .orElse(null);
        }

        public boolean hasStarredArguments() {
            return args.stream().anyMatch(Starred.class::isInstance)
                || keywords.stream().anyMatch(keyword -> keyword.name() == null);
        }
    }

    /**
     * Keyword argument {@code name=value}; {@code name} is null for {@code **mapping}.
     *
     * @param name keyword name
     * @param value argument value
     * @param line argument line
     */
    public record Keyword(String name, Expr value, int line) implements Node {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record BinOp(Expr left, String op, Expr right, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(left, right);
        }
    }

    public record UnaryOp(String op, Expr operand, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(operand);
        }
    }

    public record BoolOp(String op, List<Expr> values, int line) implements Expr {
        public BoolOp {
            values = copy(values);
        }

        @Override
        public List<Node> children() {
            return nodes(values);
        }
    }

    /**
     * Comparison chain {@code a < b <= c}.
     *
     * @param left first operand
     * @param ops operators, {@code "not in"} and {@code "is not"} included
     * @param comparators remaining operands
     * @param line expression line
     */
    public record Compare(Expr left, List<String> ops, List<Expr> comparators, int line) implements Expr {
        public Compare {
            ops = copy(ops);
            comparators = copy(comparators);
        }

        @Override
        public List<Node> children() {
            return nodes(left, comparators);
        }
    }

    public record IfExp(Expr test, Expr body, Expr orElse, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    public record Lambda(Arguments arguments, Expr body, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(arguments, body);
        }
    }

    public record ListExpr(List<Expr> elements, int line) implements Expr {
        public ListExpr {
            elements = copy(elements);
        }

        @Override
        public List<Node> children() {
            return nodes(elements);
        }
    }

    public record TupleExpr(List<Expr> elements, int line) implements Expr {
        public TupleExpr {
            elements = copy(elements);
        }

        @Override
        public List<Node> children() {
            return nodes(elements);
        }
    }

    public record SetExpr(List<Expr> elements, int line) implements Expr {
        public SetExpr {
            elements = copy(elements);
        }

        @Override
        public List<Node> children() {
            return nodes(elements);
        }
    }

    /**
     * Dict display. A null key marks a {@code **mapping} unpacking entry.
     *
     * @param keys keys, null entries allowed
     * @param values values
     * @param line expression line
     */
    public record DictExpr(List<Expr> keys, List<Expr> values, int line) implements Expr {
        public DictExpr {
            keys = keys != null ? Collections.unmodifiableList(new ArrayList<>(keys)) : List.of();
            values = copy(values);
        }

        @Override
        public List<Node> children() {
            return nodes(keys, values);
        }
    }

    /**
     * Comprehension kinds.
     */
    public enum ComprehensionKind {
        LIST,
        SET,
        DICT,
        GENERATOR
    }

    /**
     * List, set, dict or generator comprehension.
     *
     * @param kind comprehension kind
     * @param element element expression, the key for dict comprehensions
     * @param value value expression for dict comprehensions, otherwise null
     * @param generators {@code for} clauses
     * @param line expression line
     */
    public record Comprehension(
        ComprehensionKind kind,
        Expr element,
        Expr value,
        List<ComprehensionClause> generators,
        int line
    ) implements Expr {
        public Comprehension {
            generators = copy(generators);
        }

        @Override
        public List<Node> children() {
            return nodes(generators, element, value);
        }
    }

    public record ComprehensionClause(Expr target, Expr iter, List<Expr> conditions, boolean async, int line)
        implements Node {
        public ComprehensionClause {
            conditions = copy(conditions);
        }

        @Override
        public List<Node> children() {
            return nodes(iter, target, conditions);
        }
    }

    public record Await(Expr value, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record Yield(Expr value, boolean from, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record Starred(Expr value, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record NamedExpr(Name target, Expr value, int line) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(target, value);
        }
    }

    /**
     * Renders a dotted name ({@code a.b.c}) from nested attributes.
     *
     * @param expr expression
     * @return dotted name, or null when the expression is not a plain dotted name
     */
    public static String dottedName(Expr expr) {
        StringBuilder dotted = new StringBuilder();
        Expr current = expr;
        while (current instanceof Attribute attribute) {
            dotted.insert(0, "." + attribute.attr());
            current = attribute.value();
        }
        if (current instanceof Name name) {
            return name.id() + dotted;
        }
        return null;
    }

    /**
     * Returns the string value of a plain string literal.
     *
     * @param expr expression
     * @return value, or null when the expression is not a string constant
     */
    public static String stringValue(Expr expr) {
        return expr instanceof Constant constant && constant.isString() ? (String) constant.value() : null;
    }
}
