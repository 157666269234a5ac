package com.flowcheck.core.parser;

import com.flowcheck.core.parser.ast.PythonAst.Alias;
import com.flowcheck.core.parser.ast.PythonAst.AnnAssign;
import com.flowcheck.core.parser.ast.PythonAst.Arguments;
import com.flowcheck.core.parser.ast.PythonAst.Assert;
import com.flowcheck.core.parser.ast.PythonAst.Assign;
import com.flowcheck.core.parser.ast.PythonAst.Attribute;
import com.flowcheck.core.parser.ast.PythonAst.AugAssign;
import com.flowcheck.core.parser.ast.PythonAst.Await;
import com.flowcheck.core.parser.ast.PythonAst.BinOp;
import com.flowcheck.core.parser.ast.PythonAst.BoolOp;
import com.flowcheck.core.parser.ast.PythonAst.Break;
import com.flowcheck.core.parser.ast.PythonAst.Call;
import com.flowcheck.core.parser.ast.PythonAst.ClassDef;
import com.flowcheck.core.parser.ast.PythonAst.Compare;
import com.flowcheck.core.parser.ast.PythonAst.Comprehension;
import com.flowcheck.core.parser.ast.PythonAst.ComprehensionClause;
import com.flowcheck.core.parser.ast.PythonAst.ComprehensionKind;
import com.flowcheck.core.parser.ast.PythonAst.Constant;
import com.flowcheck.core.parser.ast.PythonAst.ConstantKind;
import com.flowcheck.core.parser.ast.PythonAst.Continue;
import com.flowcheck.core.parser.ast.PythonAst.Delete;
import com.flowcheck.core.parser.ast.PythonAst.DictExpr;
import com.flowcheck.core.parser.ast.PythonAst.ExceptHandler;
import com.flowcheck.core.parser.ast.PythonAst.Expr;
import com.flowcheck.core.parser.ast.PythonAst.ExprStmt;
import com.flowcheck.core.parser.ast.PythonAst.For;
import com.flowcheck.core.parser.ast.PythonAst.FunctionDef;
import com.flowcheck.core.parser.ast.PythonAst.Global;
import com.flowcheck.core.parser.ast.PythonAst.If;
import com.flowcheck.core.parser.ast.PythonAst.IfExp;
import com.flowcheck.core.parser.ast.PythonAst.Import;
import com.flowcheck.core.parser.ast.PythonAst.ImportFrom;
import com.flowcheck.core.parser.ast.PythonAst.JoinedStr;
import com.flowcheck.core.parser.ast.PythonAst.Keyword;
import com.flowcheck.core.parser.ast.PythonAst.Lambda;
import com.flowcheck.core.parser.ast.PythonAst.ListExpr;
import com.flowcheck.core.parser.ast.PythonAst.Module;
import com.flowcheck.core.parser.ast.PythonAst.Name;
import com.flowcheck.core.parser.ast.PythonAst.NamedExpr;
import com.flowcheck.core.parser.ast.PythonAst.Parameter;
import com.flowcheck.core.parser.ast.PythonAst.ParameterKind;
import com.flowcheck.core.parser.ast.PythonAst.Pass;
import com.flowcheck.core.parser.ast.PythonAst.Raise;
import com.flowcheck.core.parser.ast.PythonAst.Return;
import com.flowcheck.core.parser.ast.PythonAst.SetExpr;
import com.flowcheck.core.parser.ast.PythonAst.Slice;
import com.flowcheck.core.parser.ast.PythonAst.Starred;
import com.flowcheck.core.parser.ast.PythonAst.Stmt;
import com.flowcheck.core.parser.ast.PythonAst.Subscript;
import com.flowcheck.core.parser.ast.PythonAst.Try;
import com.flowcheck.core.parser.ast.PythonAst.TupleExpr;
import com.flowcheck.core.parser.ast.PythonAst.UnaryOp;
import com.flowcheck.core.parser.ast.PythonAst.While;
import com.flowcheck.core.parser.ast.PythonAst.With;
import com.flowcheck.core.parser.ast.PythonAst.WithItem;
import com.flowcheck.core.parser.ast.PythonAst.Yield;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Recursive-descent parser for Python source.
 *
 * <p>Covers the statement and expression grammar used by workflow definitions and
 * custom node classes: definitions, control flow, imports, assignments, calls, literals,
 * comprehensions, lambdas and f-strings. Constructs outside that grammar (for example
 * {@code match} statements) are reported as syntax errors.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PythonAst.Module module = PythonParser.parse(source);
 * PythonAst.Expr condition = PythonParser.parseExpression("quality > 0.9");
 * }</pre>
 *
 * <p>Instances are single-use and not thread safe; the static entry points create a
 * fresh parser per call.</p>
 */
public final class PythonParser {

    /**
     * Maximum nesting of expressions and blocks before the input is rejected.
     */
    static final int MAX_NESTING = 200;

    private static final Set<String> AUGMENTED_OPERATORS = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@="
    );

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private final List<Token> tokens;
    private int index;
    private int depth;

    private PythonParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete module.
     *
     * @param source Python source
     * @return module AST
     * @throws PythonSyntaxException when the source is not valid Python
     */
    public static Module parse(String source) {
        return new PythonParser(PythonLexer.tokenize(source)).parseModule();
    }

    /**
     * Parses a single expression, as {@code eval} would.
     *
     * @param source expression source
     * @return expression AST
     * @throws PythonSyntaxException when the text is not a single valid expression
     */
    public static Expr parseExpression(String source) {
        String trimmed = source == null ? "" : source.strip();
        PythonParser parser = new PythonParser(PythonLexer.tokenize(trimmed));
        return parser.parseStandaloneExpression();
    }

    // ------------------------------------------------------------------ entry

    private Module parseModule() {
        List<Stmt> body = new ArrayList<>();
        while (!at(TokenType.EOF)) {
            if (at(TokenType.NEWLINE)) {
                advance();
                continue;
            }
            body.addAll(parseStatement());
        }
        return new Module(body);
    }

    private Expr parseStandaloneExpression() {
        if (at(TokenType.EOF) || at(TokenType.NEWLINE)) {
            throw error(peek(), "invalid syntax");
        }
        Expr expr = parseStarExpressions();
        while (at(TokenType.NEWLINE)) {
            advance();
        }
        if (!at(TokenType.EOF)) {
            throw error(peek(), "invalid syntax");
        }
        return expr;
    }

    // ------------------------------------------------------------- statements

    private List<Stmt> parseStatement() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Parsing interrupted");
        }
        Token token = peek();
        if (token.is(TokenType.INDENT)) {
            throw error(token, "unexpected indent");
        }
        if (token.is(TokenType.DEDENT)) {
            throw error(token, "unindent does not match any outer indentation level");
        }
        if (token.isOp("@")) {
            return List.of(parseDecorated());
        }
        if (token.is(TokenType.KEYWORD)) {
            switch (token.text()) {
                case "if":
                    return List.of(parseIf());
                case "while":
                    return List.of(parseWhile());
                case "for":
                    return List.of(parseFor(false));
                case "try":
                    return List.of(parseTry());
                case "with":
                    return List.of(parseWith(false));
                case "def":
                    return List.of(parseFunctionDef(List.of(), false));
                case "class":
                    return List.of(parseClassDef(List.of()));
                case "async":
                    return List.of(parseAsync(List.of()));
                default:
                    break;
            }
        }
        return parseSimpleStatements();
    }

    private List<Stmt> parseSimpleStatements() {
        List<Stmt> statements = new ArrayList<>();
        statements.add(parseSmallStatement());
        while (acceptOp(";")) {
            if (at(TokenType.NEWLINE) || at(TokenType.EOF)) {
                break;
            }
            statements.add(parseSmallStatement());
        }
        expectNewline();
        return statements;
    }

    private void expectNewline() {
        if (at(TokenType.NEWLINE)) {
            advance();
        } else if (!at(TokenType.EOF)) {
            throw error(peek(), "invalid syntax");
        }
    }

    private List<Stmt> parseBlock() {
        expectOp(":", "expected ':'");
        if (!at(TokenType.NEWLINE)) {
            return parseSimpleStatements();
        }
        advance();
        if (!at(TokenType.INDENT)) {
            throw error(peek(), "expected an indented block");
        }
        advance();
        enter(peek());
        List<Stmt> body = new ArrayList<>();
        while (!at(TokenType.DEDENT) && !at(TokenType.EOF)) {
            if (at(TokenType.NEWLINE)) {
                advance();
                continue;
            }
            body.addAll(parseStatement());
        }
        if (at(TokenType.DEDENT)) {
            advance();
        }
        leave();
        return body;
    }

    private Stmt parseDecorated() {
        List<Expr> decorators = new ArrayList<>();
        while (acceptOp("@")) {
            decorators.add(parseNamedExpression());
            expectNewline();
        }
        Token token = peek();
        if (token.isKeyword("def")) {
            return parseFunctionDef(decorators, false);
        }
        if (token.isKeyword("class")) {
            return parseClassDef(decorators);
        }
        if (token.isKeyword("async") && peek(1).isKeyword("def")) {
            return parseAsync(decorators);
        }
        throw error(token, "invalid syntax");
    }

    private Stmt parseAsync(List<Expr> decorators) {
        Token async = advance();
        Token next = peek();
        if (next.isKeyword("def")) {
            return parseFunctionDef(decorators, true);
        }
        if (!decorators.isEmpty()) {
            throw error(next, "invalid syntax");
        }
        if (next.isKeyword("for")) {
            return parseFor(true);
        }
        if (next.isKeyword("with")) {
            return parseWith(true);
        }
        throw error(async, "invalid syntax");
    }

    private Stmt parseIf() {
        Token start = advance();
        Expr test = parseNamedExpression();
        List<Stmt> body = parseBlock();
        List<Stmt> orElse = List.of();
        if (peek().isKeyword("elif")) {
            orElse = List.of(parseIf());
        } else if (peek().isKeyword("else")) {
            advance();
            orElse = parseBlock();
        }
        return new If(test, body, orElse, start.line());
    }

    private Stmt parseWhile() {
        Token start = advance();
        Expr test = parseNamedExpression();
        List<Stmt> body = parseBlock();
        List<Stmt> orElse = List.of();
        if (acceptKeyword("else")) {
            orElse = parseBlock();
        }
        return new While(test, body, orElse, start.line());
    }

    private Stmt parseFor(boolean async) {
        Token start = advance();
        Expr target = parseTargetList();
        checkAssignable(target);
        expectKeyword("in");
        Expr iter = parseStarExpressions();
        List<Stmt> body = parseBlock();
        List<Stmt> orElse = List.of();
        if (acceptKeyword("else")) {
            orElse = parseBlock();
        }
        return new For(target, iter, body, orElse, async, start.line());
    }

    private Stmt parseTry() {
        Token start = advance();
        List<Stmt> body = parseBlock();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (peek().isKeyword("except")) {
            Token clause = advance();
            acceptOp("*");
            Expr type = null;
            String name = null;
            if (!at(TokenType.OP) || !peek().text().equals(":")) {
                type = parseTest();
                if (acceptOp(",")) {
                    List<Expr> types = new ArrayList<>(List.of(type));
                    do {
                        types.add(parseTest());
                    } while (acceptOp(","));
                    type = new TupleExpr(types, type.line());
                }
                if (acceptKeyword("as")) {
                    name = expectName().text();
                }
            }
            handlers.add(new ExceptHandler(type, name, parseBlock(), clause.line()));
        }
        List<Stmt> orElse = List.of();
        if (!handlers.isEmpty() && acceptKeyword("else")) {
            orElse = parseBlock();
        }
        List<Stmt> finalBody = List.of();
        if (acceptKeyword("finally")) {
            finalBody = parseBlock();
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error(peek(), "expected 'except' or 'finally' block");
        }
        return new Try(body, handlers, orElse, finalBody, start.line());
    }

    private Stmt parseWith(boolean async) {
        Token start = advance();
        List<WithItem> items = null;
        if (at(TokenType.OP) && peek().text().equals("(")) {
            items = tryParseParenthesizedWithItems();
        }
        if (items == null) {
            items = new ArrayList<>();
            do {
                items.add(parseWithItem());
            } while (acceptOp(","));
        }
        return new With(items, parseBlock(), async, start.line());
    }

    private List<WithItem> tryParseParenthesizedWithItems() {
        int mark = index;
        int markDepth = depth;
        try {
            advance();
            List<WithItem> items = new ArrayList<>();
            do {
                if (at(TokenType.OP) && peek().text().equals(")")) {
                    break;
                }
                items.add(parseWithItem());
            } while (acceptOp(","));
            expectOp(")", "invalid syntax");
            if (at(TokenType.OP) && peek().text().equals(":")) {
                return items;
            }
        } catch (PythonSyntaxException e) {
            // Not the parenthesized form; reparse as an ordinary expression below.
            index = mark;
            depth = markDepth;
            return null;
        }
        index = mark;
        depth = markDepth;
        return null;
    }

    private WithItem parseWithItem() {
        Expr context = parseTest();
        Expr target = null;
        if (acceptKeyword("as")) {
            target = parseTarget();
            checkAssignable(target);
        }
        return new WithItem(context, target, context.line());
    }

    private Stmt parseFunctionDef(List<Expr> decorators, boolean async) {
        Token def = advance();
        Token name = expectName();
        expectOp("(", "expected '('");
        Arguments arguments = parseParameters(")", true);
        expectOp(")", "expected ')'");
        Expr returns = null;
        if (acceptOp("->")) {
            returns = parseTest();
        }
        List<Stmt> body = parseBlock();
        return new FunctionDef(name.text(), arguments, body, decorators, returns, async, def.line());
    }

    private Stmt parseClassDef(List<Expr> decorators) {
        Token start = advance();
        Token name = expectName();
        List<Expr> bases = List.of();
        List<Keyword> keywords = List.of();
        if (at(TokenType.OP) && peek().text().equals("(")) {
            Call call = parseCallArguments(new Name(name.text(), name.line()));
            bases = call.args();
            keywords = call.keywords();
        }
        List<Stmt> body = parseBlock();
        return new ClassDef(name.text(), bases, keywords, body, decorators, start.line());
    }

    private Arguments parseParameters(String closer, boolean annotations) {
        List<Parameter> parameters = new ArrayList<>();
        boolean keywordOnly = false;
        boolean sawDefault = false;
        while (!(at(TokenType.OP) && peek().text().equals(closer))) {
            Token token = peek();
            if (acceptOp("/")) {
                // positional-only marker
            } else if (acceptOp("**")) {
                Token name = expectName();
                Expr annotation = annotations && acceptOp(":") ? parseTest() : null;
                parameters.add(new Parameter(name.text(), ParameterKind.VAR_KEYWORD, annotation, null, name.line()));
            } else if (acceptOp("*")) {
                keywordOnly = true;
                if (at(TokenType.NAME)) {
                    Token name = advance();
                    Expr annotation = annotations && acceptOp(":") ? parseTest() : null;
                    parameters.add(new Parameter(
                        name.text(), ParameterKind.VAR_POSITIONAL, annotation, null, name.line()));
                }
            } else {
                Token name = expectName();
                Expr annotation = annotations && acceptOp(":") ? parseTest() : null;
                Expr defaultValue = null;
                if (acceptOp("=")) {
                    defaultValue = parseTest();
                    sawDefault = true;
                } else if (sawDefault && !keywordOnly) {
                    throw error(token, "non-default argument follows default argument");
                }
                ParameterKind kind = keywordOnly ? ParameterKind.KEYWORD_ONLY : ParameterKind.POSITIONAL;
                parameters.add(new Parameter(name.text(), kind, annotation, defaultValue, name.line()));
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        return new Arguments(parameters);
    }

    private Stmt parseSmallStatement() {
        Token token = peek();
        if (token.is(TokenType.KEYWORD)) {
            switch (token.text()) {
                case "pass":
                    advance();
                    return new Pass(token.line());
                case "break":
                    advance();
                    return new Break(token.line());
                case "continue":
                    advance();
                    return new Continue(token.line());
                case "return":
                    advance();
                    return new Return(startsExpression(peek()) ? parseStarExpressions() : null, token.line());
                case "raise":
                    return parseRaise();
                case "global":
                case "nonlocal":
                    return parseGlobal();
                case "del":
                    advance();
                    Expr targets = parseTargetList();
                    List<Expr> deleted = targets instanceof TupleExpr tuple ? tuple.elements() : List.of(targets);
                    deleted.forEach(this::checkAssignable);
                    return new Delete(deleted, token.line());
                case "assert":
                    advance();
                    Expr test = parseTest();
                    Expr message = acceptOp(",") ? parseTest() : null;
                    return new Assert(test, message, token.line());
                case "import":
                    return parseImport();
                case "from":
                    return parseImportFrom();
                default:
                    break;
            }
        }
        return parseExpressionStatement();
    }

    private Stmt parseRaise() {
        Token start = advance();
        Expr exception = null;
        Expr cause = null;
        if (startsExpression(peek())) {
            exception = parseTest();
            if (acceptKeyword("from")) {
                cause = parseTest();
            }
        }
        return new Raise(exception, cause, start.line());
    }

    private Stmt parseGlobal() {
        Token start = advance();
        List<String> names = new ArrayList<>();
        do {
            names.add(expectName().text());
        } while (acceptOp(","));
        return new Global(names, start.text().equals("nonlocal"), start.line());
    }

    private Stmt parseImport() {
        Token start = advance();
        List<Alias> names = new ArrayList<>();
        do {
            String dotted = parseDottedName();
            String asName = acceptKeyword("as") ? expectName().text() : null;
            names.add(new Alias(dotted, asName));
        } while (acceptOp(","));
        return new Import(names, start.line());
    }

    private Stmt parseImportFrom() {
        Token start = advance();
        int level = 0;
        while (at(TokenType.OP) && (peek().text().equals(".") || peek().text().equals("..."))) {
            level += advance().text().length();
        }
        String module = null;
        if (!peek().isKeyword("import")) {
            module = parseDottedName();
        } else if (level == 0) {
            throw error(peek(), "invalid syntax");
        }
        expectKeyword("import");

        List<Alias> names = new ArrayList<>();
        if (acceptOp("*")) {
            names.add(new Alias("*", null));
            return new ImportFrom(module, names, level, start.line());
        }
        boolean parenthesized = acceptOp("(");
        do {
            if (parenthesized && at(TokenType.OP) && peek().text().equals(")")) {
                break;
            }
            String name = expectName().text();
            String asName = acceptKeyword("as") ? expectName().text() : null;
            names.add(new Alias(name, asName));
        } while (acceptOp(","));
        if (parenthesized) {
            expectOp(")", "invalid syntax");
        }
        if (names.isEmpty()) {
            throw error(peek(), "invalid syntax");
        }
        return new ImportFrom(module, names, level, start.line());
    }

    private String parseDottedName() {
        StringBuilder name = new StringBuilder(expectName().text());
        while (acceptOp(".")) {
            name.append('.').append(expectName().text());
        }
        return name.toString();
    }

    private Stmt parseExpressionStatement() {
        Token start = peek();
        Expr first = parseStarExpressionsOrYield();

        if (at(TokenType.OP) && peek().text().equals(":")) {
            advance();
            checkAnnotatable(first);
            Expr annotation = parseTest();
            Expr value = acceptOp("=") ? parseStarExpressionsOrYield() : null;
            return new AnnAssign(first, annotation, value, start.line());
        }

        if (at(TokenType.OP) && AUGMENTED_OPERATORS.contains(peek().text())) {
            String op = advance().text();
            checkAnnotatable(first);
            Expr value = parseStarExpressionsOrYield();
            return new AugAssign(first, op, value, start.line());
        }

        if (at(TokenType.OP) && peek().text().equals("=")) {
            List<Expr> targets = new ArrayList<>();
            targets.add(first);
            while (acceptOp("=")) {
                targets.add(parseStarExpressionsOrYield());
            }
            Expr value = targets.remove(targets.size() - 1);
            targets.forEach(this::checkAssignable);
            return new Assign(targets, value, start.line());
        }

        return new ExprStmt(first, start.line());
    }

    private void checkAssignable(Expr target) {
        if (target instanceof Name || target instanceof Attribute || target instanceof Subscript) {
            return;
        }
        if (target instanceof Starred starred) {
            checkAssignable(starred.value());
            return;
        }
        if (target instanceof TupleExpr tuple) {
            tuple.elements().forEach(this::checkAssignable);
            return;
        }
        if (target instanceof ListExpr list) {
            list.elements().forEach(this::checkAssignable);
            return;
        }
        String what = target instanceof Constant ? "literal"
            : target instanceof Call ? "function call"
            : "expression";
        throw new PythonSyntaxException("cannot assign to " + what, target.line(), 0);
    }

    private void checkAnnotatable(Expr target) {
        if (!(target instanceof Name || target instanceof Attribute || target instanceof Subscript)) {
            throw new PythonSyntaxException("illegal target for annotation or augmented assignment", target.line(), 0);
        }
    }

    // ------------------------------------------------------------ expressions

    private Expr parseStarExpressionsOrYield() {
        if (peek().isKeyword("yield")) {
            return parseYield();
        }
        return parseStarExpressions();
    }

    private Expr parseYield() {
        Token start = advance();
        if (acceptKeyword("from")) {
            return new Yield(parseTest(), true, start.line());
        }
        Expr value = startsExpression(peek()) ? parseStarExpressions() : null;
        return new Yield(value, false, start.line());
    }

    private Expr parseStarExpressions() {
        Token start = peek();
        Expr first = parseStarOrNamed();
        if (!(at(TokenType.OP) && peek().text().equals(","))) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (!startsExpression(peek())) {
                break;
            }
            elements.add(parseStarOrNamed());
        }
        return new TupleExpr(elements, start.line());
    }

    private Expr parseStarOrNamed() {
        Token token = peek();
        if (acceptOp("*")) {
            return new Starred(parseBitOr(), token.line());
        }
        return parseNamedExpression();
    }

    private Expr parseTargetList() {
        Token start = peek();
        Expr first = parseTarget();
        if (!(at(TokenType.OP) && peek().text().equals(","))) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (!startsExpression(peek())) {
                break;
            }
            elements.add(parseTarget());
        }
        return new TupleExpr(elements, start.line());
    }

    private Expr parseTarget() {
        Token token = peek();
        if (acceptOp("*")) {
            return new Starred(parseBitOr(), token.line());
        }
        return parseBitOr();
    }

    private Expr parseNamedExpression() {
        Token token = peek();
        if (token.is(TokenType.NAME) && peek(1).isOp(":=")) {
            advance();
            advance();
            Expr value = parseTest();
            return new NamedExpr(new Name(token.text(), token.line()), value, token.line());
        }
        return parseTest();
    }

    private Expr parseTest() {
        Token start = peek();
        enter(start);
        try {
            if (start.isKeyword("lambda")) {
                return parseLambda();
            }
            Expr body = parseOr();
            if (acceptKeyword("if")) {
                Expr test = parseOr();
                expectKeyword("else");
                Expr orElse = parseTest();
                return new IfExp(test, body, orElse, start.line());
            }
            return body;
        } finally {
            leave();
        }
    }

    private Expr parseTestNoCondition() {
        if (peek().isKeyword("lambda")) {
            return parseLambda();
        }
        return parseOr();
    }

    private Expr parseLambda() {
        Token start = advance();
        Arguments arguments = parseParameters(":", false);
        expectOp(":", "expected ':'");
        Expr body = parseTest();
        return new Lambda(arguments, body, start.line());
    }

    private Expr parseOr() {
        Token start = peek();
        Expr first = parseAnd();
        if (!peek().isKeyword("or")) {
            return first;
        }
        List<Expr> values = new ArrayList<>(List.of(first));
        while (acceptKeyword("or")) {
            values.add(parseAnd());
        }
        return new BoolOp("or", values, start.line());
    }

    private Expr parseAnd() {
        Token start = peek();
        Expr first = parseNot();
        if (!peek().isKeyword("and")) {
            return first;
        }
        List<Expr> values = new ArrayList<>(List.of(first));
        while (acceptKeyword("and")) {
            values.add(parseNot());
        }
        return new BoolOp("and", values, start.line());
    }

    private Expr parseNot() {
        Token token = peek();
        if (token.isKeyword("not")) {
            advance();
            enter(token);
            try {
                return new UnaryOp("not", parseNot(), token.line());
            } finally {
                leave();
            }
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        Token start = peek();
        Expr left = parseBitOr();
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            Token token = peek();
            String op = null;
            if (token.is(TokenType.OP) && COMPARISON_OPERATORS.contains(token.text())) {
                op = advance().text();
            } else if (token.isKeyword("in")) {
                advance();
                op = "in";
            } else if (token.isKeyword("not") && peek(1).isKeyword("in")) {
                advance();
                advance();
                op = "not in";
            } else if (token.isKeyword("is")) {
                advance();
                op = acceptKeyword("not") ? "is not" : "is";
            }
            if (op == null) {
                break;
            }
            ops.add(op);
            comparators.add(parseBitOr());
        }
        return ops.isEmpty() ? left : new Compare(left, ops, comparators, start.line());
    }

    private Expr parseBitOr() {
        Expr left = parseBitXor();
        while (at(TokenType.OP) && peek().text().equals("|")) {
            Token op = advance();
            left = new BinOp(left, op.text(), parseBitXor(), op.line());
        }
        return left;
    }

    private Expr parseBitXor() {
        Expr left = parseBitAnd();
        while (at(TokenType.OP) && peek().text().equals("^")) {
            Token op = advance();
            left = new BinOp(left, op.text(), parseBitAnd(), op.line());
        }
        return left;
    }

    private Expr parseBitAnd() {
        Expr left = parseShift();
        while (at(TokenType.OP) && peek().text().equals("&")) {
            Token op = advance();
            left = new BinOp(left, op.text(), parseShift(), op.line());
        }
        return left;
    }

    private Expr parseShift() {
        Expr left = parseArithmetic();
        while (at(TokenType.OP) && (peek().text().equals("<<") || peek().text().equals(">>"))) {
            Token op = advance();
            left = new BinOp(left, op.text(), parseArithmetic(), op.line());
        }
        return left;
    }

    private Expr parseArithmetic() {
        Expr left = parseTerm();
        while (at(TokenType.OP) && (peek().text().equals("+") || peek().text().equals("-"))) {
            Token op = advance();
            left = new BinOp(left, op.text(), parseTerm(), op.line());
        }
        return left;
    }

    private Expr parseTerm() {
        Expr left = parseFactor();
        while (at(TokenType.OP) && Set.of("*", "/", "//", "%", "@").contains(peek().text())) {
            Token op = advance();
            left = new BinOp(left, op.text(), parseFactor(), op.line());
        }
        return left;
    }

    private Expr parseFactor() {
        Token token = peek();
        if (token.is(TokenType.OP) && Set.of("+", "-", "~").contains(token.text())) {
            advance();
            enter(token);
            try {
                return new UnaryOp(token.text(), parseFactor(), token.line());
            } finally {
                leave();
            }
        }
        return parsePower();
    }

    private Expr parsePower() {
        Expr base = parseAwait();
        if (at(TokenType.OP) && peek().text().equals("**")) {
            Token op = advance();
            return new BinOp(base, op.text(), parseFactor(), op.line());
        }
        return base;
    }

    private Expr parseAwait() {
        Token token = peek();
        if (token.isKeyword("await")) {
            advance();
            return new Await(parsePrimary(), token.line());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Expr expr = parseAtom();
        while (at(TokenType.OP)) {
            Token token = peek();
            if (token.text().equals(".")) {
                advance();
                Token name = expectName();
                expr = new Attribute(expr, name.text(), name.line());
            } else if (token.text().equals("(")) {
                expr = parseCallArguments(expr);
            } else if (token.text().equals("[")) {
                advance();
                Expr slice = parseSlices();
                expectOp("]", "invalid syntax");
                expr = new Subscript(expr, slice, token.line());
            } else {
                break;
            }
        }
        return expr;
    }

    private Call parseCallArguments(Expr func) {
        Token open = advance();
        List<Expr> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        boolean sawKeyword = false;
        boolean sawKeywordUnpack = false;
        while (!(at(TokenType.OP) && peek().text().equals(")"))) {
            Token token = peek();
            if (acceptOp("*")) {
                if (sawKeywordUnpack) {
                    throw error(token, "iterable argument unpacking follows keyword argument unpacking");
                }
                args.add(new Starred(parseTest(), token.line()));
            } else if (acceptOp("**")) {
                keywords.add(new Keyword(null, parseTest(), token.line()));
                sawKeywordUnpack = true;
            } else if (token.is(TokenType.NAME) && peek(1).isOp("=")) {
                advance();
                advance();
                String name = token.text();
                if (keywords.stream().anyMatch(keyword -> name.equals(keyword.name()))) {
                    throw error(token, "keyword argument repeated: " + name);
                }
                keywords.add(new Keyword(name, parseTest(), token.line()));
                sawKeyword = true;
            } else {
                Expr value = parseNamedExpression();
                if (peek().isKeyword("for") || (peek().isKeyword("async") && peek(1).isKeyword("for"))) {
                    value = new Comprehension(
                        ComprehensionKind.GENERATOR, value, null, parseComprehensionClauses(), value.line());
                }
                if (sawKeywordUnpack) {
                    throw error(token, "positional argument follows keyword argument unpacking");
                }
                if (sawKeyword) {
                    throw error(token, "positional argument follows keyword argument");
                }
                args.add(value);
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        expectOp(")", "'(' was never closed");
        return new Call(func, args, keywords, open.line());
    }

    private Expr parseSlices() {
        Token start = peek();
        Expr first = parseSlice();
        if (!(at(TokenType.OP) && peek().text().equals(","))) {
            return first;
        }
        List<Expr> elements = new ArrayList<>(List.of(first));
        while (acceptOp(",")) {
            if (at(TokenType.OP) && peek().text().equals("]")) {
                break;
            }
            elements.add(parseSlice());
        }
        return new TupleExpr(elements, start.line());
    }

    private Expr parseSlice() {
        Token start = peek();
        Expr lower = null;
        if (!(at(TokenType.OP) && peek().text().equals(":"))) {
            lower = parseStarOrNamed();
            if (!(at(TokenType.OP) && peek().text().equals(":"))) {
                return lower;
            }
        }
        advance();
        Expr upper = startsSliceBound() ? parseTest() : null;
        Expr step = null;
        if (acceptOp(":")) {
            step = startsSliceBound() ? parseTest() : null;
        }
        return new Slice(lower, upper, step, start.line());
    }

    private boolean startsSliceBound() {
        Token token = peek();
        return startsExpression(token) && !token.isOp(":") && !token.isOp("*");
    }

    private Expr parseAtom() {
        Token token = peek();
        switch (token.type()) {
            case NAME:
                advance();
                return new Name(token.text(), token.line());
            case NUMBER:
                advance();
                return numberConstant(token);
            case STRING:
            case FSTRING:
                return parseStrings();
            case KEYWORD:
                return parseKeywordAtom(token);
            case OP:
                return parseBracketAtom(token);
            case NEWLINE:
            case EOF:
                throw error(token, "invalid syntax");
            case INDENT:
                throw error(token, "unexpected indent");
            default:
                throw error(token, "invalid syntax");
        }
    }

    private Expr parseKeywordAtom(Token token) {
        switch (token.text()) {
            case "True":
            case "False":
                advance();
                return new Constant(Boolean.valueOf(token.text().equals("True")), ConstantKind.BOOLEAN, token.line());
            case "None":
                advance();
                return new Constant(null, ConstantKind.NONE, token.line());
            default:
                throw error(token, "invalid syntax");
        }
    }

    private Expr parseBracketAtom(Token token) {
        switch (token.text()) {
            case "(":
                return parseParenthesized();
            case "[":
                return parseList();
            case "{":
                return parseDictOrSet();
            case "...":
                advance();
                return new Constant(null, ConstantKind.ELLIPSIS, token.line());
            default:
                throw error(token, "invalid syntax");
        }
    }

    private Expr parseParenthesized() {
        Token open = advance();
        enter(open);
        try {
            if (acceptOp(")")) {
                return new TupleExpr(List.of(), open.line());
            }
            if (peek().isKeyword("yield")) {
                Expr yield = parseYield();
                expectOp(")", "'(' was never closed");
                return yield;
            }
            Expr first = parseStarOrNamed();
            if (peek().isKeyword("for") || (peek().isKeyword("async") && peek(1).isKeyword("for"))) {
                Expr generator = new Comprehension(
                    ComprehensionKind.GENERATOR, first, null, parseComprehensionClauses(), open.line());
                expectOp(")", "'(' was never closed");
                return generator;
            }
            if (acceptOp(")")) {
                if (first instanceof Starred) {
                    throw error(open, "cannot use starred expression here");
                }
                return first;
            }
            List<Expr> elements = new ArrayList<>(List.of(first));
            while (acceptOp(",")) {
                if (at(TokenType.OP) && peek().text().equals(")")) {
                    break;
                }
                elements.add(parseStarOrNamed());
            }
            expectOp(")", "'(' was never closed");
            return new TupleExpr(elements, open.line());
        } finally {
            leave();
        }
    }

    private Expr parseList() {
        Token open = advance();
        enter(open);
        try {
            List<Expr> elements = new ArrayList<>();
            if (acceptOp("]")) {
                return new ListExpr(elements, open.line());
            }
            Expr first = parseStarOrNamed();
            if (peek().isKeyword("for") || (peek().isKeyword("async") && peek(1).isKeyword("for"))) {
                Expr comprehension = new Comprehension(
                    ComprehensionKind.LIST, first, null, parseComprehensionClauses(), open.line());
                expectOp("]", "'[' was never closed");
                return comprehension;
            }
            elements.add(first);
            while (acceptOp(",")) {
                if (at(TokenType.OP) && peek().text().equals("]")) {
                    break;
                }
                elements.add(parseStarOrNamed());
            }
            expectOp("]", "'[' was never closed");
            return new ListExpr(elements, open.line());
        } finally {
            leave();
        }
    }

    private Expr parseDictOrSet() {
        Token open = advance();
        enter(open);
        try {
            if (acceptOp("}")) {
                return new DictExpr(List.of(), List.of(), open.line());
            }
            if (at(TokenType.OP) && peek().text().equals("**")) {
                return parseDictEntries(open, null, null);
            }
            Expr first = parseStarOrNamed();
            if (acceptOp(":")) {
                Expr value = parseTest();
                if (peek().isKeyword("for") || (peek().isKeyword("async") && peek(1).isKeyword("for"))) {
                    Expr comprehension = new Comprehension(
                        ComprehensionKind.DICT, first, value, parseComprehensionClauses(), open.line());
                    expectOp("}", "'{' was never closed");
                    return comprehension;
                }
                return parseDictEntries(open, first, value);
            }
            if (peek().isKeyword("for") || (peek().isKeyword("async") && peek(1).isKeyword("for"))) {
                Expr comprehension = new Comprehension(
                    ComprehensionKind.SET, first, null, parseComprehensionClauses(), open.line());
                expectOp("}", "'{' was never closed");
                return comprehension;
            }
            List<Expr> elements = new ArrayList<>(List.of(first));
            while (acceptOp(",")) {
                if (at(TokenType.OP) && peek().text().equals("}")) {
                    break;
                }
                elements.add(parseStarOrNamed());
            }
            expectOp("}", "'{' was never closed");
            return new SetExpr(elements, open.line());
        } finally {
            leave();
        }
    }

    private Expr parseDictEntries(Token open, Expr firstKey, Expr firstValue) {
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        if (firstValue != null) {
            keys.add(firstKey);
            values.add(firstValue);
            if (!acceptOp(",")) {
                expectOp("}", "'{' was never closed");
                return new DictExpr(keys, values, open.line());
            }
        }
        while (!(at(TokenType.OP) && peek().text().equals("}"))) {
            if (acceptOp("**")) {
                keys.add(null);
                values.add(parseBitOr());
            } else {
                keys.add(parseTest());
                expectOp(":", "':' expected after dictionary key");
                values.add(parseTest());
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        expectOp("}", "'{' was never closed");
        return new DictExpr(keys, values, open.line());
    }

    private List<ComprehensionClause> parseComprehensionClauses() {
        List<ComprehensionClause> clauses = new ArrayList<>();
        while (peek().isKeyword("for") || (peek().isKeyword("async") && peek(1).isKeyword("for"))) {
            boolean async = acceptKeyword("async");
            Token start = advance();
            Expr target = parseTargetList();
            checkAssignable(target);
            expectKeyword("in");
            Expr iter = parseOr();
            List<Expr> conditions = new ArrayList<>();
            while (acceptKeyword("if")) {
                conditions.add(parseTestNoCondition());
            }
            clauses.add(new ComprehensionClause(target, iter, conditions, async, start.line()));
        }
        return clauses;
    }

    // ---------------------------------------------------------------- literals

    private Expr numberConstant(Token token) {
        String text = token.text().replace("_", "");
        String lower = text.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith("j")) {
                return new Constant(Double.valueOf(lower.substring(0, lower.length() - 1)), ConstantKind.COMPLEX,
                    token.line());
            }
            if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
                int radix = lower.charAt(1) == 'x' ? 16 : lower.charAt(1) == 'o' ? 8 : 2;
                return integerConstant(new BigInteger(lower.substring(2), radix), token.line());
            }
            if (lower.contains(".") || lower.contains("e")) {
                return new Constant(Double.valueOf(lower), ConstantKind.FLOAT, token.line());
            }
            return integerConstant(new BigInteger(lower), token.line());
        } catch (NumberFormatException e) {
            throw error(token, "invalid number literal");
        }
    }

    private static Constant integerConstant(BigInteger value, int line) {
        Object boxed = value.bitLength() < 64 ? (Object) Long.valueOf(value.longValue()) : value;
        return new Constant(boxed, ConstantKind.INTEGER, line);
    }

    private Expr parseStrings() {
        Token first = peek();
        List<Token> parts = new ArrayList<>();
        while (at(TokenType.STRING) || at(TokenType.FSTRING)) {
            parts.add(advance());
        }
        boolean template = parts.stream().anyMatch(part -> part.is(TokenType.FSTRING));
        boolean bytes = first.isBytes();
        if (parts.stream().anyMatch(part -> part.isBytes() != bytes)) {
            throw error(first, "cannot mix bytes and nonbytes literals");
        }
        if (!template) {
            StringBuilder value = new StringBuilder();
            parts.forEach(part -> value.append(part.text()));
            return new Constant(value.toString(), bytes ? ConstantKind.BYTES : ConstantKind.STRING, first.line());
        }
        List<Expr> values = new ArrayList<>();
        for (Token part : parts) {
            if (part.is(TokenType.FSTRING)) {
                values.addAll(FormattedStringParser.parse(part));
            } else {
                values.add(new Constant(part.text(), ConstantKind.STRING, part.line()));
            }
        }
        return new JoinedStr(values, first.line());
    }

    // ------------------------------------------------------------------ tokens

    private boolean startsExpression(Token token) {
        return switch (token.type()) {
            case NAME, NUMBER, STRING, FSTRING -> true;
            case KEYWORD -> Set.of("None", "True", "False", "not", "lambda", "await", "yield").contains(token.text());
            case OP -> Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(token.text());
            default -> false;
        };
    }

    private Token peek() {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private boolean at(TokenType type) {
        return peek().is(type);
    }

    private Token advance() {
        Token token = peek();
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }

    private boolean acceptOp(String op) {
        if (peek().isOp(op)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectOp(String op, String message) {
        if (!acceptOp(op)) {
            throw error(peek(), message);
        }
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error(peek(), "expected '" + keyword + "'");
        }
    }

    private Token expectName() {
        Token token = peek();
        if (!token.is(TokenType.NAME)) {
            throw error(token, "invalid syntax");
        }
        return advance();
    }

    private void enter(Token token) {
        if (++depth > MAX_NESTING) {
            throw error(token, "too many nested expressions");
        }
    }

    private void leave() {
        depth--;
    }

    private static PythonSyntaxException error(Token token, String message) {
        return new PythonSyntaxException(message, token.line(), token.column());
    }

    /**
     * Splits an f-string body into literal parts and embedded expressions.
     */
    private static final class FormattedStringParser {

        private FormattedStringParser() {
        }

        static List<Expr> parse(Token token) {
            String body = token.text();
            List<Expr> values = new ArrayList<>();
            StringBuilder literal = new StringBuilder();
            int i = 0;
            while (i < body.length()) {
                char c = body.charAt(i);
                if (c == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                } else if (c == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                } else if (c == '{') {
                    if (literal.length() > 0) {
                        values.add(new Constant(literal.toString(), ConstantKind.STRING, token.line()));
                        literal.setLength(0);
                    }
                    i = parseField(token, body, i + 1, values);
                } else if (c == '}') {
                    throw error(token, "f-string: single '}' is not allowed");
                } else {
                    literal.append(c);
                    i++;
                }
            }
            if (literal.length() > 0) {
                values.add(new Constant(literal.toString(), ConstantKind.STRING, token.line()));
            }
            return values;
        }

        private static int parseField(Token token, String body, int start, List<Expr> values) {
            int nesting = 0;
            int i = start;
            char quote = 0;
            int expressionEnd = -1;
            while (i < body.length()) {
                char c = body.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '(' || c == '[' || c == '{') {
                    nesting++;
                } else if ((c == ')' || c == ']' || c == '}') && nesting > 0) {
                    nesting--;
                } else if (nesting == 0 && (c == '}' || c == ':' || (c == '!' && peekChar(body, i + 1) != '='))) {
                    expressionEnd = i;
                    break;
                }
                i++;
            }
            if (expressionEnd < 0) {
                throw error(token, "f-string: expecting '}'");
            }

            String expression = body.substring(start, expressionEnd);
            if (expression.endsWith("=") && !expression.endsWith("==")) {
                expression = expression.substring(0, expression.length() - 1);
            }
            if (expression.isBlank()) {
                throw error(token, "f-string: empty expression not allowed");
            }
            try {
                values.add(PythonParser.parseExpression(expression));
            } catch (PythonSyntaxException e) {
                throw error(token, "f-string: " + e.getMessage());
            }

            int close = expressionEnd;
            int braces = 0;
            while (close < body.length()) {
                char c = body.charAt(close);
                if (c == '{') {
                    braces++;
                } else if (c == '}') {
                    if (braces == 0) {
                        return close + 1;
                    }
                    braces--;
                }
                close++;
            }
            throw error(token, "f-string: expecting '}'");
        }

        private static char peekChar(String text, int index) {
            return index < text.length() ? text.charAt(index) : 0;
        }
    }
}
