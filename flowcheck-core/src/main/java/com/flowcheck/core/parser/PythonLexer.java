package com.flowcheck.core.parser;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Tokenizer for Python source.
 *
 * <p>Produces the token stream consumed by {@link PythonParser}, including synthetic
 * {@link TokenType#NEWLINE}, {@link TokenType#INDENT} and {@link TokenType#DEDENT}
 * tokens. Newlines inside brackets and after a backslash continuation are joined,
 * blank and comment-only lines produce no tokens.</p>
 *
 * <p>Bracket nesting is capped at {@value #MAX_BRACKET_DEPTH} and indentation at
 * {@value #MAX_INDENT_DEPTH} levels, matching CPython's own limits.</p>
 */
public final class PythonLexer {

    static final int MAX_BRACKET_DEPTH = 200;
    static final int MAX_INDENT_DEPTH = 100;
    private static final int TAB_SIZE = 8;

    static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break",
        "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
        "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
        "pass", "raise", "return", "try", "while", "with", "yield"
    );

    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "f", "br", "rb", "fr", "rf"
    );

    // Longest first so that greedy matching picks "**=" before "**" before "*".
    private static final List<String> OPERATORS = List.of(
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    );

    private final String source;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Token> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean atLineStart = true;

    private PythonLexer(String source) {
        this.source = source.startsWith("\uFEFF") ? source.substring(1) : source;
        this.length = this.source.length();
        this.indents.push(0);
    }

    /**
     * Tokenizes Python source.
     *
     * @param source source text
     * @return tokens, always terminated by {@link TokenType#EOF}
     * @throws PythonSyntaxException if the text is not lexically valid Python
     */
    public static List<Token> tokenize(String source) {
        return new PythonLexer(source != null ? source : "").run();
    }

    private List<Token> run() {
        while (pos < length) {
            if (atLineStart && brackets.isEmpty()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Tokenizing interrupted");
                }
                handleIndentation();
                continue;
            }

            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                lineContinuation();
            } else if (c == '\n' || c == '\r') {
                if (brackets.isEmpty()) {
                    emitNewline();
                    atLineStart = true;
                }
                consumeNewline();
            } else if (c == '"' || c == '\'') {
                lexString("", pos);
            } else if (isDigit(c) || (c == '.' && pos + 1 < length && isDigit(source.charAt(pos + 1)))) {
                lexNumber();
            } else if (isIdentifierStart(c)) {
                lexName();
            } else {
                lexOperator();
            }
        }
        return finish();
    }

    private List<Token> finish() {
        if (!brackets.isEmpty()) {
            Token open = brackets.peek();
            throw new PythonSyntaxException("'" + open.text() + "' was never closed", open.line(), open.column());
        }
        emitNewline();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", "", line, 1));
        }
        tokens.add(new Token(TokenType.EOF, "", "", line, 1));
        return List.copyOf(tokens);
    }

    private void handleIndentation() {
        int width = 0;
        int start = pos;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            pos++;
        }

        if (pos >= length) {
            return;
        }
        char c = source.charAt(pos);
        if (c == '#') {
            skipComment();
            return;
        }
        if (c == '\n' || c == '\r') {
            consumeNewline();
            return;
        }
        if (c == '\\' && pos + 1 < length && (source.charAt(pos + 1) == '\n' || source.charAt(pos + 1) == '\r')) {
            lineContinuation();
            return;
        }

        atLineStart = false;
        int current = indents.peek();
        int column = pos - start + 1;
        if (width > current) {
            if (indents.size() > MAX_INDENT_DEPTH) {
                throw new PythonSyntaxException("too many levels of indentation", line, column);
            }
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", "", line, column));
        } else if (width < current) {
            while (width < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", "", line, column));
            }
            if (width != indents.peek()) {
                throw new PythonSyntaxException("unindent does not match any outer indentation level", line, column);
            }
        }
    }

    private void skipComment() {
        while (pos < length && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void lineContinuation() {
        int column = column();
        pos++;
        if (pos < length && (source.charAt(pos) == '\n' || source.charAt(pos) == '\r')) {
            consumeNewline();
            return;
        }
        if (pos >= length) {
            throw new PythonSyntaxException("unexpected EOF while parsing", line, column);
        }
        throw new PythonSyntaxException("unexpected character after line continuation character", line, column);
    }

    private void consumeNewline() {
        if (source.charAt(pos) == '\r' && pos + 1 < length && source.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
        lineStart = pos;
    }

    private void emitNewline() {
        if (tokens.isEmpty()) {
            return;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        if (last != TokenType.NEWLINE && last != TokenType.INDENT && last != TokenType.DEDENT) {
            tokens.add(new Token(TokenType.NEWLINE, "", "", line, column()));
        }
    }

    private void lexName() {
        int start = pos;
        int column = column();
        pos++;
        while (pos < length && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String text = source.substring(start, pos);

        if (pos < length && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
            && STRING_PREFIXES.contains(text.toLowerCase(Locale.ROOT))) {
            lexString(text.toLowerCase(Locale.ROOT), start);
            return;
        }

        TokenType type = KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.NAME;
        tokens.add(new Token(type, text, "", line, column));
    }

    private void lexString(String prefix, int tokenStart) {
        int startLine = line;
        int startColumn = tokenStart - lineStart + 1;
        char quote = source.charAt(pos);
        boolean triple = pos + 2 < length && source.charAt(pos + 1) == quote && source.charAt(pos + 2) == quote;
        boolean raw = prefix.indexOf('r') >= 0;
        boolean template = prefix.indexOf('f') >= 0;
        boolean bytes = prefix.indexOf('b') >= 0;
        pos += triple ? 3 : 1;

        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= length) {
                String message = triple
                    ? "unterminated triple-quoted string literal (detected at line " + line + ")"
                    : "unterminated string literal (detected at line " + line + ")";
                throw new PythonSyntaxException(message, startLine, startColumn);
            }
            char c = source.charAt(pos);
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (pos + 2 < length && source.charAt(pos + 1) == quote && source.charAt(pos + 2) == quote) {
                    pos += 3;
                    break;
                }
                value.append(c);
                pos++;
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new PythonSyntaxException(
                        "unterminated string literal (detected at line " + line + ")", startLine, startColumn);
                }
                consumeNewline();
                value.append('\n');
            } else if (c == '\\') {
                if (pos + 1 >= length) {
                    pos++;
                    continue;
                }
                if (raw || template) {
                    char next = source.charAt(pos + 1);
                    value.append(c);
                    if (next == '\n' || next == '\r') {
                        pos++;
                        consumeNewline();
                        value.append('\n');
                    } else {
                        value.append(next);
                        pos += 2;
                    }
                } else {
                    decodeEscape(value, bytes);
                }
            } else {
                value.append(c);
                pos++;
            }
        }

        TokenType type = template ? TokenType.FSTRING : TokenType.STRING;
        tokens.add(new Token(type, value.toString(), prefix, startLine, startColumn));
    }

    private void decodeEscape(StringBuilder value, boolean bytes) {
        char next = source.charAt(pos + 1);
        pos += 2;
        switch (next) {
            case '\n' -> {
                line++;
                lineStart = pos;
            }
            case '\r' -> {
                if (pos < length && source.charAt(pos) == '\n') {
                    pos++;
                }
                line++;
                lineStart = pos;
            }
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case 'a' -> value.append('\u0007');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'v' -> value.append('\u000B');
            case '\\', '\'', '"' -> value.append(next);
            case 'x' -> value.append((char) readHex(2, next));
            case 'u' -> appendUnicode(value, bytes, 4, next);
            case 'U' -> appendUnicode(value, bytes, 8, next);
            case 'N' -> {
                int end = source.indexOf('}', pos);
                if (bytes || pos >= length || source.charAt(pos) != '{' || end < 0) {
                    value.append("\\N");
                } else {
                    value.append(source, pos - 2, end + 1);
                    pos = end + 1;
                }
            }
            default -> {
                if (next >= '0' && next <= '7') {
                    int code = next - '0';
                    for (int i = 0; i < 2 && pos < length && source.charAt(pos) >= '0' && source.charAt(pos) <= '7'; i++) {
                        code = code * 8 + (source.charAt(pos) - '0');
                        pos++;
                    }
                    value.append((char) code);
                } else {
                    value.append('\\').append(next);
                }
            }
        }
    }

    private void appendUnicode(StringBuilder value, boolean bytes, int digits, char marker) {
        if (bytes) {
            value.append('\\').append(marker);
            return;
        }
        value.appendCodePoint(readHex(digits, marker));
    }

    private int readHex(int digits, char marker) {
        if (pos + digits > length) {
            throw new PythonSyntaxException("truncated \\" + marker + " escape", line, column());
        }
        String hex = source.substring(pos, pos + digits);
        try {
            int value = Integer.parseInt(hex, 16);
            pos += digits;
            return value;
        } catch (NumberFormatException e) {
            throw new PythonSyntaxException("truncated \\" + marker + " escape", line, column());
        }
    }

    private void lexNumber() {
        int start = pos;
        int column = column();
        char c = source.charAt(pos);

        if (c == '0' && pos + 1 < length && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            char kind = Character.toLowerCase(source.charAt(pos + 1));
            pos += 2;
            while (pos < length && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            String digits = source.substring(start + 2, pos).replace("_", "");
            int radix = kind == 'x' ? 16 : kind == 'o' ? 8 : 2;
            try {
                new BigInteger(digits, radix);
            } catch (NumberFormatException e) {
                String name = kind == 'x' ? "hexadecimal" : kind == 'o' ? "octal" : "binary";
                throw new PythonSyntaxException("invalid " + name + " literal", line, column);
            }
            tokens.add(new Token(TokenType.NUMBER, source.substring(start, pos), "", line, column));
            return;
        }

        consumeDigits();
        boolean isFloat = false;
        if (pos < length && source.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            consumeDigits();
        }
        if (pos < length && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < length && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < length && isDigit(source.charAt(pos))) {
                isFloat = true;
                consumeDigits();
            } else {
                pos = mark;
            }
        }
        if (pos < length && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
            pos++;
        }
        if (pos < length && isIdentifierPart(source.charAt(pos))) {
            throw new PythonSyntaxException("invalid decimal literal", line, column);
        }

        String text = source.substring(start, pos);
        String digits = text.replace("_", "");
        if (!isFloat && digits.length() > 1 && digits.startsWith("0") && !digits.chars().allMatch(ch -> ch == '0')
            && !digits.endsWith("j") && !digits.endsWith("J")) {
            throw new PythonSyntaxException(
                "leading zeros in decimal integer literals are not permitted", line, column);
        }
        tokens.add(new Token(TokenType.NUMBER, text, "", line, column));
    }

    private void consumeDigits() {
        while (pos < length && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void lexOperator() {
        int column = column();
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                Token token = new Token(TokenType.OP, op, "", line, column);
                trackBracket(token);
                tokens.add(token);
                return;
            }
        }
        char c = source.charAt(pos);
        if (c == '!') {
            throw new PythonSyntaxException("invalid syntax", line, column);
        }
        throw new PythonSyntaxException(
            String.format("invalid character '%c' (U+%04X)", c, (int) c), line, column);
    }

    private void trackBracket(Token token) {
        switch (token.text()) {
            case "(", "[", "{" -> {
                if (brackets.size() >= MAX_BRACKET_DEPTH) {
                    throw new PythonSyntaxException("too many nested parentheses", token.line(), token.column());
                }
                brackets.push(token);
            }
            case ")", "]", "}" -> {
                if (brackets.isEmpty()) {
                    throw new PythonSyntaxException("unmatched '" + token.text() + "'", token.line(), token.column());
                }
                Token open = brackets.pop();
                if (!matches(open.text(), token.text())) {
                    throw new PythonSyntaxException(
                        "closing parenthesis '" + token.text() + "' does not match opening parenthesis '"
                            + open.text() + "'",
                        token.line(), token.column());
                }
            }
            default -> {
                // not a bracket
            }
        }
    }

    private static boolean matches(String open, String close) {
        return (open.equals("(") && close.equals(")"))
            || (open.equals("[") && close.equals("]"))
            || (open.equals("{") && close.equals("}"));
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) || (c > 127 && Character.isUnicodeIdentifierStart(c));
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }
}
