package com.flowcheck.core.parser;

import java.util.Objects;

/**
 * A lexical token.
 *
 * <p>For {@link TokenType#STRING} tokens {@code text} holds the decoded literal value;
 * for {@link TokenType#FSTRING} tokens it holds the raw template body. {@code prefix}
 * is the lowercase string prefix ({@code "r"}, {@code "b"}, {@code "f"}, ...) and is
 * empty for every other token type.</p>
 *
 * @param type token category
 * @param text token text
 * @param prefix string prefix, lowercase
 * @param line 1-based line
 * @param column 1-based column
 */
public record Token(
    TokenType type,
    String text,
    String prefix,
    int line,
    int column
) {
    public Token {
        Objects.requireNonNull(type, "type must not be null");
        text = text != null ? text : "";
        prefix = prefix != null ? prefix : "";
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    public boolean isBytes() {
        return prefix.indexOf('b') >= 0;
    }

    /**
     * Short description used in syntax error messages.
     *
     * @return printable form
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of file";
            case STRING, FSTRING -> "string literal";
            default -> "'" + text + "'";
        };
    }
}
