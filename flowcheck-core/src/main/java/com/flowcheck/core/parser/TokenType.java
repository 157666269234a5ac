package com.flowcheck.core.parser;

/**
 * Lexical token categories produced by {@link PythonLexer}.
 */
public enum TokenType {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    FSTRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
