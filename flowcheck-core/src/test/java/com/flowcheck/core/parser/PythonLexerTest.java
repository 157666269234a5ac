package com.flowcheck.core.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PythonLexer}.
 */
class PythonLexerTest {

    @Test
    void tokenize_simpleAssignment_producesLogicalLine() {
        List<Token> tokens = PythonLexer.tokenize("count = 10\n");

        assertThat(tokens).extracting(Token::type).containsSubsequence(
            TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE, TokenType.EOF);
        assertThat(tokens.get(0).text()).isEqualTo("count");
        assertThat(tokens.get(1).isOp("=")).isTrue();
        assertThat(tokens.get(tokens.size() - 1).is(TokenType.EOF)).isTrue();
    }

    @Test
    void tokenize_indentedBlock_emitsIndentAndDedent() {
        List<Token> tokens = PythonLexer.tokenize("""
            if ready:
                run()
            done()
            """);

        assertThat(tokens).extracting(Token::type).containsSubsequence(
            TokenType.KEYWORD, TokenType.NAME, TokenType.OP, TokenType.NEWLINE,
            TokenType.INDENT, TokenType.NAME,
            TokenType.DEDENT, TokenType.NAME);
        assertThat(tokens.get(0).isKeyword("if")).isTrue();
    }

    @Test
    void tokenize_bracketsSpanLines_suppressNewlines() {
        List<Token> tokens = PythonLexer.tokenize("""
            call(
                1,
                2,
            )
            """);

        long newlines = tokens.stream().filter(token -> token.is(TokenType.NEWLINE)).count();
        assertThat(newlines).isEqualTo(1);
        assertThat(tokens).noneMatch(token -> token.is(TokenType.INDENT));
    }

    @Test
    void tokenize_tracksLineNumbers() {
        List<Token> tokens = PythonLexer.tokenize("a = 1\n\n# note\nb = 2\n");

        Token b = tokens.stream().filter(token -> token.text().equals("b")).findFirst().orElseThrow();
        assertThat(b.line()).isEqualTo(4);
    }

    @Test
    void tokenize_bytesLiteral_keepsPrefix() {
        Token token = PythonLexer.tokenize("b'raw'\n").get(0);

        assertThat(token.is(TokenType.STRING)).isTrue();
        assertThat(token.isBytes()).isTrue();
    }

    @Test
    void tokenize_unclosedBracket_throwsSyntaxError() {
        assertThatThrownBy(() -> PythonLexer.tokenize("items = [1, 2\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessage("'[' was never closed");
    }

    @Test
    void tokenize_unmatchedClosingBracket_throwsSyntaxError() {
        assertThatThrownBy(() -> PythonLexer.tokenize("x = 1)\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessage("unmatched ')'");
    }

    @Test
    void tokenize_leadingZeroInteger_throwsSyntaxError() {
        assertThatThrownBy(() -> PythonLexer.tokenize("x = 012\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessageContaining("leading zeros");
    }

    @Test
    void tokenize_excessiveBracketNesting_throwsSyntaxErrorInsteadOfOverflowing() {
        String source = "(".repeat(500) + "1" + ")".repeat(500) + "\n";

        assertThatThrownBy(() -> PythonLexer.tokenize(source))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessage("too many nested parentheses");
    }

    @Test
    void tokenize_inconsistentDedent_throwsSyntaxError() {
        assertThatThrownBy(() -> PythonLexer.tokenize("if x:\n        a = 1\n    b = 2\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessage("unindent does not match any outer indentation level");
    }
}
