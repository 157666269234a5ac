package com.flowcheck.core.validator.impl;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConvergenceExpressionChecker}.
 */
class ConvergenceExpressionCheckerTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "quality > 0.9",
        "converged",
        "True",
        "error < 0.01 and iteration >= 3",
        "not done or count == 10",
        "abs(delta) < 1e-6",
        "result['score'] >= threshold",
        "state.value in ('done', 'stopped')",
        "0 < score <= 1"
    })
    void isValid_booleanExpressions_returnsTrue(String expression) {
        assertThat(ConvergenceExpressionChecker.isValid(expression)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
        "   ",
        "quality >",
        "x = 5",
        "lambda x: x > 1",
        "(n := 3) > 2",
        "[x for x in items]",
        "42",
        "'done'",
        "a, b"
    })
    void isValid_invalidExpressions_returnsFalse(String expression) {
        assertThat(ConvergenceExpressionChecker.isValid(expression)).isFalse();
    }
}
