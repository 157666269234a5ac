package com.flowcheck.core.validator.impl;

import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.parser.ast.PythonAst.Call;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the gold-standard table: a structural match over call expressions.
 *
 * @param code code reported on a match
 * @param name short pattern name, e.g. {@code execution-pattern}
 * @param description what the correct form looks like
 * @param matcher predicate over a call expression
 * @param message builds the diagnostic message for a matching call
 */
public record GoldStandardPattern(
    DiagnosticCode code,
    String name,
    String description,
    Predicate<Call> matcher,
    Function<Call, String> message
) {
    public GoldStandardPattern {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public boolean matches(Call call) {
        return matcher.test(call);
    }
}
