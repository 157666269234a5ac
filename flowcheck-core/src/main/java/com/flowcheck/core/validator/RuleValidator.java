package com.flowcheck.core.validator;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCategory;

import java.util.List;

/**
 * One independent rule pass over a parsed workflow.
 *
 * <p>Validators read the {@link ValidationContext} and return diagnostics; they never
 * mutate the context and keep no state between calls, so one instance can serve
 * concurrent requests. A validator may throw on an unexpected fault; the facade
 * isolates each pass and reports the fault as {@code VAL001}.</p>
 *
 * <p><b>Implementation Guidelines:</b></p>
 * <ul>
 *   <li>Return an empty list when nothing is wrong, never null</li>
 *   <li>Report only codes of {@link #getCategory()}</li>
 *   <li>Use {@link com.flowcheck.core.model.Diagnostic#of} so the catalog severity applies</li>
 * </ul>
 *
 * @see AbstractRuleValidator
 */
public interface RuleValidator {

    /**
     * Stable identifier used in logs and in {@code VAL001} context, e.g. {@code "connections"}.
     *
     * @return validator id
     */
    String getId();

    String getDisplayName();

    DiagnosticCategory getCategory();

    /**
     * Runs the pass.
     *
     * @param context parsed source, IR, graph and shared read-only catalogs
     * @return diagnostics in emission order
     */
    List<Diagnostic> validate(ValidationContext context);
}
