package com.flowcheck.core.validator;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for rule validators.
 *
 * <p>Provides a logger named after the concrete class, debug logging of the
 * diagnostic count, and helpers for building context maps.</p>
 */
public abstract class AbstractRuleValidator implements RuleValidator {

    /**
     * Logger instance for this validator.
     * Automatically initialized with the concrete validator class name.
     */
    protected final Logger log;

    protected AbstractRuleValidator() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final List<Diagnostic> validate(ValidationContext context) {
        List<Diagnostic> diagnostics = check(context);
        log.debug("{} reported {} diagnostics", getId(), diagnostics.size());
        return List.copyOf(diagnostics);
    }

    /**
     * Performs the actual checks.
     *
     * @param context validation context
     * @return diagnostics in emission order
     */
    protected abstract List<Diagnostic> check(ValidationContext context);

    /**
     * Builds an ordered context map from alternating keys and values. Null values are skipped.
     *
     * @param keysAndValues key, value, key, value, ...
     * @return ordered context
     */
    protected static Map<String, Object> context(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Context needs key/value pairs");
        }
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                context.put(keysAndValues[i].toString(), keysAndValues[i + 1]);
            }
        }
        return context;
    }

    protected static Diagnostic diagnostic(DiagnosticCode code, String message, Integer line, Map<String, Object> context) {
        return Diagnostic.of(code, message, line, context);
    }
}
