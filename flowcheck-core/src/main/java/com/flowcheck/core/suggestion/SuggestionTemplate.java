package com.flowcheck.core.suggestion;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.Suggestion;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fix template for one diagnostic code.
 *
 * <p>Text may contain {@code ${key}} placeholders. A placeholder is filled from the
 * diagnostic's context, then from {@code line}, then from {@link #defaults()}; an
 * unresolved placeholder is left as written.</p>
 *
 * @param description one-line description
 * @param fix short fix instruction
 * @param codeExample example code
 * @param explanation why the fix is needed
 * @param defaults fallback placeholder values
 */
public record SuggestionTemplate(
    String description,
    String fix,
    String codeExample,
    String explanation,
    Map<String, String> defaults
) {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([a-z_]+)}");

    public SuggestionTemplate {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(fix, "fix must not be null");
        Objects.requireNonNull(codeExample, "codeExample must not be null");
        Objects.requireNonNull(explanation, "explanation must not be null");
        defaults = defaults != null ? Map.copyOf(defaults) : Map.of();
    }

    /**
     * Renders the template for a diagnostic.
     *
     * @param diagnostic first diagnostic of the code
     * @return suggestion
     */
    public Suggestion render(Diagnostic diagnostic) {
        return new Suggestion(
            diagnostic.code(),
            fill(description, diagnostic),
            fill(fix, diagnostic),
            fill(codeExample, diagnostic),
            fill(explanation, diagnostic));
    }

    private String fill(String text, Diagnostic diagnostic) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = diagnostic.contextValue(key);
            if (value == null && "line".equals(key) && diagnostic.line() != null) {
                value = diagnostic.line().toString();
            }
            if (value == null) {
                value = defaults.getOrDefault(key, matcher.group());
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
