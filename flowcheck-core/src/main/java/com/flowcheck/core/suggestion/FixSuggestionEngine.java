package com.flowcheck.core.suggestion;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns diagnostics into fix suggestions.
 *
 * <p>Exactly one suggestion is produced per distinct diagnostic code, in the order the
 * codes first appear. The first diagnostic of each code fills the template placeholders.
 * Codes outside the catalog get a generic manual-fix suggestion.</p>
 */
public class FixSuggestionEngine {

    private static final Logger log = LoggerFactory.getLogger(FixSuggestionEngine.class);

    static final String MANUAL_FIX = "# Manual fix required";
    static final String MANUAL_EXPLANATION = "This error requires manual attention.";

    /**
     * Generates suggestions for a list of diagnostics.
     *
     * @param diagnostics diagnostics in response order
     * @return one suggestion per distinct code
     */
    public List<Suggestion> suggest(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return List.of();
        }

        Set<String> seen = new HashSet<>();
        List<Suggestion> suggestions = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic == null || !seen.add(diagnostic.code())) {
                continue;
            }
            suggestions.add(suggestionFor(diagnostic));
        }
        log.debug("Generated {} suggestions for {} diagnostics", suggestions.size(), diagnostics.size());
        return List.copyOf(suggestions);
    }

    private Suggestion suggestionFor(Diagnostic diagnostic) {
        return diagnostic.knownCode()
            .map(code -> SuggestionTemplates.forCode(code).render(diagnostic))
            .orElseGet(() -> genericSuggestion(diagnostic));
    }

    private Suggestion genericSuggestion(Diagnostic diagnostic) {
        log.debug("No template for code '{}', using manual fix", diagnostic.code());
        return new Suggestion(
            diagnostic.code(),
            "Fix needed for: " + diagnostic.message(),
            MANUAL_FIX,
            MANUAL_FIX,
            MANUAL_EXPLANATION);
    }
}
