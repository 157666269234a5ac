package com.flowcheck.core.diagnostic;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.Severity;
import com.flowcheck.core.model.Suggestion;
import com.flowcheck.core.model.ValidationResponse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Merges the output of independent passes into one deterministic list.
 *
 * <p>Exact duplicates are dropped. The result is sorted by line (diagnostics without a
 * line last), then severity (error, warning, info), then the configured {@link TieBreak}.
 * The sort is stable, so with {@link TieBreak#EMISSION} equal keys keep pass order.</p>
 */
public class DiagnosticAggregator {

    private final Comparator<Diagnostic> order;

    public DiagnosticAggregator() {
        this(TieBreak.CODE);
    }

    public DiagnosticAggregator(TieBreak tieBreak) {
        Objects.requireNonNull(tieBreak, "tieBreak must not be null");
        Comparator<Diagnostic> base = Comparator
            .comparing(Diagnostic::line, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(Diagnostic::severity);
        this.order = tieBreak == TieBreak.CODE
            ? base.thenComparing(Diagnostic::code)
            : base;
    }

    /**
     * Merges pass outputs.
     *
     * @param passes diagnostics per pass, in pass order
     * @return deduplicated, ordered diagnostics
     */
    public List<Diagnostic> merge(Collection<? extends List<Diagnostic>> passes) {
        LinkedHashSet<Diagnostic> unique = new LinkedHashSet<>();
        for (List<Diagnostic> pass : passes) {
            unique.addAll(pass);
        }
        List<Diagnostic> merged = new ArrayList<>(unique);
        merged.sort(order);
        return merged;
    }

    /**
     * Splits ordered diagnostics into the response shape. Errors go to {@code errors};
     * warnings and infos go to {@code warnings}.
     *
     * @param diagnostics ordered diagnostics
     * @param suggestions fix suggestions
     * @return response
     */
    public ValidationResponse respond(List<Diagnostic> diagnostics, List<Suggestion> suggestions) {
        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.severity() == Severity.ERROR) {
                errors.add(diagnostic);
            } else {
                warnings.add(diagnostic);
            }
        }
        return new ValidationResponse(!errors.isEmpty(), errors, warnings, suggestions);
    }
}
