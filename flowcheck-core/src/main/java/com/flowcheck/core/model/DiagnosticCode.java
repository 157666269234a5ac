package com.flowcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed catalog of every finding the validator can report.
 *
 * <p>Each constant carries its category and the severity it is reported with.
 * Adding a constant forces a matching suggestion template, see
 * {@code com.flowcheck.core.suggestion.SuggestionTemplates}.</p>
 *
 * @since 1.0.0
 */
public enum DiagnosticCode {
    SYN001(DiagnosticCategory.SYNTAX, Severity.ERROR, "Syntax error"),

    PAR001(DiagnosticCategory.PARAMETER, Severity.ERROR, "Missing get_parameters method"),
    PAR002(DiagnosticCategory.PARAMETER, Severity.ERROR, "Undeclared parameter used"),
    PAR003(DiagnosticCategory.PARAMETER, Severity.ERROR, "Parameter declared without type"),
    PAR004(DiagnosticCategory.PARAMETER, Severity.ERROR, "Missing required parameter"),

    CON001(DiagnosticCategory.CONNECTION, Severity.ERROR, "Wrong connection argument count"),
    CON002(DiagnosticCategory.CONNECTION, Severity.ERROR, "Deprecated two-argument connection"),
    CON003(DiagnosticCategory.CONNECTION, Severity.ERROR, "Unknown source node"),
    CON004(DiagnosticCategory.CONNECTION, Severity.ERROR, "Unknown target node"),
    CON005(DiagnosticCategory.CONNECTION, Severity.ERROR, "Circular dependency"),
    CON006(DiagnosticCategory.CONNECTION, Severity.WARNING, "Suspicious output field"),
    CON007(DiagnosticCategory.CONNECTION, Severity.WARNING, "Suspicious input field"),
    CON008(DiagnosticCategory.CONNECTION, Severity.ERROR, "Duplicate node id"),

    CYC001(DiagnosticCategory.CYCLE, Severity.ERROR, "Legacy cycle flag"),
    CYC002(DiagnosticCategory.CYCLE, Severity.ERROR, "Cycle without termination"),
    CYC003(DiagnosticCategory.CYCLE, Severity.ERROR, "Invalid convergence expression"),
    CYC004(DiagnosticCategory.CYCLE, Severity.ERROR, "Cycle without edges"),
    CYC005(DiagnosticCategory.CYCLE, Severity.ERROR, "Invalid cycle mapping"),
    CYC006(DiagnosticCategory.CYCLE, Severity.WARNING, "Excessive max_iterations"),
    CYC007(DiagnosticCategory.CYCLE, Severity.ERROR, "Invalid cycle timeout"),
    CYC008(DiagnosticCategory.CYCLE, Severity.ERROR, "Unknown cycle node"),

    IMP001(DiagnosticCategory.IMPORT, Severity.ERROR, "Missing import"),
    IMP002(DiagnosticCategory.IMPORT, Severity.WARNING, "Unused import"),
    IMP003(DiagnosticCategory.IMPORT, Severity.ERROR, "Non-canonical import path"),
    IMP004(DiagnosticCategory.IMPORT, Severity.WARNING, "Relative SDK import"),
    IMP006(DiagnosticCategory.IMPORT, Severity.WARNING, "Import order"),
    IMP008(DiagnosticCategory.IMPORT, Severity.WARNING, "Unused heavy import"),

    GOLD002(DiagnosticCategory.GOLD_STANDARD, Severity.ERROR, "Inverted execution call"),
    GOLD003(DiagnosticCategory.GOLD_STANDARD, Severity.ERROR, "Camel-case builder method"),

    VAL001(DiagnosticCategory.INTERNAL, Severity.ERROR, "Internal validator fault");

    private final DiagnosticCategory category;
    private final Severity defaultSeverity;
    private final String title;

    DiagnosticCode(DiagnosticCategory category, Severity defaultSeverity, String title) {
        this.category = category;
        this.defaultSeverity = defaultSeverity;
        this.title = title;
    }

    public DiagnosticCategory category() {
        return category;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public String title() {
        return title;
    }

    /**
     * Looks up a code by its string form.
     *
     * @param code code string such as {@code "PAR004"}
     * @return the constant, or empty for codes outside the catalog
     */
    public static Optional<DiagnosticCode> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(candidate -> candidate.name().equals(code))
            .findFirst();
    }
}
