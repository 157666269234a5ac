package com.flowcheck.core.model;

import java.util.Arrays;

/**
 * Rule family a diagnostic code belongs to, keyed by the code prefix.
 *
 * @since 1.0.0
 */
public enum DiagnosticCategory {
    SYNTAX("SYN"),
    PARAMETER("PAR"),
    CONNECTION("CON"),
    CYCLE("CYC"),
    IMPORT("IMP"),
    GOLD_STANDARD("GOLD"),
    INTERNAL("VAL"),
    UNKNOWN("");

    private final String prefix;

    DiagnosticCategory(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Resolves the category of an arbitrary code string by its alphabetic prefix.
     *
     * @param code diagnostic code such as {@code "CON005"}
     * @return category, or {@link #UNKNOWN} when no prefix matches
     */
    public static DiagnosticCategory ofCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        String letters = code.replaceAll("[^A-Za-z]", "");
        return Arrays.stream(values())
            .filter(category -> category != UNKNOWN)
            .filter(category -> category.prefix.equalsIgnoreCase(letters))
            .findFirst()
            .orElse(UNKNOWN);
    }
}
