package com.flowcheck.core;

import com.flowcheck.core.model.DiagnosticCategory;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Families of error patterns accepted by {@link WorkflowValidator#checkErrorPattern}.
 */
public enum ErrorPatternType {
    CONNECTION_SYNTAX(DiagnosticCategory.CONNECTION, Set.of("CON001", "CON002", "CON006", "CON007")),
    PARAMETER_DECLARATION(DiagnosticCategory.PARAMETER, Set.of()),
    CIRCULAR_DEPS(DiagnosticCategory.CONNECTION, Set.of("CON005")),
    CYCLE_CONFIGURATION(DiagnosticCategory.CYCLE, Set.of()),
    IMPORTS(DiagnosticCategory.IMPORT, Set.of()),
    EXECUTION_PATTERN(DiagnosticCategory.GOLD_STANDARD, Set.of());

    private final DiagnosticCategory category;
    private final Set<String> codes;

    /**
     * @param category pass that reports the family
     * @param codes codes of the family, empty for the whole category
     */
    ErrorPatternType(DiagnosticCategory category, Set<String> codes) {
        this.category = category;
        this.codes = codes;
    }

    public DiagnosticCategory category() {
        return category;
    }

    public Set<DiagnosticCategory> categories() {
        return EnumSet.of(category);
    }

    public boolean includes(String code) {
        if (!codes.isEmpty()) {
            return codes.contains(code);
        }
        return DiagnosticCategory.ofCode(code) == category;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a wire name such as {@code "connection_syntax"}.
     *
     * @param wireName pattern type name
     * @return the type, or empty for unknown names
     */
    public static Optional<ErrorPatternType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalized = wireName.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.name().equals(normalized))
            .findFirst();
    }
}
