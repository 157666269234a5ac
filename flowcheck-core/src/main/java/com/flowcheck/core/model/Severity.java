package com.flowcheck.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Severity of a {@link Diagnostic}.
 *
 * <p>Declaration order is the reporting order: errors sort before warnings,
 * warnings before informational findings.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Will break execution at runtime.
     */
    ERROR,

    /**
     * Style or performance risk, non-blocking.
     */
    WARNING,

    /**
     * Informational only.
     */
    INFO;

    /**
     * Lowercase name used in the JSON wire format ({@code "error"}, {@code "warning"}, {@code "info"}).
     *
     * @return wire name
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a wire name, case-insensitively.
     *
     * @param value wire name such as {@code "warning"}
     * @return matching severity, {@link #ERROR} when the value is null or unknown
     */
    public static Severity fromWire(String value) {
        if (value == null) {
            return ERROR;
        }
        return Arrays.stream(values())
            .filter(severity -> severity.name().equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElse(ERROR);
    }
}
