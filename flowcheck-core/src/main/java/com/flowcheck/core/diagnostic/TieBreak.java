package com.flowcheck.core.diagnostic;

/**
 * Ordering applied to diagnostics that share a line and severity.
 */
public enum TieBreak {
    /** Lexical order of the diagnostic code. */
    CODE,
    /** Order in which the passes emitted the diagnostics. */
    EMISSION
}
