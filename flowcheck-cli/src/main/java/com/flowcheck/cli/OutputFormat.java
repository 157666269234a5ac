package com.flowcheck.cli;

/**
 * Output formats accepted by {@code --format}.
 */
public enum OutputFormat {
    TEXT,
    JSON
}
