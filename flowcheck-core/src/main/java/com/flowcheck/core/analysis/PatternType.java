package com.flowcheck.core.analysis;

import java.util.Locale;

/**
 * Dominant shape of a workflow graph.
 */
public enum PatternType {
    EMPTY,
    SINGLE_NODE,
    CYCLIC,
    LINEAR,
    PARALLEL,
    COMPLEX;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
