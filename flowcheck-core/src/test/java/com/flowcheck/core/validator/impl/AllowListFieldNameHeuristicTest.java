package com.flowcheck.core.validator.impl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AllowListFieldNameHeuristicTest {

    private final AllowListFieldNameHeuristic heuristic = new AllowListFieldNameHeuristic();

    @Test
    void isSuspicious_placeholderMarkers_returnsTrue() {
        assertThat(heuristic.isSuspicious("nonexistent_field")).isTrue();
        assertThat(heuristic.isSuspicious("InvalidOutput")).isTrue();
        assertThat(heuristic.isSuspicious("fake")).isTrue();
    }

    @Test
    void isSuspicious_ordinaryNames_returnsFalse() {
        assertThat(heuristic.isSuspicious("result")).isFalse();
        assertThat(heuristic.isSuspicious("summary_text")).isFalse();
        assertThat(heuristic.isSuspicious(null)).isFalse();
        assertThat(heuristic.isSuspicious("")).isFalse();
    }

    @Test
    void isSuspicious_dottedPathWithAllowedHead_returnsFalse() {
        assertThat(heuristic.isSuspicious("result.invalid_rows")).isFalse();
        assertThat(heuristic.isSuspicious("payload.fake_id")).isFalse();
    }

    @Test
    void isSuspicious_extraAllowedName_returnsFalse() {
        AllowListFieldNameHeuristic extended = new AllowListFieldNameHeuristic(List.of("invalid_rows"));

        assertThat(extended.isSuspicious("invalid_rows")).isFalse();
        assertThat(extended.isSuspicious("invalid_columns")).isTrue();
    }
}
