package com.flowcheck.core.diagnostic;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.model.Suggestion;
import com.flowcheck.core.model.ValidationResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagnosticAggregator}.
 */
class DiagnosticAggregatorTest {

    private static final Diagnostic PAR004_LINE_3 = Diagnostic.of(DiagnosticCode.PAR004, "missing model", 3);
    private static final Diagnostic CON001_LINE_3 = Diagnostic.of(DiagnosticCode.CON001, "bad arity", 3);
    private static final Diagnostic CON006_LINE_3 = Diagnostic.of(DiagnosticCode.CON006, "suspicious", 3);
    private static final Diagnostic IMP002_LINE_1 = Diagnostic.of(DiagnosticCode.IMP002, "unused", 1);
    private static final Diagnostic VAL001_NO_LINE = Diagnostic.of(DiagnosticCode.VAL001, "fault", null);

    @Test
    void merge_sortsByLineThenSeverityThenCode() {
        List<Diagnostic> merged = new DiagnosticAggregator().merge(List.of(
            List.of(VAL001_NO_LINE, PAR004_LINE_3),
            List.of(CON006_LINE_3, CON001_LINE_3, IMP002_LINE_1)));

        assertThat(merged).containsExactly(IMP002_LINE_1, CON001_LINE_3, PAR004_LINE_3, CON006_LINE_3, VAL001_NO_LINE);
    }

    @Test
    void merge_emissionTieBreak_keepsPassOrderForEqualKeys() {
        List<Diagnostic> merged = new DiagnosticAggregator(TieBreak.EMISSION).merge(List.of(
            List.of(PAR004_LINE_3),
            List.of(CON001_LINE_3)));

        assertThat(merged).containsExactly(PAR004_LINE_3, CON001_LINE_3);
    }

    @Test
    void merge_exactDuplicates_areDropped() {
        Diagnostic copy = Diagnostic.of(DiagnosticCode.PAR004, "missing model", 3);

        List<Diagnostic> merged = new DiagnosticAggregator().merge(List.of(
            List.of(PAR004_LINE_3),
            List.of(copy)));

        assertThat(merged).hasSize(1);
    }

    @Test
    void merge_sameCodeDifferentContext_keepsBoth() {
        Diagnostic model = Diagnostic.of(DiagnosticCode.PAR004, "missing", 3, Map.of("parameter", "model"));
        Diagnostic prompt = Diagnostic.of(DiagnosticCode.PAR004, "missing", 3, Map.of("parameter", "prompt"));

        assertThat(new DiagnosticAggregator().merge(List.of(List.of(model, prompt)))).hasSize(2);
    }

    @Test
    void respond_splitsErrorsFromWarnings() {
        Suggestion suggestion = new Suggestion("CON001", "d", "f", "c", "e");

        ValidationResponse response = new DiagnosticAggregator().respond(
            List.of(IMP002_LINE_1, CON001_LINE_3, CON006_LINE_3), List.of(suggestion));

        assertThat(response.hasErrors()).isTrue();
        assertThat(response.errors()).containsExactly(CON001_LINE_3);
        assertThat(response.warnings()).containsExactly(IMP002_LINE_1, CON006_LINE_3);
        assertThat(response.suggestions()).containsExactly(suggestion);
    }

    @Test
    void respond_onlyWarnings_hasNoErrors() {
        ValidationResponse response = new DiagnosticAggregator().respond(List.of(IMP002_LINE_1), List.of());

        assertThat(response.hasErrors()).isFalse();
        assertThat(response.toWire()).containsEntry("has_errors", false);
    }
}
