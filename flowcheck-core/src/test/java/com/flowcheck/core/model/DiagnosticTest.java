package com.flowcheck.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Diagnostic} and the code catalog.
 */
class DiagnosticTest {

    @Test
    void of_usesCatalogSeverity() {
        assertThat(Diagnostic.of(DiagnosticCode.CON006, "suspicious", 2).severity()).isEqualTo(Severity.WARNING);
        assertThat(Diagnostic.of(DiagnosticCode.CON005, "loop", 2).severity()).isEqualTo(Severity.ERROR);
    }

    @Test
    void constructor_nullCode_throws() {
        assertThatThrownBy(() -> new Diagnostic(null, "m", Severity.ERROR, 1, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("code");
    }

    @Test
    void context_isUnmodifiableCopy() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put(Diagnostic.NODE_ID, "agent");
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.PAR004, "missing", 4, source);

        source.put(Diagnostic.PARAMETER, "model");

        assertThat(diagnostic.context()).containsOnlyKeys(Diagnostic.NODE_ID);
        assertThatThrownBy(() -> diagnostic.context().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toWire_flattensContextAfterFixedFields() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(Diagnostic.NODE_ID, "agent");
        context.put(Diagnostic.PARAMETER, "model");
        context.put("line", 99);
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.PAR004, "missing", 4, context);

        Map<String, Object> wire = diagnostic.toWire();

        assertThat(wire.keySet()).containsExactly("code", "message", "severity", "line", "node_id", "parameter");
        assertThat(wire).containsEntry("severity", "error").containsEntry("line", 4);
    }

    @Test
    void toWire_withoutLine_omitsLine() {
        assertThat(Diagnostic.of(DiagnosticCode.VAL001, "fault", null).toWire()).doesNotContainKey("line");
    }

    @Test
    void fromWire_readsWireMap() {
        Diagnostic diagnostic = Diagnostic.fromWire(Map.of(
            "code", "CON003",
            "message", "unknown source",
            "severity", "error",
            "line", 7,
            "source", "loader"));

        assertThat(diagnostic.code()).isEqualTo("CON003");
        assertThat(diagnostic.line()).isEqualTo(7);
        assertThat(diagnostic.contextValue("source")).isEqualTo("loader");
        assertThat(diagnostic.knownCode()).contains(DiagnosticCode.CON003);
        assertThat(diagnostic.category()).isEqualTo(DiagnosticCategory.CONNECTION);
    }

    @Test
    void fromWire_missingFields_fallBackToEmptyValues() {
        Diagnostic diagnostic = Diagnostic.fromWire(Map.of("line", "seven"));

        assertThat(diagnostic.code()).isEmpty();
        assertThat(diagnostic.message()).isEmpty();
        assertThat(diagnostic.severity()).isEqualTo(Severity.ERROR);
        assertThat(diagnostic.line()).isNull();
        assertThat(diagnostic.knownCode()).isEmpty();
        assertThat(diagnostic.category()).isEqualTo(DiagnosticCategory.UNKNOWN);
    }

    @ParameterizedTest
    @CsvSource({
        "warning, WARNING",
        "WARNING, WARNING",
        "' info ', INFO",
        "error, ERROR",
        "fatal, ERROR"
    })
    void severityFromWire_resolvesCaseInsensitively(String wire, Severity expected) {
        assertThat(Severity.fromWire(wire)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "SYN001, SYNTAX",
        "PAR004, PARAMETER",
        "con005, CONNECTION",
        "CYC008, CYCLE",
        "IMP006, IMPORT",
        "GOLD002, GOLD_STANDARD",
        "VAL001, INTERNAL",
        "XYZ999, UNKNOWN",
        "123, UNKNOWN"
    })
    void categoryOfCode_usesAlphabeticPrefix(String code, DiagnosticCategory expected) {
        assertThat(DiagnosticCategory.ofCode(code)).isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(DiagnosticCode.class)
    void catalogCode_prefixMatchesCategory(DiagnosticCode code) {
        assertThat(DiagnosticCategory.ofCode(code.name())).isEqualTo(code.category());
        assertThat(DiagnosticCode.lookup(code.name())).contains(code);
    }

    @Test
    void validationResponse_diagnosticsListsErrorsFirst() {
        Diagnostic warning = Diagnostic.of(DiagnosticCode.IMP002, "unused", 1);
        Diagnostic error = Diagnostic.of(DiagnosticCode.CON001, "arity", 5);

        ValidationResponse response = new ValidationResponse(true, List.of(error), List.of(warning), null);

        assertThat(response.diagnostics()).containsExactly(error, warning);
        assertThat(response.codes()).containsExactly("CON001", "IMP002");
        assertThat(response.toWire().keySet()).containsExactly("has_errors", "errors", "warnings", "suggestions");
    }
}
