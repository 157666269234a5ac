package com.flowcheck.core;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link WireFormat}.
 */
class WireFormatTest {

    @Test
    void toJson_keepsWireFieldOrder() throws IOException {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.CON003, "unknown source", 7, Map.of("source", "loader"));

        String json = WireFormat.toJson(diagnostic.toWire());

        assertThat(json.indexOf("\"code\"")).isLessThan(json.indexOf("\"message\""));
        assertThat(json.indexOf("\"line\"")).isLessThan(json.indexOf("\"source\""));
        assertThat(json).contains("\"severity\" : \"error\"");
    }

    @Test
    void readConnections_readsObjectsInOrder() throws IOException {
        List<Map<String, Object>> entries = WireFormat.readConnections("""
            [
              {"source": "a", "output": "result", "target": "b", "input": "data"},
              {"source": "b", "target": "c"}
            ]
            """);

        assertThat(entries).hasSize(2);
        assertThat(entries.get(1)).containsOnlyKeys("source", "target");
    }

    @Test
    void readConnections_notAnArray_throws() {
        assertThatThrownBy(() -> WireFormat.readConnections("{\"source\": \"a\"}"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void readDiagnostics_skipsNullEntries() throws IOException {
        List<Diagnostic> diagnostics = WireFormat.readDiagnostics("""
            [
              {"code": "PAR004", "message": "missing", "severity": "error", "line": 4, "parameter": "model"},
              null,
              {"code": "IMP002", "message": "unused", "severity": "warning"}
            ]
            """);

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly("PAR004", "IMP002");
        assertThat(diagnostics.get(0).contextValue("parameter")).isEqualTo("model");
        assertThat(diagnostics.get(1).severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void readDiagnostics_jsonNull_returnsEmptyList() throws IOException {
        assertThat(WireFormat.readDiagnostics("null")).isEmpty();
    }
}
