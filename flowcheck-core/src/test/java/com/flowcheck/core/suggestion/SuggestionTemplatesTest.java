package com.flowcheck.core.suggestion;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.model.Suggestion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SuggestionTemplatesTest {

    @Test
    void all_coversEveryCode() {
        assertThat(SuggestionTemplates.all()).containsOnlyKeys(DiagnosticCode.values());
    }

    @ParameterizedTest
    @EnumSource(DiagnosticCode.class)
    void forCode_renderedWithoutContext_leavesNoPlaceholders(DiagnosticCode code) {
        Suggestion suggestion = SuggestionTemplates.forCode(code).render(Diagnostic.of(code, "message", null));

        assertThat(suggestion.errorCode()).isEqualTo(code.name());
        assertThat(suggestion.description()).isNotBlank().doesNotContain("${");
        assertThat(suggestion.fix()).isNotBlank().doesNotContain("${");
        assertThat(suggestion.codeExample()).isNotBlank().doesNotContain("${");
        assertThat(suggestion.explanation()).isNotBlank().doesNotContain("${");
    }

    @Test
    void render_contextValuesTakePrecedenceOverDefaults() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.PAR001, "missing", 3, Map.of("node_type", "SummaryNode"));

        Suggestion suggestion = SuggestionTemplates.forCode(DiagnosticCode.PAR001).render(diagnostic);

        assertThat(suggestion.description()).isEqualTo("Add get_parameters() method to SummaryNode");
    }

    @Test
    void render_replacementWithRegexCharacters_isInsertedLiterally() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.PAR004, "missing", 3,
            Map.of("parameter", "$price\\usd", "node_id", "n"));

        Suggestion suggestion = SuggestionTemplates.forCode(DiagnosticCode.PAR004).render(diagnostic);

        assertThat(suggestion.fix()).isEqualTo("Add required parameter '$price\\usd' to node 'n'");
    }
}
