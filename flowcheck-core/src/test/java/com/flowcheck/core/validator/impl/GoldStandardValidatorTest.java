package com.flowcheck.core.validator.impl;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.validator.RuleValidator;
import com.flowcheck.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GoldStandardValidator}.
 */
class GoldStandardValidatorTest extends ValidatorTestBase {

    @Override
    protected RuleValidator validator() {
        return new GoldStandardValidator();
    }

    @Test
    void validate_runtimeExecutesBuiltWorkflow_reportsNothing() {
        List<String> codes = codes("""
            runtime = LocalRuntime()
            results, run_id = runtime.execute(workflow.build())
            """);

        assertThat(codes).isEmpty();
    }

    @Test
    void validate_workflowExecutesRuntime_reportsGold002() {
        Diagnostic diagnostic = single(validate("""
            runtime = LocalRuntime()
            workflow.execute(runtime)
            """), "GOLD002");

        assertThat(diagnostic.line()).isEqualTo(2);
        assertThat(diagnostic.message())
            .isEqualTo("Use 'runtime.execute(workflow.build())' not 'workflow.execute(runtime)'");
        assertThat(diagnostic.context()).containsEntry("gold_standard", "execution-pattern");
    }

    @Test
    void validate_runtimeConstructedInline_reportsGold002() {
        List<Diagnostic> diagnostics = validate("""
            my_flow.execute(LocalRuntime())
            """);

        assertThat(single(diagnostics, "GOLD002").message()).endsWith("not 'my_flow.execute(runtime)'");
    }

    @Test
    void validate_executeWithOrdinaryArgument_reportsNothing() {
        List<String> codes = codes("""
            cursor.execute(query)
            """);

        assertThat(codes).isEmpty();
    }

    @Test
    void validate_bareFunctionCalls_reportsNothing() {
        List<String> codes = codes("""
            workflow = WorkflowBuilder()
            runtime = LocalRuntime()
            print('hi')
            """);

        assertThat(codes).isEmpty();
    }

    @Test
    void validate_camelCaseBuilderMethods_reportsGold003PerCall() {
        List<Diagnostic> diagnostics = validate("""
            workflow.addNode("PythonCodeNode", "a", {"code": "x"})
            workflow.addConnection("a", "result", "b", "data")
            """);

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly("GOLD003", "GOLD003");
        assertThat(diagnostics.get(0).message()).isEqualTo("Use 'add_node()' not 'addNode()' (snake_case convention)");
        assertThat(diagnostics.get(1).message()).startsWith("Use 'add_connection()'");
    }
}
