package com.flowcheck.core.validator.impl;

import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.Severity;
import com.flowcheck.core.validator.RuleValidator;
import com.flowcheck.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ImportValidator}.
 */
class ImportValidatorTest extends ValidatorTestBase {

    @Override
    protected RuleValidator validator() {
        return new ImportValidator();
    }

    @Test
    void validate_canonicalImportsInOrder_reportsNothing() {
        List<String> codes = codes("""
            import os

            import requests

            from kailash.workflow.builder import WorkflowBuilder
            from kailash.runtime.local import LocalRuntime

            workflow = WorkflowBuilder()
            runtime = LocalRuntime()
            token = os.getenv("TOKEN")
            session = requests.Session()
            """);

        assertThat(codes).isEmpty();
    }

    @Test
    void validate_sdkClassNeverImported_reportsImp001() {
        List<Diagnostic> diagnostics = validate("""
            workflow = WorkflowBuilder()
            workflow.add_node("PythonCodeNode", "step", {"code": "x"})
            """);

        Diagnostic diagnostic = single(diagnostics, "IMP001");
        assertThat(diagnostic.line()).isEqualTo(1);
        assertThat(diagnostic.context())
            .containsEntry("missing_name", "WorkflowBuilder")
            .containsEntry("import_statement", "from kailash.workflow.builder import WorkflowBuilder");
    }

    @Test
    void validate_starImportFromSdk_suppressesImp001() {
        List<String> codes = codes("""
            from kailash.workflow.builder import *

            workflow = WorkflowBuilder()
            """);

        assertThat(codes).isEmpty();
    }

    @Test
    void validate_locallyDefinedSdkName_suppressesImp001() {
        List<String> codes = codes("""
            class WorkflowBuilder:
                pass

            workflow = WorkflowBuilder()
            """);

        assertThat(codes).isEmpty();
    }

    @Test
    void validate_unusedImport_reportsImp002Warning() {
        Diagnostic diagnostic = single(validate("""
            import json

            print("done")
            """), "IMP002");

        assertThat(diagnostic.severity()).isEqualTo(Severity.WARNING);
        assertThat(diagnostic.context()).containsEntry("import_name", "json").containsEntry("statement", "import json");
    }

    @Test
    void validate_unusedHeavyImport_reportsImp008InsteadOfImp002() {
        List<Diagnostic> diagnostics = validate("""
            import pandas as pd

            print("done")
            """);

        Diagnostic diagnostic = single(diagnostics, "IMP008");
        assertThat(diagnostics).extracting(Diagnostic::code).doesNotContain("IMP002");
        assertThat(diagnostic.context()).containsEntry("statement", "import pandas as pd");
    }

    @Test
    void validate_nonCanonicalSdkPath_reportsImp003() {
        Diagnostic diagnostic = single(validate("""
            from kailash.workflow import WorkflowBuilder

            workflow = WorkflowBuilder()
            """), "IMP003");

        assertThat(diagnostic.context())
            .containsEntry("current_path", "kailash.workflow")
            .containsEntry("correct_path", "kailash.workflow.builder");
        assertThat(diagnostic.message())
            .contains("Expected 'from kailash.workflow.builder import WorkflowBuilder'");
    }

    @Test
    void validate_relativeSdkImport_reportsImp004() {
        Diagnostic diagnostic = single(validate("""
            from .nodes.base import Node

            class LocalNode(Node):
                pass
            """), "IMP004");

        assertThat(diagnostic.context()).containsEntry("statement", "from .nodes.base import Node");
    }

    @Test
    void validate_relativeImportOfOwnModule_isAccepted() {
        List<String> codes = codes("""
            from .helpers import normalize

            value = normalize("x")
            """);

        assertThat(codes).isEmpty();
    }

    @Test
    void validate_standardLibraryAfterSdk_reportsImp006() {
        Diagnostic diagnostic = single(validate("""
            from kailash.workflow.builder import WorkflowBuilder
            import os

            workflow = WorkflowBuilder()
            path = os.getcwd()
            """), "IMP006");

        assertThat(diagnostic.line()).isEqualTo(2);
        assertThat(diagnostic.message())
            .isEqualTo("Import order violation: standard library imports should come before SDK imports");
    }

    @Test
    void validate_importsInsideFunctions_areNotOrdered() {
        List<String> codes = codes("""
            from kailash.workflow.builder import WorkflowBuilder

            def build():
                import json
                return WorkflowBuilder(), json.dumps({})
            """);

        assertThat(codes).isEmpty();
    }
}
