package com.flowcheck;

import com.flowcheck.cli.AbstractFlowCheckCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@code flowcheck} command line.
 */
class FlowCheckCLITest {

    private static final String CLEAN_WORKFLOW = """
        from kailash.workflow.builder import WorkflowBuilder
        from kailash.runtime.local import LocalRuntime

        workflow = WorkflowBuilder()
        workflow.add_node("PythonCodeNode", "load", {"code": "result = [1, 2, 3]"})
        workflow.add_node("PythonCodeNode", "total", {"code": "result = sum(data)"})
        workflow.add_connection("load", "result", "total", "data")

        runtime = LocalRuntime()
        results, run_id = runtime.execute(workflow.build())
        """;

    private static final String BROKEN_WORKFLOW = """
        from kailash.workflow.builder import WorkflowBuilder

        workflow = WorkflowBuilder()
        workflow.add_node("LLMAgentNode", "agent", {})
        workflow.add_node("PythonCodeNode", "a", {"code": "x"})
        workflow.add_node("PythonCodeNode", "b", {"code": "x"})
        workflow.add_connection("a", "result", "b", "data")
        workflow.add_connection("b", "result", "a", "data")
        """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine commandLine = FlowCheckCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void validate_cleanWorkflow_exitsZero() throws IOException {
        Path workflow = write("workflow.py", CLEAN_WORKFLOW);

        int exitCode = run("validate", workflow.toString());

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_OK);
        assertThat(out.toString()).contains("No problems found");
    }

    @Test
    void validate_brokenWorkflow_printsFindingsAndExitsOne() throws IOException {
        Path workflow = write("workflow.py", BROKEN_WORKFLOW);

        int exitCode = run("validate", workflow.toString());

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_FINDINGS);
        assertThat(out.toString())
            .contains("PAR004")
            .contains("CON005")
            .contains("Suggestions:")
            .contains("3 error(s), 0 warning(s)");
    }

    @Test
    void validate_jsonFormat_printsWireResponse() throws IOException {
        Path workflow = write("workflow.py", BROKEN_WORKFLOW);

        int exitCode = run("validate", workflow.toString(), "--format", "json");

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_FINDINGS);
        assertThat(out.toString())
            .contains("\"has_errors\" : true")
            .contains("\"code\" : \"PAR004\"")
            .contains("\"error_code\" : \"CON005\"");
    }

    @Test
    void validate_missingFile_exitsTwo() {
        int exitCode = run("validate", tempDir.resolve("missing.py").toString());

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_IO_FAILURE);
        assertThat(err.toString()).contains("Failed to read input");
    }

    @Test
    void validate_configFileExtendsRegistry() throws IOException {
        Path workflow = write("workflow.py", """
            workflow.add_node("BillingNode", "bill", {"currency": "EUR"})
            """);
        Path config = write("flowcheck.yaml", """
            registry:
              nodeTypes:
                BillingNode: [account_id]
            """);

        int exitCode = run("validate", workflow.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_FINDINGS);
        assertThat(out.toString()).contains("account_id");
    }

    @Test
    void checkParams_reportsParameterFindingsOnly() throws IOException {
        Path workflow = write("workflow.py", BROKEN_WORKFLOW);

        int exitCode = run("check-params", workflow.toString());

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_FINDINGS);
        assertThat(out.toString()).contains("PAR004").doesNotContain("CON005");
    }

    @Test
    void connections_legacyEntry_exitsOne() throws IOException {
        Path connections = write("connections.json", """
            [{"source": "fetch", "target": "process"}]
            """);

        int exitCode = run("connections", connections.toString());

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_FINDINGS);
        assertThat(out.toString()).contains("CON002");
    }

    @Test
    void connections_invalidJson_exitsTwo() throws IOException {
        Path connections = write("connections.json", "{not json");

        assertThat(run("connections", connections.toString())).isEqualTo(AbstractFlowCheckCommand.EXIT_IO_FAILURE);
    }

    @Test
    void suggest_printsOneSuggestionPerCode() throws IOException {
        Path diagnostics = write("errors.json", """
            [
              {"code": "PAR004", "message": "missing", "severity": "error", "node_id": "agent", "parameter": "model"},
              {"code": "PAR004", "message": "missing", "severity": "error", "node_id": "agent", "parameter": "prompt"}
            ]
            """);

        int exitCode = run("suggest", diagnostics.toString());

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_OK);
        assertThat(out.toString()).containsOnlyOnce("[PAR004]")
            .contains("Fix: Add required parameter 'model' to node 'agent'");
    }

    @Test
    void checkPattern_circularDeps_exitsOne() throws IOException {
        Path workflow = write("workflow.py", BROKEN_WORKFLOW);

        int exitCode = run("check-pattern", workflow.toString(), "--type", "circular_deps");

        assertThat(exitCode).isEqualTo(AbstractFlowCheckCommand.EXIT_FINDINGS);
        assertThat(out.toString()).contains("CON005").doesNotContain("PAR004");
    }

    @Test
    void checkPattern_unknownType_exitsZero() throws IOException {
        Path workflow = write("workflow.py", BROKEN_WORKFLOW);

        assertThat(run("check-pattern", workflow.toString(), "--type", "nonsense"))
            .isEqualTo(AbstractFlowCheckCommand.EXIT_OK);
    }

    @Test
    void patterns_listsBundledPatterns() {
        assertThat(run("patterns")).isEqualTo(AbstractFlowCheckCommand.EXIT_OK);
        assertThat(out.toString()).contains("basic_workflow").contains("cycle_builder");
    }

    @Test
    void complexity_syntaxError_exitsOne() throws IOException {
        Path workflow = write("workflow.py", "def broken(:\n");

        assertThat(run("complexity", workflow.toString())).isEqualTo(AbstractFlowCheckCommand.EXIT_FINDINGS);
        assertThat(out.toString()).contains("Syntax error in workflow code");
    }

    @Test
    void complexity_jsonFormat_printsMetrics() throws IOException {
        Path workflow = write("workflow.py", CLEAN_WORKFLOW);

        assertThat(run("complexity", workflow.toString(), "--format", "JSON")).isEqualTo(AbstractFlowCheckCommand.EXIT_OK);
        assertThat(out.toString()).contains("\"has_analysis\" : true");
    }

    @Test
    void unknownSubcommand_isUsageError() {
        assertThat(run("frobnicate")).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
