package com.flowcheck.core.validator;

import com.flowcheck.core.config.ValidatorConfig;
import com.flowcheck.core.graph.GraphBuilder;
import com.flowcheck.core.graph.WorkflowGraph;
import com.flowcheck.core.ir.IrExtractor;
import com.flowcheck.core.ir.WorkflowIr;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.parser.PythonParser;
import com.flowcheck.core.parser.ast.PythonAst.Module;
import com.flowcheck.core.registry.NodeTypeRegistry;
import com.flowcheck.core.registry.SdkSymbolCatalog;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for rule validator tests.
 *
 * <p>Parses a source snippet, extracts the IR, builds the graph and runs the validator
 * under test against a {@link ValidationContext} with the bundled catalogs. Subclasses
 * only supply the validator and the source fixtures.</p>
 */
public abstract class ValidatorTestBase {

    protected ValidatorConfig config = ValidatorConfig.defaults();
    protected NodeTypeRegistry registry = NodeTypeRegistry.defaults();

    /**
     * Creates the validator under test.
     *
     * @return fresh validator
     */
    protected abstract RuleValidator validator();

    /**
     * Builds a validation context for a source snippet.
     *
     * @param source Python source
     * @return context with the bundled catalogs
     */
    protected ValidationContext contextFor(String source) {
        Module module = PythonParser.parse(source);
        WorkflowIr ir = new IrExtractor().extract(module);
        WorkflowGraph graph = new GraphBuilder().build(ir);
        return new ValidationContext(module, ir, graph, config, registry, SdkSymbolCatalog.defaults());
    }

    protected List<Diagnostic> validate(String source) {
        return validator().validate(contextFor(source));
    }

    protected List<String> codes(String source) {
        return validate(source).stream().map(Diagnostic::code).toList();
    }

    protected void useNodeTypes(Map<String, List<String>> nodeTypes) {
        registry = NodeTypeRegistry.of(nodeTypes);
    }

    /**
     * Asserts that exactly one diagnostic with the given code exists and returns it.
     */
    protected Diagnostic single(List<Diagnostic> diagnostics, String code) {
        List<Diagnostic> matching = diagnostics.stream().filter(d -> d.code().equals(code)).toList();
        assertThat(matching).as("diagnostics with code %s", code).hasSize(1);
        return matching.get(0);
    }
}
