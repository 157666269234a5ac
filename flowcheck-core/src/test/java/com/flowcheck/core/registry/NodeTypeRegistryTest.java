package com.flowcheck.core.registry;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeTypeRegistry} and the bundled catalogs.
 */
class NodeTypeRegistryTest {

    @Test
    void defaults_containsBuiltInNodeTypes() {
        NodeTypeRegistry registry = NodeTypeRegistry.defaults();

        assertThat(registry.requiredParameters("LLMAgentNode")).containsExactly("model", "prompt");
        assertThat(registry.requiredParameters("HTTPRequestNode")).containsExactly("url");
        assertThat(registry.isKnown("PythonCodeNode")).isTrue();
        assertThat(registry.isKnown("MadeUpNode")).isFalse();
        assertThat(registry.requiredParameters("MadeUpNode")).isEmpty();
        assertThat(registry.lookup(null)).isEmpty();
    }

    @Test
    void defaults_isSharedInstance() {
        assertThat(NodeTypeRegistry.defaults()).isSameAs(NodeTypeRegistry.defaults());
    }

    @Test
    void withAdditional_addsAndOverridesEntries() {
        NodeTypeRegistry base = NodeTypeRegistry.defaults();

        NodeTypeRegistry extended = base.withAdditional(Map.of(
            "BillingNode", List.of("account_id"),
            "HTTPRequestNode", List.of("url", "method")));

        assertThat(extended.requiredParameters("BillingNode")).containsExactly("account_id");
        assertThat(extended.requiredParameters("HTTPRequestNode")).containsExactly("url", "method");
        assertThat(extended.requiredParameters("LLMAgentNode")).containsExactly("model", "prompt");
        assertThat(base.isKnown("BillingNode")).isFalse();
    }

    @Test
    void withAdditional_emptyMap_returnsSameRegistry() {
        NodeTypeRegistry base = NodeTypeRegistry.of(Map.of("ANode", List.of()));

        assertThat(base.withAdditional(Map.of())).isSameAs(base);
        assertThat(base.withAdditional(null)).isSameAs(base);
    }

    @Test
    void of_nullRequiredParameters_becomeEmpty() {
        Map<String, List<String>> nodeTypes = new HashMap<>();
        nodeTypes.put("LooseNode", null);

        assertThat(NodeTypeRegistry.of(nodeTypes).lookup("LooseNode"))
            .hasValueSatisfying(signature -> assertThat(signature.requiredParameters()).isEmpty());
    }

    @Test
    void sdkCatalog_resolvesCanonicalModules() {
        SdkSymbolCatalog catalog = SdkSymbolCatalog.defaults();

        assertThat(catalog.sdkRoot()).isEqualTo("kailash");
        assertThat(catalog.canonicalModule("WorkflowBuilder")).contains("kailash.workflow.builder");
        assertThat(catalog.canonicalModule("LocalRuntime")).contains("kailash.runtime.local");
        assertThat(catalog.canonicalModule("NodeParameter")).contains("kailash.nodes.base");
        assertThat(catalog.canonicalModule("DataFrame")).isEmpty();
    }

    @Test
    void sdkCatalog_classifiesModules() {
        SdkSymbolCatalog catalog = SdkSymbolCatalog.defaults();

        assertThat(catalog.isSdkModule("kailash")).isTrue();
        assertThat(catalog.isSdkModule("kailash.nodes.base")).isTrue();
        assertThat(catalog.isSdkModule("kailashx")).isFalse();
        assertThat(catalog.isStandardLibrary("os.path")).isTrue();
        assertThat(catalog.isStandardLibrary("json")).isTrue();
        assertThat(catalog.isStandardLibrary("requests")).isFalse();
        assertThat(catalog.isHeavy("pandas")).isTrue();
        assertThat(catalog.isHeavy("numpy.linalg")).isTrue();
        assertThat(catalog.isHeavy("")).isFalse();
        assertThat(catalog.isHeavy("json")).isFalse();
    }

    @Test
    void validationPatterns_loadInFileOrder() {
        assertThat(ValidationPatternCatalog.patterns())
            .extracting(pattern -> pattern.name())
            .containsSubsequence("basic_workflow", "connected_nodes", "parameter_validation", "cycle_builder");
    }
}
