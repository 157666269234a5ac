package com.flowcheck.core.ir;

import com.flowcheck.core.parser.PythonParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IrExtractor}.
 */
class IrExtractorTest {

    private final IrExtractor extractor = new IrExtractor();

    private WorkflowIr extract(String source) {
        return extractor.extract(PythonParser.parse(source));
    }

    @Test
    void extract_nodesWithLiteralConfig_resolvesConfiguration() {
        WorkflowIr ir = extract("""
            workflow = WorkflowBuilder()
            workflow.add_node("LLMAgentNode", "agent", {"model": "gpt-4", "max_tokens": 256})
            workflow.add_node(HTTPRequestNode, "fetch", url="https://example.com")
            """);

        assertThat(ir.nodes()).extracting(NodeDeclaration::id).containsExactly("agent", "fetch");
        NodeDeclaration agent = ir.node("agent").orElseThrow();
        assertThat(agent.className()).isEqualTo("LLMAgentNode");
        assertThat(agent.config()).containsEntry("model", "gpt-4").containsEntry("max_tokens", 256L);
        assertThat(agent.configResolved()).isTrue();
        assertThat(agent.line()).isEqualTo(2);

        NodeDeclaration fetch = ir.node("fetch").orElseThrow();
        assertThat(fetch.className()).isEqualTo("HTTPRequestNode");
        assertThat(fetch.config()).containsEntry("url", "https://example.com");
    }

    @Test
    void extract_dynamicConfig_marksConfigurationUnresolved() {
        WorkflowIr ir = extract("""
            workflow.add_node("LLMAgentNode", "a", settings)
            workflow.add_node("LLMAgentNode", "b", {"model": model_name})
            workflow.add_node("LLMAgentNode", "c", {**base})
            """);

        assertThat(ir.node("a").orElseThrow().configResolved()).isFalse();
        NodeDeclaration b = ir.node("b").orElseThrow();
        assertThat(b.configResolved()).isTrue();
        assertThat(b.config()).containsEntry("model", Unresolved.EXPRESSION);
        assertThat(ir.node("c").orElseThrow().configResolved()).isFalse();
    }

    @Test
    void extract_nodeIdNotLiteral_skipsNode() {
        WorkflowIr ir = extract("""
            for name in names:
                workflow.add_node("PythonCodeNode", name, {"code": "x"})
            """);

        assertThat(ir.nodes()).isEmpty();
    }

    @Test
    void extract_repeatedNodeId_keepsFirstAndRecordsDuplicate() {
        WorkflowIr ir = extract("""
            workflow.add_node("PythonCodeNode", "step", {"code": "x"})
            workflow.add_node("HTTPRequestNode", "step", {"url": "u"})
            """);

        assertThat(ir.nodes()).singleElement().extracting(NodeDeclaration::className).isEqualTo("PythonCodeNode");
        assertThat(ir.duplicateNodes()).singleElement().extracting(NodeDeclaration::line).isEqualTo(2);
    }

    @Test
    void extract_connections_classifiesShapes() {
        WorkflowIr ir = extract("""
            workflow.add_connection("a", "result", "b", "data")
            workflow.add_connection("a", "b")
            workflow.add_connection("a", "result", "b")
            workflow.add_connection("b", "result", "a", "data", cycle=True)
            workflow.add_connection(source_node="a", source_output="x", target_node="b", target_input="y")
            """);

        assertThat(ir.connections()).extracting(ConnectionDeclaration::shape).containsExactly(
            ConnectionShape.FOUR_ARGUMENT,
            ConnectionShape.TWO_ARGUMENT,
            ConnectionShape.INVALID_ARITY,
            ConnectionShape.FOUR_ARGUMENT,
            ConnectionShape.FOUR_ARGUMENT);

        ConnectionDeclaration legacy = ir.connections().get(1);
        assertThat(legacy.sourceNode()).isEqualTo("a");
        assertThat(legacy.targetNode()).isEqualTo("b");
        assertThat(legacy.sourceOutput()).isNull();

        assertThat(ir.connections().get(2).argumentCount()).isEqualTo(3);
        assertThat(ir.connections().get(3).cycleEdge()).isTrue();
        assertThat(ir.connections().get(3).isOrdinary()).isFalse();

        ConnectionDeclaration keywords = ir.connections().get(4);
        assertThat(keywords.sourceOutput()).isEqualTo("x");
        assertThat(keywords.targetInput()).isEqualTo("y");
    }

    @Test
    void extract_chainedCycle_collectsEdgesAndSettings() {
        WorkflowIr ir = extract("""
            workflow.create_cycle("refine") \\
                .connect("draft", "review", mapping={"text": "text"}) \\
                .max_iterations(10) \\
                .converge_when("score > 0.8") \\
                .timeout(60) \\
                .build()
            """);

        CycleDefinition cycle = ir.cycles().get(0);
        assertThat(ir.cycles()).hasSize(1);
        assertThat(cycle.name()).isEqualTo("refine");
        assertThat(cycle.built()).isTrue();
        assertThat(cycle.edges()).singleElement().satisfies(edge -> {
            assertThat(edge.source()).isEqualTo("draft");
            assertThat(edge.target()).isEqualTo("review");
            assertThat(edge.mapping()).isEqualTo(Map.of("text", "text"));
        });
        assertThat(cycle.maxIterations().value()).isEqualTo(10L);
        assertThat(cycle.convergeWhen().value()).isEqualTo("score > 0.8");
        assertThat(cycle.timeout().value()).isEqualTo(60L);
    }

    @Test
    void extract_cycleBoundToVariable_collectsLaterCalls() {
        WorkflowIr ir = extract("""
            loop = workflow.create_cycle("loop")
            loop.connect("a", "b")
            loop.converge_when("done")
            """);

        CycleDefinition cycle = ir.cycles().get(0);
        assertThat(cycle.edges()).hasSize(1);
        assertThat(cycle.edges().get(0).mappingGiven()).isFalse();
        assertThat(cycle.convergeWhen().value()).isEqualTo("done");
        assertThat(cycle.maxIterations()).isNull();
        assertThat(cycle.built()).isFalse();
    }

    @Test
    void extract_nodeClass_collectsParametersAndUsages() {
        WorkflowIr ir = extract("""
            class ScoreNode(Node):
                def get_parameters(self):
                    return {
                        "text": NodeParameter(name="text", type=str, required=True),
                        "weight": NodeParameter(type=float, default=1.0),
                    }

                def run(self, **kwargs):
                    return kwargs["text"], kwargs.get("weight"), kwargs.get("bias")
            """);

        CustomNodeClass nodeClass = ir.customClass("ScoreNode").orElseThrow();
        assertThat(nodeClass.baseClasses()).containsExactly("Node");
        assertThat(nodeClass.declaresParameters()).isTrue();
        assertThat(nodeClass.parameters()).extracting(ParameterDeclaration::name).containsExactly("text", "weight");
        assertThat(nodeClass.parameters().get(0).required()).isTrue();
        assertThat(nodeClass.parameters().get(1).defaultValue()).isEqualTo(1.0);
        assertThat(nodeClass.usages()).extracting(ParameterUsage::name).containsExactly("text", "weight", "bias");
    }

    @Test
    void extract_classReferencedByAddNode_isTreatedAsNodeClass() {
        WorkflowIr ir = extract("""
            class Enricher:
                def run(self, **kwargs):
                    return {}

            class Helper:
                pass

            workflow.add_node(Enricher, "enrich")
            """);

        assertThat(ir.customClasses()).extracting(CustomNodeClass::name).containsExactly("Enricher");
    }

    @Test
    void extract_imports_recordBindingsAndPlacement() {
        WorkflowIr ir = extract("""
            import os.path
            import numpy as np
            from kailash.workflow.builder import WorkflowBuilder as Builder
            from . import helpers

            def late():
                import json
            """);

        assertThat(ir.imports()).extracting(ImportDeclaration::boundName)
            .containsExactly("os", "np", "Builder", "helpers", "json");
        assertThat(ir.imports()).extracting(ImportDeclaration::topLevel)
            .containsExactly(true, true, true, true, false);
        ImportDeclaration relative = ir.imports().get(3);
        assertThat(relative.isRelative()).isTrue();
        assertThat(relative.statement()).isEqualTo("from . import helpers");
        assertThat(ir.imports().get(2).statement())
            .isEqualTo("from kailash.workflow.builder import WorkflowBuilder as Builder");
    }

    @Test
    void extract_names_separatesReadsFromBindings() {
        WorkflowIr ir = extract("""
            runtime = LocalRuntime()
            for item in items:
                counter += 1
            """);

        assertThat(ir.usedNames()).containsKeys("LocalRuntime", "items", "counter");
        assertThat(ir.usedNames()).doesNotContainKeys("runtime", "item");
        assertThat(ir.localNames()).contains("runtime", "item", "counter");
        assertThat(ir.usedNames().get("items")).isEqualTo(2);
    }

    @Test
    void extract_plainScript_hasNoWorkflow() {
        WorkflowIr ir = extract("print('hello')\n");

        assertThat(ir.hasNoWorkflow()).isTrue();
        assertThat(WorkflowIr.empty().hasNoWorkflow()).isTrue();
        assertThat(ir.connections()).isEqualTo(List.of());
    }
}
