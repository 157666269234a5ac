package com.flowcheck.core.graph;

import com.flowcheck.core.ir.ConnectionDeclaration;
import com.flowcheck.core.ir.ConnectionShape;
import com.flowcheck.core.ir.IrExtractor;
import com.flowcheck.core.ir.WorkflowIr;
import com.flowcheck.core.parser.PythonParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link GraphBuilder} and {@link WorkflowGraph}.
 */
class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    private WorkflowGraph build(String source) {
        WorkflowIr ir = new IrExtractor().extract(PythonParser.parse(source));
        return builder.build(ir);
    }

    private static String nodes(String... ids) {
        StringBuilder source = new StringBuilder();
        for (String id : ids) {
            source.append("workflow.add_node(\"PythonCodeNode\", \"").append(id).append("\", {\"code\": \"x\"})\n");
        }
        return source.toString();
    }

    private static String edge(String from, String to) {
        return "workflow.add_connection(\"" + from + "\", \"result\", \"" + to + "\", \"data\")\n";
    }

    @Test
    void build_linearChain_hasNoCyclesAndFullDepth() {
        WorkflowGraph graph = build(nodes("a", "b", "c") + edge("a", "b") + edge("b", "c"));

        assertThat(graph.nodes()).containsOnlyKeys("a", "b", "c");
        assertThat(graph.edges()).hasSize(2);
        assertThat(graph.cycles()).isEmpty();
        assertThat(graph.danglingEndpoints()).isEmpty();
        assertThat(graph.successors("a")).containsExactly("b");
        assertThat(graph.depth()).isEqualTo(3);
    }

    @Test
    void build_unknownEndpoint_isDanglingAndNotAnEdge() {
        WorkflowGraph graph = build(nodes("a") + edge("a", "ghost") + edge("phantom", "a"));

        assertThat(graph.edges()).isEmpty();
        assertThat(graph.danglingEndpoints())
            .extracting(DanglingEndpoint::role, DanglingEndpoint::nodeId)
            .containsExactly(
                tuple(EndpointRole.TARGET, "ghost"),
                tuple(EndpointRole.SOURCE, "phantom"));
    }

    @Test
    void build_cycleEdge_isResolvedButNotAnEdge() {
        WorkflowGraph graph = build(nodes("a", "b") + edge("a", "b")
            + "workflow.add_connection(\"b\", \"result\", \"a\", \"data\", cycle=True)\n"
            + "workflow.add_connection(\"a\", \"result\", \"ghost\", \"data\", cycle=True)\n");

        assertThat(graph.edges()).hasSize(1);
        assertThat(graph.cycles()).isEmpty();
        assertThat(graph.danglingEndpoints())
            .extracting(DanglingEndpoint::role, DanglingEndpoint::nodeId)
            .containsExactly(tuple(EndpointRole.TARGET, "ghost"));
    }

    @Test
    void build_twoSeparateLoops_reportsOneCyclePerComponent() {
        WorkflowGraph graph = build(nodes("a", "b", "x", "y", "z")
            + edge("a", "b") + edge("b", "a")
            + edge("x", "y") + edge("y", "z") + edge("z", "x"));

        assertThat(graph.cycles()).extracting(GraphCycle::members)
            .containsExactly(List.of("a", "b"), List.of("x", "y", "z"));
        assertThat(graph.cycles().get(1).line()).isEqualTo(8);
    }

    @Test
    void build_diamond_isAcyclicWithFanOut() {
        WorkflowGraph graph = build(nodes("src", "left", "right", "sink")
            + edge("src", "left") + edge("src", "right")
            + edge("left", "sink") + edge("right", "sink"));

        assertThat(graph.cycles()).isEmpty();
        assertThat(graph.outDegrees()).containsEntry("src", 2);
        assertThat(graph.inDegrees()).containsEntry("sink", 2);
        assertThat(graph.depth()).isEqualTo(3);
    }

    @Test
    void depth_edgelessAndEmptyGraphs() {
        assertThat(build(nodes("solo")).depth()).isEqualTo(1);
        assertThat(WorkflowGraph.empty().depth()).isZero();
    }

    @Test
    void depth_everyNodeOnALoop_reportsNodeCount() {
        WorkflowGraph graph = build(nodes("a", "b", "c") + edge("a", "b") + edge("b", "c") + edge("c", "a"));

        assertThat(graph.depth()).isEqualTo(3);
    }

    @Test
    void findCycles_longChain_doesNotOverflowTheStack() {
        List<ConnectionDeclaration> edges = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            edges.add(new ConnectionDeclaration(
                "n" + i, "out", "n" + (i + 1), "in", ConnectionShape.FOUR_ARGUMENT, 4, false, i + 1));
        }
        edges.add(new ConnectionDeclaration("n20000", "out", "n0", "in", ConnectionShape.FOUR_ARGUMENT, 4, false, 20_001));

        List<GraphCycle> cycles = GraphBuilder.findCycles(edges);

        assertThat(cycles).singleElement().satisfies(cycle -> assertThat(cycle.members()).hasSize(20_001));
    }

    @Test
    void buildDetached_treatsEveryEndpointAsDeclared() {
        List<ConnectionDeclaration> connections = List.of(
            new ConnectionDeclaration("a", "out", "b", "in", ConnectionShape.FOUR_ARGUMENT, 4, false, 1),
            new ConnectionDeclaration("b", "out", "a", "in", ConnectionShape.FOUR_ARGUMENT, 4, false, 2));

        WorkflowGraph graph = builder.buildDetached(connections);

        assertThat(graph.nodes()).containsOnlyKeys("a", "b");
        assertThat(graph.danglingEndpoints()).isEmpty();
        assertThat(graph.cycles()).hasSize(1);
    }
}
