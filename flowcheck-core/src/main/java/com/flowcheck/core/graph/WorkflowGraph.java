package com.flowcheck.core.graph;

import com.flowcheck.core.ir.ConnectionDeclaration;
import com.flowcheck.core.ir.NodeDeclaration;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed workflow graph assembled from the IR.
 *
 * <p>Nodes are keyed by id in declaration order. {@link #edges()} holds the ordinary
 * connections whose endpoints both resolved; four-argument connections naming undeclared
 * nodes, cycle edges included, are listed in {@link #danglingEndpoints()}.
 * {@link #cycles()} are the circular dependencies among the resolved edges.</p>
 *
 * <p>Instances are immutable and created by {@link GraphBuilder}.</p>
 */
public final class WorkflowGraph {

    private final Map<String, NodeDeclaration> nodes;
    private final List<ConnectionDeclaration> edges;
    private final List<DanglingEndpoint> danglingEndpoints;
    private final List<GraphCycle> cycles;
    private final Map<String, List<String>> successors;

    WorkflowGraph(
        Map<String, NodeDeclaration> nodes,
        List<ConnectionDeclaration> edges,
        List<DanglingEndpoint> danglingEndpoints,
        List<GraphCycle> cycles
    ) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.danglingEndpoints = List.copyOf(danglingEndpoints);
        this.cycles = List.copyOf(cycles);

        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (ConnectionDeclaration edge : this.edges) {
            adjacency.computeIfAbsent(edge.sourceNode(), key -> new ArrayList<>()).add(edge.targetNode());
        }
        adjacency.replaceAll((key, value) -> List.copyOf(value));
        this.successors = Collections.unmodifiableMap(adjacency);
    }

    public static WorkflowGraph empty() {
        return new WorkflowGraph(Map.of(), List.of(), List.of(), List.of());
    }

    public Map<String, NodeDeclaration> nodes() {
        return nodes;
    }

    public Optional<NodeDeclaration> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public List<ConnectionDeclaration> edges() {
        return edges;
    }

    public List<DanglingEndpoint> danglingEndpoints() {
        return danglingEndpoints;
    }

    public List<GraphCycle> cycles() {
        return cycles;
    }

    public List<String> successors(String nodeId) {
        return successors.getOrDefault(nodeId, List.of());
    }

    /**
     * Number of resolved edges leaving each node that has any.
     *
     * @return out-degree per source node, in first-edge order
     */
    public Map<String, Integer> outDegrees() {
        Map<String, Integer> degrees = new LinkedHashMap<>();
        for (ConnectionDeclaration edge : edges) {
            degrees.merge(edge.sourceNode(), 1, Integer::sum);
        }
        return degrees;
    }

    /**
     * Number of resolved edges entering each node that has any.
     *
     * @return in-degree per target node, in first-edge order
     */
    public Map<String, Integer> inDegrees() {
        Map<String, Integer> degrees = new LinkedHashMap<>();
        for (ConnectionDeclaration edge : edges) {
            degrees.merge(edge.targetNode(), 1, Integer::sum);
        }
        return degrees;
    }

    /**
     * Length in nodes of the longest simple path that starts at a node without
     * incoming edges. A graph with nodes but no edges has depth 1; a graph where
     * every node has an incoming edge reports its node count.
     *
     * @return workflow depth, 0 for an empty graph
     */
    public int depth() {
        if (nodes.isEmpty()) {
            return 0;
        }
        if (edges.isEmpty()) {
            return 1;
        }
        Map<String, Integer> incoming = inDegrees();
        List<String> starts = nodes.keySet().stream()
            .filter(id -> !incoming.containsKey(id))
            .toList();
        if (starts.isEmpty()) {
            return nodes.size();
        }

        int max = 0;
        for (String start : starts) {
            max = Math.max(max, longestPathFrom(start));
        }
        return max;
    }

    /**
     * Iterative depth-first search that keeps the current path on a stack and never
     * revisits a node already on it.
     */
    private int longestPathFrom(String start) {
        Deque<PathFrame> stack = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        stack.push(new PathFrame(start, 1));
        onPath.add(start);
        int max = 1;

        Map<String, Integer> cursor = new HashMap<>();
        while (!stack.isEmpty()) {
            PathFrame frame = stack.peek();
            List<String> next = successors(frame.nodeId());
            int index = cursor.getOrDefault(frame.nodeId(), 0);
            if (index < next.size()) {
                cursor.put(frame.nodeId(), index + 1);
                String neighbor = next.get(index);
                if (!onPath.contains(neighbor)) {
                    onPath.add(neighbor);
                    stack.push(new PathFrame(neighbor, frame.depth() + 1));
                    max = Math.max(max, frame.depth() + 1);
                }
            } else {
                stack.pop();
                onPath.remove(frame.nodeId());
                cursor.remove(frame.nodeId());
            }
        }
        return max;
    }

    private record PathFrame(String nodeId, int depth) {
    }
}
