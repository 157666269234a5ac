package com.flowcheck.core.graph;

import com.flowcheck.core.ir.ConnectionDeclaration;
import com.flowcheck.core.ir.ConnectionShape;
import com.flowcheck.core.ir.NodeDeclaration;
import com.flowcheck.core.ir.WorkflowIr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles a {@link WorkflowGraph} from extracted declarations.
 *
 * <p>Every four-argument connection with literal endpoints is resolved against the
 * declared nodes, cycle edges included. Only ordinary connections (not cycle edges)
 * become graph edges. Circular dependencies are found with Tarjan's strongly connected
 * components algorithm, run iteratively so that long chains cannot exhaust the stack.
 * Each component with more than one node, or a single node with a self loop, is one
 * {@link GraphCycle}.</p>
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    /**
     * Builds the graph of a source unit. Endpoints are resolved against the declared nodes.
     *
     * @param ir extracted IR
     * @return workflow graph
     */
    public WorkflowGraph build(WorkflowIr ir) {
        Map<String, NodeDeclaration> nodes = new LinkedHashMap<>();
        for (NodeDeclaration node : ir.nodes()) {
            nodes.putIfAbsent(node.id(), node);
        }

        List<ConnectionDeclaration> edges = new ArrayList<>();
        List<DanglingEndpoint> dangling = new ArrayList<>();
        for (ConnectionDeclaration connection : ir.connections()) {
            if (connection.shape() != ConnectionShape.FOUR_ARGUMENT || !connection.hasLiteralEndpoints()) {
                continue;
            }
            boolean resolved = true;
            if (!nodes.containsKey(connection.sourceNode())) {
                dangling.add(new DanglingEndpoint(connection, EndpointRole.SOURCE, connection.sourceNode()));
                resolved = false;
            }
            if (!nodes.containsKey(connection.targetNode())) {
                dangling.add(new DanglingEndpoint(connection, EndpointRole.TARGET, connection.targetNode()));
                resolved = false;
            }
            if (resolved && !connection.cycleEdge()) {
                edges.add(connection);
            }
        }

        List<GraphCycle> cycles = findCycles(edges);
        log.debug("Built graph with {} nodes, {} edges, {} dangling endpoints, {} cycles",
            nodes.size(), edges.size(), dangling.size(), cycles.size());
        return new WorkflowGraph(nodes, edges, dangling, cycles);
    }

    /**
     * Builds a graph from bare connections without node declarations. Every endpoint
     * is taken as declared, so no dangling endpoints are reported.
     *
     * @param connections ordinary connections
     * @return workflow graph whose nodes carry no class or configuration
     */
    public WorkflowGraph buildDetached(List<ConnectionDeclaration> connections) {
        Map<String, NodeDeclaration> nodes = new LinkedHashMap<>();
        List<ConnectionDeclaration> edges = new ArrayList<>();
        for (ConnectionDeclaration connection : connections) {
            if (!connection.isOrdinary() || !connection.hasLiteralEndpoints()) {
                continue;
            }
            nodes.computeIfAbsent(connection.sourceNode(),
                id -> new NodeDeclaration(id, null, Map.of(), false, connection.line()));
            nodes.computeIfAbsent(connection.targetNode(),
                id -> new NodeDeclaration(id, null, Map.of(), false, connection.line()));
            edges.add(connection);
        }
        return new WorkflowGraph(nodes, edges, List.of(), findCycles(edges));
    }

    // ==================== Tarjan SCC ====================

    static List<GraphCycle> findCycles(List<ConnectionDeclaration> edges) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (ConnectionDeclaration edge : edges) {
            adjacency.computeIfAbsent(edge.sourceNode(), key -> new ArrayList<>()).add(edge.targetNode());
            adjacency.computeIfAbsent(edge.targetNode(), key -> new ArrayList<>());
        }

        Tarjan tarjan = new Tarjan(adjacency);
        List<GraphCycle> cycles = new ArrayList<>();
        for (Set<String> component : tarjan.components()) {
            boolean selfLoop = component.size() == 1
                && adjacency.get(component.iterator().next()).contains(component.iterator().next());
            if (component.size() < 2 && !selfLoop) {
                continue;
            }
            int line = edges.stream()
                .filter(edge -> component.contains(edge.sourceNode()) && component.contains(edge.targetNode()))
                .mapToInt(ConnectionDeclaration::line)
                .min()
                .orElse(0);
            cycles.add(new GraphCycle(component.stream().sorted().toList(), line));
        }
        cycles.sort(Comparator.comparing(GraphCycle::anchor));
        return cycles;
    }

    /**
     * Iterative Tarjan. Each frame remembers the next successor index to visit.
     */
    private static final class Tarjan {

        private final Map<String, List<String>> adjacency;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final List<Set<String>> components = new ArrayList<>();
        private int counter;

        Tarjan(Map<String, List<String>> adjacency) {
            this.adjacency = adjacency;
        }

        List<Set<String>> components() {
            for (String node : adjacency.keySet()) {
                if (!index.containsKey(node)) {
                    connect(node);
                }
            }
            return components;
        }

        private void connect(String root) {
            Deque<Frame> frames = new ArrayDeque<>();
            visit(root);
            frames.push(new Frame(root));

            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                List<String> successors = adjacency.get(frame.node);
                if (frame.next < successors.size()) {
                    String successor = successors.get(frame.next++);
                    if (!index.containsKey(successor)) {
                        visit(successor);
                        frames.push(new Frame(successor));
                    } else if (onStack.contains(successor)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(successor)));
                    }
                    continue;
                }

                frames.pop();
                if (!frames.isEmpty()) {
                    String parent = frames.peek().node;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node)));
                }
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    Set<String> component = new LinkedHashSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node));
                    components.add(component);
                }
            }
        }

        private void visit(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);
        }

        private static final class Frame {
            private final String node;
            private int next;

            Frame(String node) {
                this.node = node;
            }
        }
    }
}
