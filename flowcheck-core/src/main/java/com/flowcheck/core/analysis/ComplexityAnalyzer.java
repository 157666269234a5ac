package com.flowcheck.core.analysis;

import com.flowcheck.core.graph.WorkflowGraph;
import com.flowcheck.core.ir.ConnectionDeclaration;
import com.flowcheck.core.ir.CycleDefinition;
import com.flowcheck.core.ir.NodeDeclaration;
import com.flowcheck.core.ir.WorkflowIr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes structural metrics and optimisation hints for a workflow.
 *
 * <p>The analyzer only reads the IR and graph. Scores are heuristics: they rank
 * workflows against each other and carry no absolute meaning.</p>
 */
public class ComplexityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    static final String UNKNOWN_TYPE = "Unknown";

    private static final Set<String> HIGH_LATENCY_TYPES = Set.of(
        "HTTPRequestNode", "DatabaseQueryNode", "LLMAgentNode");
    private static final Set<String> EXTERNAL_TYPES = Set.of(
        "HTTPRequestNode", "DatabaseQueryNode", "ExternalAPINode");
    private static final Set<String> MEMORY_INTENSIVE_TYPES = Set.of(
        "LLMAgentNode", "EmbeddingGeneratorNode", "VectorSearchNode", "MLModelNode");
    private static final Set<String> CPU_INTENSIVE_TYPES = Set.of(
        "DataProcessorNode", "MLModelNode", "ImageProcessorNode", "ComputeNode");
    private static final Set<String> ERROR_HANDLING_KEYS = Set.of(
        "retry", "max_retries", "retry_config", "timeout", "request_timeout");

    private static final int FAN_OUT_THRESHOLD = 3;
    private static final int LONG_FIELD_NAME = 10;

    /**
     * Analyses a workflow.
     *
     * @param ir extracted IR
     * @param graph graph built from the IR
     * @return complexity report, {@link ComplexityReport#empty()} when the source has no workflow
     */
    public ComplexityReport analyze(WorkflowIr ir, WorkflowGraph graph) {
        if (ir.hasNoWorkflow()) {
            return ComplexityReport.empty();
        }

        Map<String, Integer> outgoing = fanOut(ir.connections());
        ComplexityMetrics metrics = metrics(ir, graph, outgoing);
        List<WorkflowFinding> bottlenecks = bottlenecks(ir, outgoing);
        List<WorkflowFinding> risks = errorRisks(ir, outgoing);
        List<OptimizationHint> hints = optimizations(metrics);

        log.debug("Complexity: {} nodes, {} connections, score {}, pattern {}",
            metrics.nodeCount(), metrics.connectionCount(), metrics.complexityScore(),
            metrics.patternType().wireName());

        return new ComplexityReport(true, null, metrics, hints, bottlenecks, risks,
            resources(ir.nodes()), scalability(ir.nodes(), outgoing));
    }

    // ==================== Metrics ====================

    private ComplexityMetrics metrics(WorkflowIr ir, WorkflowGraph graph, Map<String, Integer> outgoing) {
        List<NodeDeclaration> nodes = ir.nodes();
        List<ConnectionDeclaration> connections = ir.connections();

        int legacyCycleEdges = (int) connections.stream().filter(ConnectionDeclaration::cycleEdge).count();
        int cycleCount = ir.cycles().size() + legacyCycleEdges;

        Map<String, Integer> nodeTypes = new LinkedHashMap<>();
        for (NodeDeclaration node : nodes) {
            nodeTypes.merge(typeOf(node), 1, Integer::sum);
        }

        int depth = graph.depth();
        double complexityScore = nodes.size() * 2
            + connections.size() * 1.5
            + cycleCount * 10
            + depth * 3
            + nodeTypes.size() * 2;
        double configuration = configurationComplexity(nodes);
        double connection = connectionComplexity(connections);
        double maintenance = complexityScore * 0.5 + configuration * 20 + connection * 15;

        return new ComplexityMetrics(
            nodes.size(),
            connections.size(),
            cycleCount,
            depth,
            round(complexityScore),
            patternType(ir, graph, cycleCount),
            round(parallelism(nodes.size(), outgoing)),
            nodeTypes,
            maxCycleDepth(ir.cycles(), legacyCycleEdges),
            round(configuration),
            round(connection),
            round(maintenance));
    }

    private PatternType patternType(WorkflowIr ir, WorkflowGraph graph, int cycleCount) {
        if (ir.nodes().isEmpty()) {
            return PatternType.EMPTY;
        }
        if (cycleCount > 0) {
            return PatternType.CYCLIC;
        }
        if (ir.nodes().size() == 1) {
            return PatternType.SINGLE_NODE;
        }
        // Circular dependencies among ordinary connections have no clean shape
        if (!graph.cycles().isEmpty()) {
            return PatternType.COMPLEX;
        }

        Map<String, Integer> in = new LinkedHashMap<>();
        Map<String, Integer> out = new LinkedHashMap<>();
        for (ConnectionDeclaration connection : ir.connections()) {
            if (ir.node(connection.sourceNode()).isPresent()) {
                out.merge(connection.sourceNode(), 1, Integer::sum);
            }
            if (ir.node(connection.targetNode()).isPresent()) {
                in.merge(connection.targetNode(), 1, Integer::sum);
            }
        }
        boolean branches = in.values().stream().anyMatch(count -> count > 1)
            || out.values().stream().anyMatch(count -> count > 1);
        return branches ? PatternType.PARALLEL : PatternType.LINEAR;
    }

    private double parallelism(int nodeCount, Map<String, Integer> outgoing) {
        if (nodeCount <= 1) {
            return 0.0;
        }
        int parallel = outgoing.values().stream()
            .filter(count -> count > 1)
            .mapToInt(count -> count - 1)
            .sum();
        return (double) parallel / (nodeCount - 1);
    }

    private int maxCycleDepth(List<CycleDefinition> cycles, int legacyCycleEdges) {
        int max = legacyCycleEdges > 0 ? 1 : 0;
        for (CycleDefinition cycle : cycles) {
            max = Math.max(max, cycle.edges().size());
        }
        return max;
    }

    private double configurationComplexity(List<NodeDeclaration> nodes) {
        if (nodes.isEmpty()) {
            return 0.0;
        }
        int total = 0;
        for (NodeDeclaration node : nodes) {
            long nested = node.config().values().stream()
                .filter(value -> value instanceof Map || value instanceof Collection)
                .count();
            total += node.config().size() + (int) nested * 2;
        }
        return (double) total / nodes.size();
    }

    private double connectionComplexity(List<ConnectionDeclaration> connections) {
        if (connections.isEmpty()) {
            return 0.0;
        }
        double total = 0;
        for (ConnectionDeclaration connection : connections) {
            double weight = 1;
            if (length(connection.sourceOutput()) > LONG_FIELD_NAME || length(connection.targetInput()) > LONG_FIELD_NAME) {
                weight += 0.5;
            }
            total += weight;
        }
        return total / connections.size();
    }

    // ==================== Findings ====================

    private List<WorkflowFinding> bottlenecks(WorkflowIr ir, Map<String, Integer> outgoing) {
        List<WorkflowFinding> findings = new ArrayList<>();

        List<String> llmNodes = ir.nodes().stream()
            .filter(node -> typeOf(node).contains("LLM"))
            .map(NodeDeclaration::id)
            .toList();
        if (llmNodes.size() >= 3) {
            long chained = ir.connections().stream()
                .filter(connection -> llmNodes.contains(connection.sourceNode())
                    && llmNodes.contains(connection.targetNode()))
                .count();
            if (chained >= 2) {
                findings.add(new WorkflowFinding("sequential_llm_calls", "high",
                    "Found " + llmNodes.size() + " LLM nodes in sequence",
                    "Consider parallelizing LLM calls or using batch processing",
                    llmNodes));
            }
        }

        List<String> highLatency = ir.nodes().stream()
            .filter(node -> HIGH_LATENCY_TYPES.contains(typeOf(node)))
            .map(NodeDeclaration::id)
            .toList();
        if (highLatency.size() >= 4) {
            findings.add(new WorkflowFinding("high_latency_chain", "medium",
                "Found " + highLatency.size() + " high-latency operations",
                "Consider caching, parallel execution, or async processing",
                highLatency));
        }

        outgoing.forEach((nodeId, count) -> {
            if (count >= FAN_OUT_THRESHOLD) {
                findings.add(new WorkflowFinding("single_point_of_failure", "high",
                    "Node '" + nodeId + "' feeds into " + count + " other nodes",
                    "Add redundancy or split responsibilities",
                    List.of(nodeId)));
            }
        });
        return findings;
    }

    private List<WorkflowFinding> errorRisks(WorkflowIr ir, Map<String, Integer> outgoing) {
        List<WorkflowFinding> risks = new ArrayList<>();

        for (NodeDeclaration node : ir.nodes()) {
            if (!EXTERNAL_TYPES.contains(typeOf(node))) {
                continue;
            }
            boolean handled = node.config().keySet().stream().anyMatch(ERROR_HANDLING_KEYS::contains);
            if (!handled) {
                risks.add(new WorkflowFinding("no_error_handling", "medium",
                    "External node '" + node.id() + "' lacks error handling",
                    "Add retry logic and timeout configuration",
                    List.of(node.id())));
            }
        }

        outgoing.forEach((nodeId, count) -> {
            if (count >= FAN_OUT_THRESHOLD) {
                risks.add(new WorkflowFinding("single_point_of_failure", "high",
                    "Critical dependency on node '" + nodeId + "'",
                    "Add backup nodes or implement circuit breaker pattern",
                    List.of(nodeId)));
            }
        });
        return risks;
    }

    private List<OptimizationHint> optimizations(ComplexityMetrics metrics) {
        List<OptimizationHint> hints = new ArrayList<>();

        if (metrics.patternType() == PatternType.LINEAR && metrics.nodeCount() >= 4) {
            hints.add(new OptimizationHint("parallelize_operations", "medium",
                "Linear workflow could benefit from parallelization",
                "Consider splitting independent operations into parallel branches",
                "50-70% reduction in execution time"));
        }
        if (metrics.workflowDepth() >= 5) {
            hints.add(new OptimizationHint("pipeline_optimization", "high",
                "Deep workflow may benefit from pipelining",
                "Implement streaming/pipeline processing to reduce latency",
                "30-50% reduction in end-to-end latency"));
        }
        metrics.nodeTypes().forEach((type, count) -> {
            if (count >= 3 && HIGH_LATENCY_TYPES.contains(type)) {
                hints.add(new OptimizationHint("add_caching", "medium",
                    "Multiple " + type + " instances detected",
                    "Add caching layer for " + type + " to avoid redundant calls",
                    "20-40% reduction in external API calls"));
            }
        });
        if (metrics.nodeCount() >= 10) {
            hints.add(new OptimizationHint("batch_processing", "low",
                "Large workflow may benefit from batch processing",
                "Group similar operations into batches to improve efficiency",
                "10-25% improvement in resource utilization"));
        }
        return hints;
    }

    // ==================== Resources ====================

    private ResourceAnalysis resources(List<NodeDeclaration> nodes) {
        int memory = (int) nodes.stream().filter(node -> MEMORY_INTENSIVE_TYPES.contains(typeOf(node))).count();
        int cpu = (int) nodes.stream().filter(node -> CPU_INTENSIVE_TYPES.contains(typeOf(node))).count();
        double efficiency = Math.min(1.0, (double) nodes.size() / Math.max(1, memory + cpu));
        return new ResourceAnalysis(
            memory,
            cpu,
            memory * 500 + nodes.size() * 50,
            Math.max(1, cpu / 2 + 1),
            round(efficiency));
    }

    private ScalabilityAnalysis scalability(List<NodeDeclaration> nodes, Map<String, Integer> outgoing) {
        boolean balancer = nodes.stream().anyMatch(node -> typeOf(node).contains("Balancer"));
        int workers = (int) nodes.stream()
            .filter(node -> typeOf(node).contains("Worker") || typeOf(node).contains("Processor"))
            .count();

        int maxOut = outgoing.values().stream().mapToInt(Integer::intValue).max().orElse(1);
        double avgOut = outgoing.values().stream().mapToInt(Integer::intValue).average().orElse(1.0);
        double distribution = Math.min(1.0, avgOut / maxOut);

        long fanningOut = outgoing.values().stream().filter(count -> count > 1).count();
        double horizontal = Math.min(1.0, (double) fanningOut / Math.max(1, nodes.size() / 2));
        int bottleneckCount = (int) outgoing.values().stream().filter(count -> count > 5).count();

        return new ScalabilityAnalysis(
            round(horizontal),
            round(distribution),
            balancer,
            workers,
            bottleneckCount,
            round((horizontal + distribution) / 2));
    }

    // ==================== Helpers ====================

    private static Map<String, Integer> fanOut(List<ConnectionDeclaration> connections) {
        Map<String, Integer> outgoing = new LinkedHashMap<>();
        for (ConnectionDeclaration connection : connections) {
            if (connection.hasLiteralEndpoints()) {
                outgoing.merge(connection.sourceNode(), 1, Integer::sum);
            }
        }
        return outgoing;
    }

    private static String typeOf(NodeDeclaration node) {
        return node.hasClassName() ? node.className() : UNKNOWN_TYPE;
    }

    private static int length(String value) {
        return value != null ? value.length() : 0;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
