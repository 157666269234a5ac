package com.flowcheck.core.suggestion;

import com.flowcheck.core.model.DiagnosticCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Process-wide table of fix templates, one per {@link DiagnosticCode}.
 *
 * <p>The table is built once from an exhaustive switch, so adding a code without a
 * template does not compile.</p>
 */
public final class SuggestionTemplates {

    private static final Map<DiagnosticCode, SuggestionTemplate> TEMPLATES = build();

    private SuggestionTemplates() {
        // Utility class - no instantiation
    }

    public static SuggestionTemplate forCode(DiagnosticCode code) {
        return TEMPLATES.get(code);
    }

    public static Map<DiagnosticCode, SuggestionTemplate> all() {
        return TEMPLATES;
    }

    private static Map<DiagnosticCode, SuggestionTemplate> build() {
        Map<DiagnosticCode, SuggestionTemplate> templates = new EnumMap<>(DiagnosticCode.class);
        for (DiagnosticCode code : DiagnosticCode.values()) {
            templates.put(code, template(code));
        }
        return Collections.unmodifiableMap(templates);
    }

    private static SuggestionTemplate template(DiagnosticCode code) {
        return switch (code) {
            case SYN001 -> new SuggestionTemplate(
                "Fix Python syntax error on line ${line}",
                "Fix Python syntax error on line ${line}",
                """
                # Common syntax fixes:
                # 1. Missing commas in function calls
                # 2. Unmatched parentheses or brackets
                # 3. Incorrect indentation
                # 4. Missing quotes around strings

                workflow.add_node("PythonCodeNode", "node_id", {
                    "code": "result = {'key': 'value'}"
                })""",
                "Python syntax error in workflow code. Check for missing commas, quotes, parentheses, or indentation issues.",
                Map.of("line", "0"));

            case PAR001 -> new SuggestionTemplate(
                "Add get_parameters() method to ${node_type}",
                "Add get_parameters() method to ${node_type}",
                """
                def get_parameters(self) -> List[NodeParameter]:
                    \"""Define the parameters this node accepts.\"""
                    return [
                        NodeParameter(
                            name="example_param",
                            type=str,
                            required=True,
                            description="Example parameter description"
                        )
                    ]""",
                "Every node must implement get_parameters() to declare what parameters it accepts. The runtime drops undeclared parameters.",
                Map.of("node_type", "YourNode"));

            case PAR002 -> new SuggestionTemplate(
                "Declare parameter '${parameter}' in get_parameters()",
                "Declare parameter '${parameter}' in get_parameters()",
                """
                # Add to your node's get_parameters() method:
                NodeParameter(
                    name="${parameter}",
                    type=str,  # Replace with appropriate type
                    required=True,  # Set to False if optional
                    description="Description of ${parameter} parameter"
                )""",
                "Parameter '${parameter}' is used in ${node_type} but not declared in get_parameters(). The SDK filters undeclared parameters before run() is called.",
                Map.of("parameter", "unknown_param", "node_type", "the node"));

            case PAR003 -> new SuggestionTemplate(
                "Add type field to NodeParameter",
                "Add type field to NodeParameter",
                """
                NodeParameter(
                    name="parameter_name",
                    type=str,  # Add this required field
                    required=True,
                    description="Parameter description"
                )""",
                "NodeParameter requires a 'type' field for runtime validation. Common types: str, int, float, bool, dict, list",
                Map.of());

            case PAR004 -> new SuggestionTemplate(
                "Add required parameter '${parameter}' to node '${node_id}'",
                "Add required parameter '${parameter}' to node '${node_id}'",
                """
                # Add to your add_node call:
                workflow.add_node("${node_type}", "${node_id}", {
                    "${parameter}": "your_value_here",  # Add this required parameter
                    # ... other parameters
                })""",
                "Node '${node_id}' requires parameter '${parameter}' but it's not provided. You can provide it via node config, workflow connections, or runtime parameters.",
                Map.of("parameter", "missing_param", "node_id", "node", "node_type", "NodeType"));

            case CON001 -> new SuggestionTemplate(
                "Fix connection with ${arg_count} arguments - need exactly 4",
                "Use 4 parameters for connection",
                """
                # Correct connection syntax:
                workflow.add_connection(
                    "source_node_id",    # Source node ID
                    "output_field",      # Output field name (e.g., "result")
                    "target_node_id",    # Target node ID
                    "input_field"        # Input field name (e.g., "input", "data")
                )""",
                "Connections require exactly 4 parameters: source node, output field, target node, input field.",
                Map.of("arg_count", "0"));

            case CON002 -> new SuggestionTemplate(
                "Update to 4-parameter connection syntax",
                "Update to 4-parameter connection syntax",
                """
                # Change from old syntax:
                # workflow.add_connection("${source}", "${target}")

                # To new 4-parameter syntax:
                workflow.add_connection("${source}", "result", "${target}", "input")""",
                "The 2-parameter connection syntax is deprecated. Use 4-parameter syntax: add_connection(source, output, target, input)",
                Map.of("source", "source_node", "target", "target_node"));

            case CON003 -> new SuggestionTemplate(
                "Add missing source node '${source}' or fix connection",
                "Add missing source node '${source}'",
                """
                # Option 1: Add the missing source node
                workflow.add_node("SomeNodeType", "${source}", {
                    "param": "value"
                })

                # Option 2: Fix the connection to use existing node
                workflow.add_connection("existing_node", "result", "target_node", "input")""",
                "Connection references source node '${source}' which doesn't exist in the workflow.",
                Map.of("source", "missing_node"));

            case CON004 -> new SuggestionTemplate(
                "Add missing target node '${target}' or fix connection",
                "Add missing target node '${target}'",
                """
                # Option 1: Add the missing target node
                workflow.add_node("SomeNodeType", "${target}", {
                    "param": "value"
                })

                # Option 2: Fix the connection to use existing node
                workflow.add_connection("source_node", "result", "existing_node", "input")""",
                "Connection references target node '${target}' which doesn't exist in the workflow.",
                Map.of("target", "missing_node"));

            case CON005 -> new SuggestionTemplate(
                "Remove circular dependency in connections",
                "Remove circular dependency in connections",
                """
                # Circular dependency example (BAD):
                # Node A -> Node B -> Node C -> Node A

                # Fix by breaking the cycle, or declare an intentional loop
                # with workflow.create_cycle(...)
                workflow.add_connection("node_a", "result", "node_b", "input")
                workflow.add_connection("node_b", "result", "node_c", "input")
                # Remove: workflow.add_connection("node_c", "result", "node_a", "input")""",
                "Workflow connections form a circular dependency around '${node_id}'. Ordinary connections must form a directed acyclic graph.",
                Map.of("node_id", "a node"));

            case CON006 -> new SuggestionTemplate(
                "Check output field '${output}' of node '${source}'",
                "Use an output field that node '${source}' actually produces",
                """
                # Most nodes return their payload under "result":
                workflow.add_connection("${source}", "result", "target_node", "input")

                # Nested values can be addressed with a dotted path:
                workflow.add_connection("${source}", "result.data", "target_node", "input")""",
                "Field names are not checked at build time. A misspelled output field silently passes nothing to the target node.",
                Map.of("output", "output_field", "source", "source_node"));

            case CON007 -> new SuggestionTemplate(
                "Check input field '${input}' of node '${target}'",
                "Use an input parameter that node '${target}' declares",
                """
                # Connect to a parameter the target declares in get_parameters():
                workflow.add_connection("source_node", "result", "${target}", "data")""",
                "Inputs that the target node does not declare are dropped before run() is called.",
                Map.of("input", "input_field", "target", "target_node"));

            case CON008 -> new SuggestionTemplate(
                "Rename duplicate node '${node_id}'",
                "Give every node a unique id",
                """
                workflow.add_node("PythonCodeNode", "${node_id}", {"code": "..."})
                workflow.add_node("PythonCodeNode", "${node_id}_2", {"code": "..."})""",
                "Node ids identify nodes in connections. The runtime rejects a workflow that declares the same id twice.",
                Map.of("node_id", "node"));

            case CYC001 -> new SuggestionTemplate(
                "Migrate from deprecated cycle=True to CycleBuilder API",
                "Use workflow.create_cycle() API instead of cycle=True parameter",
                """
                # DEPRECATED - Don't use this:
                workflow.add_connection("node1", "output", "node2", "input", cycle=True)

                # CORRECT - Use CycleBuilder API:
                cycle_builder = workflow.create_cycle("my_cycle")
                cycle_builder.connect("node1", "node2", mapping={"output": "input"})
                cycle_builder.max_iterations(50)
                cycle_builder.converge_when("condition > threshold")
                cycle_builder.build()""",
                "The cycle=True parameter is deprecated. The CycleBuilder API controls convergence conditions, timeouts and iteration limits.",
                Map.of());

            case CYC002 -> new SuggestionTemplate(
                "Add required cycle configuration",
                "Add either max_iterations() or converge_when() to cycle",
                """
                cycle_builder = workflow.create_cycle("${cycle_name}")
                cycle_builder.connect("node1", "node2", mapping={"output": "input"})

                # Option 1: Use max_iterations
                cycle_builder.max_iterations(50)

                # Option 2: Use converge_when (recommended)
                cycle_builder.converge_when("quality > 0.95")

                # Optional: Add timeout for safety
                cycle_builder.timeout(300)

                cycle_builder.build()""",
                "Cycles must have either a maximum iteration limit or a convergence condition to prevent infinite loops.",
                Map.of("cycle_name", "my_cycle"));

            case CYC003 -> new SuggestionTemplate(
                "Fix invalid convergence condition syntax",
                "Use valid boolean expression for convergence condition",
                """
                # VALID convergence conditions:
                cycle_builder.converge_when("quality > 0.95")
                cycle_builder.converge_when("error < 0.01")
                cycle_builder.converge_when("quality > 0.95 and iterations < 100")
                cycle_builder.converge_when("abs(current - previous) < threshold")""",
                "Convergence conditions must be boolean expressions that can be evaluated during cycle execution.",
                Map.of("cycle_name", "my_cycle"));

            case CYC004 -> new SuggestionTemplate(
                "Add connections to cycle",
                "Add at least one connection to the cycle",
                """
                cycle_builder = workflow.create_cycle("${cycle_name}")

                cycle_builder.connect("source_node", "target_node", mapping={
                    "output_field": "input_field"
                })

                # For feedback loops, connect back to source
                cycle_builder.connect("target_node", "source_node", mapping={
                    "feedback": "adjustment"
                })

                cycle_builder.max_iterations(50)
                cycle_builder.build()""",
                "Cycles must have at least one connection between nodes to define the cyclic flow.",
                Map.of("cycle_name", "my_cycle"));

            case CYC005 -> new SuggestionTemplate(
                "Fix cycle connection mapping format",
                "Use dictionary format for mapping parameter",
                """
                cycle_builder.connect("node1", "node2", mapping={
                    "output_field": "input_field",
                    "result": "data"
                })

                # INCORRECT mapping formats:
                # cycle_builder.connect("node1", "node2", mapping="invalid")
                # cycle_builder.connect("node1", "node2", mapping=["list", "format"])""",
                "The mapping parameter must be a dictionary that maps output fields of the source node to input fields of the target node.",
                Map.of("cycle_name", "my_cycle"));

            case CYC006 -> new SuggestionTemplate(
                "Lower max_iterations of cycle '${cycle_name}'",
                "Replace the high iteration limit with a convergence condition",
                """
                cycle_builder = workflow.create_cycle("${cycle_name}")
                cycle_builder.max_iterations(100)
                cycle_builder.converge_when("quality > 0.95")""",
                "A cycle allowed to run ${max_iterations} times can hold a worker for a long time. A convergence condition stops it as soon as the result is good enough.",
                Map.of("cycle_name", "my_cycle", "max_iterations", "many"));

            case CYC007 -> new SuggestionTemplate(
                "Fix cycle timeout value",
                "Use positive number for timeout value",
                """
                # VALID timeout values:
                cycle_builder.timeout(300)    # 5 minutes
                cycle_builder.timeout(60)     # 1 minute

                # INVALID timeout values:
                # cycle_builder.timeout(-1)
                # cycle_builder.timeout(0)
                # cycle_builder.timeout("5m")""",
                "Timeout values must be positive numbers of seconds.",
                Map.of("cycle_name", "my_cycle"));

            case CYC008 -> new SuggestionTemplate(
                "Fix non-existent node reference in cycle",
                "Add '${node_name}' node or use existing node name",
                """
                # Option 1: Add the missing node
                workflow.add_node("NodeType", "${node_name}", {
                    "parameter": "value"
                })

                # Option 2: Use existing node name in cycle
                cycle_builder.connect("existing_node", "other_existing_node", mapping={
                    "output": "input"
                })""",
                "The cycle references node '${node_name}' which doesn't exist in the workflow. Either add this node or use an existing node name.",
                Map.of("cycle_name", "my_cycle", "node_name", "missing_node"));

            case IMP001 -> new SuggestionTemplate(
                "Add missing import for '${missing_name}'",
                "Add import statement at the top of your file",
                """
                # Add this import at the top of your file:
                ${import_statement}""",
                "The code uses '${missing_name}' but doesn't import it.",
                Map.of("missing_name", "WorkflowBuilder",
                    "import_statement", "from kailash.workflow.builder import WorkflowBuilder"));

            case IMP002 -> new SuggestionTemplate(
                "Remove unused import '${import_name}'",
                "Delete the unused import statement on line ${line}",
                """
                # Only import what you use:
                from kailash.workflow.builder import WorkflowBuilder
                from kailash.runtime.local import LocalRuntime

                workflow = WorkflowBuilder()
                runtime = LocalRuntime()""",
                "The import '${import_name}' is not used anywhere in the code.",
                Map.of("import_name", "unused_import", "line", "0"));

            case IMP003 -> new SuggestionTemplate(
                "Fix import path for '${import_name}'",
                "Use correct import path for '${import_name}'",
                """
                # WRONG:
                from ${current_path} import ${import_name}

                # CORRECT:
                from ${correct_path} import ${import_name}""",
                "The import path '${current_path}' is incorrect for '${import_name}'. Use '${correct_path}'.",
                Map.of("import_name", "WorkflowBuilder", "current_path", "wrong.path",
                    "correct_path", "kailash.workflow.builder"));

            case IMP004 -> new SuggestionTemplate(
                "Convert relative import to absolute import",
                "Use absolute import instead of relative import for '${import_name}'",
                """
                # WRONG - Relative imports:
                from ..workflow.builder import WorkflowBuilder

                # CORRECT - Absolute imports:
                from kailash.workflow.builder import WorkflowBuilder""",
                "Relative imports break when the file moves between packages. Import SDK components by their absolute 'kailash' path.",
                Map.of("import_name", "module"));

            case IMP006 -> new SuggestionTemplate(
                "Reorder imports according to PEP 8",
                "Reorganize imports in the correct order",
                """
                # 1. Standard library imports first
                import os
                from typing import Dict, List

                # 2. Third-party imports second
                import numpy as np

                # 3. SDK imports third
                from kailash.workflow.builder import WorkflowBuilder

                # 4. Local/relative imports last
                from .my_custom_module import CustomClass""",
                "Imports are grouped as standard library, third-party packages, SDK, then local modules.",
                Map.of());

            case IMP008 -> new SuggestionTemplate(
                "Remove heavy unused import '${import_name}'",
                "Remove or lazy-load the heavy import '${import_name}'",
                """
                # Import only when needed:
                def process_with_tensorflow(data):
                    import tensorflow as tf
                    return tf.process(data)""",
                "Heavy imports like '${import_name}' slow down startup. Remove unused heavy imports or import them inside the function that needs them.",
                Map.of("import_name", "heavy_module"));

            case GOLD002 -> new SuggestionTemplate(
                "Use correct execution pattern with runtime.execute()",
                "Use runtime.execute(workflow.build()) pattern",
                """
                from kailash.workflow.builder import WorkflowBuilder
                from kailash.runtime.local import LocalRuntime

                workflow = WorkflowBuilder()
                workflow.add_node("PythonCodeNode", "process", {
                    "code": "result = {'output': 'value'}"
                })

                runtime = LocalRuntime()
                results, run_id = runtime.execute(workflow.build())""",
                "Always use runtime.execute(workflow.build()), never workflow.execute(runtime). Building first validates parameters and connections.",
                Map.of());

            case GOLD003 -> new SuggestionTemplate(
                "Use snake_case builder methods",
                "Rename camelCase builder calls to their snake_case form",
                """
                workflow.add_node("PythonCodeNode", "process", {"code": "..."})
                workflow.add_connection("fetch", "result", "process", "data")
                workflow.create_cycle("refine")""",
                "The builder only defines snake_case methods. Calls such as addNode() fail with AttributeError.",
                Map.of());

            case VAL001 -> new SuggestionTemplate(
                "Validator fault in ${pass}",
                "Report the source that triggered the fault",
                "# Manual fix required",
                "The validator hit an internal fault and could not finish this check. Other checks still ran.",
                Map.of("pass", "a validation pass"));
        };
    }
}
