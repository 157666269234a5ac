package com.flowcheck.core.validator;

import com.flowcheck.core.config.ValidatorConfig;
import com.flowcheck.core.graph.WorkflowGraph;
import com.flowcheck.core.ir.WorkflowIr;
import com.flowcheck.core.parser.ast.PythonAst.Module;
import com.flowcheck.core.registry.NodeTypeRegistry;
import com.flowcheck.core.registry.SdkSymbolCatalog;

import java.util.Objects;

/**
 * Everything a rule pass may read.
 *
 * <p>Created once per request after the graph is built. All members are immutable,
 * so passes can run in any order.</p>
 *
 * @param module parsed source; an empty module when validating bare connections
 * @param ir extracted IR
 * @param graph workflow graph
 * @param config validator configuration
 * @param registry known node types
 * @param catalog SDK import catalog
 */
public record ValidationContext(
    Module module,
    WorkflowIr ir,
    WorkflowGraph graph,
    ValidatorConfig config,
    NodeTypeRegistry registry,
    SdkSymbolCatalog catalog
) {
    public ValidationContext {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(ir, "ir must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
    }
}
