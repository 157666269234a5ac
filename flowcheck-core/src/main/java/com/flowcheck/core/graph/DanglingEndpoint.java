package com.flowcheck.core.graph;

import com.flowcheck.core.ir.ConnectionDeclaration;

import java.util.Objects;

/**
 * Connection endpoint that names a node the workflow never declares.
 *
 * @param connection offending connection
 * @param role which side failed to resolve
 * @param nodeId the unresolved node id
 */
public record DanglingEndpoint(ConnectionDeclaration connection, EndpointRole role, String nodeId) {
    public DanglingEndpoint {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
    }
}
