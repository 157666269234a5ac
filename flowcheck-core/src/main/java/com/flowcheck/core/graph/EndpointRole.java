package com.flowcheck.core.graph;

/**
 * Side of a connection that failed to resolve.
 */
public enum EndpointRole {
    SOURCE,
    TARGET
}
