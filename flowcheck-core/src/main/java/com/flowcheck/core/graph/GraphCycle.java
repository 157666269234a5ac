package com.flowcheck.core.graph;

import java.util.List;
import java.util.Objects;

/**
 * One strongly connected group of nodes among the ordinary connections.
 *
 * @param members node ids in lexical order
 * @param line smallest source line among the connections inside the group
 */
public record GraphCycle(List<String> members, int line) {
    public GraphCycle {
        Objects.requireNonNull(members, "members must not be null");
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cycle needs at least one member");
        }
    }

    /**
     * Canonical anchor of the cycle: its lexically smallest node id.
     *
     * @return anchor node id
     */
    public String anchor() {
        return members.get(0);
    }

    public String describe() {
        return String.join(", ", members);
    }
}
