package com.flowcheck.core.parser.ast;

import com.flowcheck.core.parser.ast.PythonAst.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Iterative pre-order traversal over {@link PythonAst} trees.
 *
 * <p>Uses an explicit stack, so deeply nested expressions never exhaust the call stack.
 * Children are visited in source order.</p>
 */
public final class AstWalker {

    private AstWalker() {
        // Utility class - no instantiation
    }

    /**
     * Visits {@code root} and all of its descendants.
     *
     * @param root start node
     * @param visitor callback invoked once per node
     */
    public static void walk(Node root, Consumer<Node> visitor) {
        if (root == null) {
            return;
        }
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            visitor.accept(node);
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Collects every node of the given type below {@code root}, in pre-order.
     *
     * @param root start node
     * @param type node type to collect
     * @param <T> node type
     * @return matching nodes
     */
    public static <T extends Node> List<T> collect(Node root, Class<T> type) {
        List<T> result = new ArrayList<>();
        walk(root, node -> {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        });
        return result;
    }

    /**
     * Collects nodes of a type below every root in {@code roots}.
     *
     * @param roots start nodes
     * @param type node type to collect
     * @param <T> node type
     * @return matching nodes
     */
    public static <T extends Node> List<T> collect(List<? extends Node> roots, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Node root : roots) {
            result.addAll(collect(root, type));
        }
        return result;
    }
}
