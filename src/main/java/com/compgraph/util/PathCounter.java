package com.compgraph.util;

import com.compgraph.core.Graph;
import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;

/**
 * Counts leaf-to-node paths in a graph.
 *
 * The number of paths through a DAG can grow exponentially with its depth, so
 * a naive recursive walk is hopeless on deep graphs. This counter memoizes the
 * path count per handle in a single ascending pass: a leaf has one path, and
 * any other node has the sum of its children's counts (a child listed twice
 * counts twice).
 *
 * Useful as a diagnostic when checking that a graph's evaluation cost is
 * linear in node count while its path count is not.
 */
public final class PathCounter {
    private PathCounter() {
        // Utility class
    }

    /**
     * Returns the number of distinct paths from any leaf to {@code target}.
     *
     * @throws ArithmeticException if the count overflows a long.
     */
    public static long countPaths(Graph graph, NodeHandle target) {
        int n = target.index() + 1;
        long[] counts = new long[n];
        for (int i = 0; i < n; i++) {
            Node node = graph.node(graph.handle(i));
            if (node.children().isEmpty()) {
                counts[i] = 1;
                continue;
            }
            long total = 0;
            for (NodeHandle child : node.children())
                total = Math.addExact(total, counts[child.index()]);
            counts[i] = total;
        }
        return counts[target.index()];
    }
}
