package com.compgraph.util;

import com.compgraph.core.Graph;
import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.node.Constant;

import java.util.Locale;
import java.util.Map;

/**
 * Diagnostic utility for inspecting graph structure and evaluated values.
 *
 * <p>
 * Generates human-readable strings only; nothing is written anywhere.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error logs. Every method
 * scans the graph and allocates strings, so keep it out of tight loops.
 */
public final class GraphExplain {
    private final Graph graph;

    public GraphExplain(Graph graph) {
        this.graph = graph;
    }

    /**
     * Dumps the structure of a single node.
     */
    public String explainNode(NodeHandle handle) {
        Node node = graph.node(handle);
        int parents = 0;
        for (int i = handle.index() + 1; i < graph.size(); i++) {
            if (graph.node(graph.handle(i)).children().contains(handle))
                parents++;
        }
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(handle).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n')
                .append("  Detail: ").append(node).append('\n')
                .append("  Children: ").append(node.children()).append('\n')
                .append("  Parents: ").append(parents).append('\n')
                .append("  Paths from leaves: ").append(PathCounter.countPaths(graph, handle)).append('\n');
        return sb.toString();
    }

    /**
     * Tabulates every node with its value from {@code values}, or "-" where the
     * map has none.
     */
    public String explain(Map<NodeHandle, Double> values) {
        StringBuilder sb = new StringBuilder(64 * (graph.size() + 2));
        sb.append(String.format(Locale.ROOT, "%-8s | %-14s | %-24s | %s%n", "Handle", "Kind", "Children", "Value"));
        sb.append("----------------------------------------------------------------------\n");
        for (NodeHandle h : graph.asSubgraph()) {
            Node node = graph.node(h);
            Double v = values.get(h);
            sb.append(String.format(Locale.ROOT, "%-8s | %-14s | %-24s | %s%n", h, node.kind(), node.children(),
                    v == null ? "-" : String.format(Locale.ROOT, "%.6f", v)));
        }
        return sb.toString();
    }

    /**
     * Renders the graph as a Mermaid flowchart. Edges point from child to
     * parent, the direction values flow.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (NodeHandle h : graph.asSubgraph()) {
            Node node = graph.node(h);
            String label = node instanceof Constant c
                    ? h + " " + String.format(Locale.ROOT, "%.4f", c.value())
                    : h + " " + node.kind();
            sb.append("  n").append(h.index()).append("[\"").append(label).append("\"];\n");
        }
        for (NodeHandle h : graph.asSubgraph()) {
            for (NodeHandle child : graph.node(h).children())
                sb.append("  n").append(child.index()).append(" --> n").append(h.index()).append(";\n");
        }
        return sb.toString();
    }
}
