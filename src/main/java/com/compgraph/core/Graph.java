package com.compgraph.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph -- append-only arena of computation nodes.
 *
 * Nodes live in a single growable list and are addressed by their position,
 * wrapped in a {@link NodeHandle}. The graph exclusively owns its nodes; the
 * backing list is never exposed.
 *
 * Invariants:
 * 1. Append-only: nodes are never removed or replaced, so every handle the
 * graph hands out stays valid for the graph's lifetime.
 * 2. Children first: a node may only reference handles that already exist
 * when it is appended. Every edge therefore points to a smaller index, which
 * makes ascending handle order a valid topological order for the whole graph,
 * always. No sort or cycle detection is ever needed.
 *
 * Thread Safety:
 * Not thread-safe. Concurrent readers are only safe while nobody appends
 * (differentiation appends too); guard shared graphs externally.
 */
public final class Graph {
    private final List<Node> nodes;

    public Graph() {
        this.nodes = new ArrayList<>();
    }

    public Graph(int expectedSize) {
        this.nodes = new ArrayList<>(expectedSize);
    }

    /**
     * Appends a node at the next position.
     *
     * @param node The node to add. Its children must already be in the graph.
     * @return The handle of the new node.
     * @throws IllegalArgumentException if the node references a handle that
     *                                  does not precede it.
     */
    public NodeHandle append(Node node) {
        int idx = nodes.size();
        for (NodeHandle child : node.children()) {
            if (child.index() < 0 || child.index() >= idx)
                throw new IllegalArgumentException(
                        "Node " + node.kind() + " at #" + idx + " references " + child + " which does not precede it");
        }
        nodes.add(node);
        return new NodeHandle(idx);
    }

    /**
     * Returns the node stored at a handle.
     *
     * Foreign or stale handles are a caller error. With assertions enabled
     * (-ea) the bounds check reports the graph size; otherwise the backing list
     * still fails with IndexOutOfBoundsException.
     */
    public Node node(NodeHandle handle) {
        assert handle.index() >= 0 && handle.index() < nodes.size()
                : "Handle " + handle + " out of range for graph of size " + nodes.size();
        return nodes.get(handle.index());
    }

    /** Returns the handle at a position. */
    public NodeHandle handle(int index) {
        if (index < 0 || index >= nodes.size())
            throw new IndexOutOfBoundsException("Index " + index + " out of range for graph of size " + nodes.size());
        return new NodeHandle(index);
    }

    /** True if the handle addresses a node in this graph's current range. */
    public boolean contains(NodeHandle handle) {
        return handle.index() >= 0 && handle.index() < nodes.size();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** All current handles, ascending. Nodes appended later are not included. */
    public Subgraph asSubgraph() {
        return Subgraph.range(0, nodes.size());
    }
}
