package com.compgraph.core;

/**
 * Opaque reference to a node's position inside one {@link Graph}.
 *
 * Handles are pure identity: equality, ordering and hashing all derive from the
 * underlying position. Only {@link Graph#append(Node)} creates them.
 *
 * Caller Contract:
 * A handle is only meaningful against the graph that produced it. No
 * cross-graph check is performed; using a handle from one graph against another
 * is undefined. Because graphs are append-only, a handle stays valid for the
 * lifetime of its graph.
 */
public final class NodeHandle implements Comparable<NodeHandle> {
    private final int index;

    NodeHandle(int index) {
        this.index = index;
    }

    /** Position of the node in construction order. */
    public int index() {
        return index;
    }

    /** True if this handle was appended strictly before {@code other}. */
    public boolean precedes(NodeHandle other) {
        return index < other.index;
    }

    @Override
    public int compareTo(NodeHandle other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeHandle h && h.index == index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
