package com.compgraph.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeSet;

/**
 * An ordered set of handles scoping an evaluation or reporting the nodes
 * created by a differentiation pass.
 *
 * Handles are deduplicated and sorted ascending on construction. Since every
 * node only references earlier handles, ascending order is a valid topological
 * order for any subset of the graph.
 *
 * Like handles, a subgraph is only meaningful against the graph it came from.
 */
public final class Subgraph implements Iterable<NodeHandle> {
    private static final Subgraph EMPTY = new Subgraph(List.of());

    private final List<NodeHandle> handles;

    private Subgraph(List<NodeHandle> handles) {
        this.handles = handles;
    }

    /**
     * Creates a subgraph from handles in any order, with duplicates removed.
     */
    public static Subgraph of(Collection<NodeHandle> handles) {
        if (handles.isEmpty())
            return EMPTY;
        return new Subgraph(List.copyOf(new TreeSet<>(handles)));
    }

    public static Subgraph of(NodeHandle... handles) {
        return of(List.of(handles));
    }

    public static Subgraph empty() {
        return EMPTY;
    }

    /** Contiguous handles {@code from} (inclusive) to {@code to} (exclusive). */
    static Subgraph range(int from, int to) {
        if (from >= to)
            return EMPTY;
        List<NodeHandle> list = new ArrayList<>(to - from);
        for (int i = from; i < to; i++)
            list.add(new NodeHandle(i));
        return new Subgraph(Collections.unmodifiableList(list));
    }

    /** Handles in ascending order. The list is unmodifiable. */
    public List<NodeHandle> handles() {
        return handles;
    }

    public int size() {
        return handles.size();
    }

    public boolean isEmpty() {
        return handles.isEmpty();
    }

    public boolean contains(NodeHandle handle) {
        return Collections.binarySearch(handles, handle) >= 0;
    }

    public NodeHandle first() {
        if (handles.isEmpty())
            throw new NoSuchElementException("Empty subgraph");
        return handles.get(0);
    }

    public NodeHandle last() {
        if (handles.isEmpty())
            throw new NoSuchElementException("Empty subgraph");
        return handles.get(handles.size() - 1);
    }

    @Override
    public Iterator<NodeHandle> iterator() {
        return handles.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Subgraph s && s.handles.equals(handles);
    }

    @Override
    public int hashCode() {
        return handles.hashCode();
    }

    @Override
    public String toString() {
        return "Subgraph" + handles;
    }
}
