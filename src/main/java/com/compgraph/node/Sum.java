package com.compgraph.node;

import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.core.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sum of any number of children. An empty sum is 0.
 *
 * The derivative is the sum of the children's derivatives, so it references
 * only derivative handles. A child listed twice contributes twice.
 */
public final class Sum implements Node {
    private final List<NodeHandle> children;

    public Sum(List<NodeHandle> children) {
        this.children = List.copyOf(children);
    }

    public static Sum of(NodeHandle... children) {
        return new Sum(List.of(children));
    }

    @Override
    public double value(NodeHandle self, Map<NodeHandle, Double> values) {
        double total = 0.0;
        for (NodeHandle child : children)
            total += Values.value(values, child);
        return total;
    }

    @Override
    public Node derivative(NodeHandle self, Set<NodeHandle> wrt, Map<NodeHandle, NodeHandle> derivatives) {
        List<NodeHandle> d = new ArrayList<>(children.size());
        for (NodeHandle child : children)
            d.add(Values.derivative(derivatives, child));
        return new Sum(d);
    }

    @Override
    public List<NodeHandle> children() {
        return children;
    }

    @Override
    public String toString() {
        return "Sum" + children;
    }
}
