package com.compgraph.node;

import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;

import java.util.Map;
import java.util.Set;

/**
 * A fixed scalar. Its derivative is always zero.
 */
public record Constant(double value) implements Node {
    public static final Constant ZERO = new Constant(0.0);
    public static final Constant ONE = new Constant(1.0);

    @Override
    public double value(NodeHandle self, Map<NodeHandle, Double> values) {
        return value;
    }

    @Override
    public Node derivative(NodeHandle self, Set<NodeHandle> wrt, Map<NodeHandle, NodeHandle> derivatives) {
        return ZERO;
    }
}
