package com.compgraph.node;

import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.core.Values;

import java.util.Map;
import java.util.Set;

/**
 * An external input.
 *
 * A variable stores nothing: its value is bound by the caller under the
 * variable's own handle before evaluation. Evaluating an unbound variable is a
 * contract violation and fails with IllegalStateException.
 *
 * The derivative is 1 if this variable is one of the selected variables and 0
 * otherwise.
 */
public final class Variable implements Node {

    @Override
    public double value(NodeHandle self, Map<NodeHandle, Double> values) {
        return Values.value(values, self);
    }

    @Override
    public Node derivative(NodeHandle self, Set<NodeHandle> wrt, Map<NodeHandle, NodeHandle> derivatives) {
        return wrt.contains(self) ? Constant.ONE : Constant.ZERO;
    }

    @Override
    public String toString() {
        return "Variable";
    }
}
