package com.compgraph.node;

import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.core.Values;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Product of any number of children. An empty product is 1.
 *
 * Differentiation applies the product rule:
 * d(c0 * c1 * ... * cn) = sum over i of d(ci) * (product of cj, j != i).
 * The result is a {@link SumOfProducts} mixing derivative handles with this
 * node's original children. Both precede the derivative node, so the
 * ascending-order invariant holds.
 */
public final class Product implements Node {
    private final List<NodeHandle> children;

    public Product(List<NodeHandle> children) {
        this.children = List.copyOf(children);
    }

    public static Product of(NodeHandle... children) {
        return new Product(List.of(children));
    }

    @Override
    public double value(NodeHandle self, Map<NodeHandle, Double> values) {
        double result = 1.0;
        for (NodeHandle child : children)
            result *= Values.value(values, child);
        return result;
    }

    @Override
    public Node derivative(NodeHandle self, Set<NodeHandle> wrt, Map<NodeHandle, NodeHandle> derivatives) {
        return new SumOfProducts(SumOfProducts.productRule(children, derivatives));
    }

    @Override
    public List<NodeHandle> children() {
        return children;
    }

    @Override
    public String toString() {
        return "Product" + children;
    }
}
