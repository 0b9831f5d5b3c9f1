package com.compgraph.node;

import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.core.Values;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A sum of product terms: t0 + t1 + ... where each term is a product of
 * handles.
 *
 * This is what the product rule produces. It is closed under differentiation
 * (the derivative of a sum of products is again a sum of products), which lets
 * products be differentiated any number of times.
 *
 * An empty term list evaluates to 0; an empty term evaluates to 1.
 */
public final class SumOfProducts implements Node {
    private final List<List<NodeHandle>> terms;
    private final List<NodeHandle> children;

    public SumOfProducts(List<List<NodeHandle>> terms) {
        List<List<NodeHandle>> copy = new ArrayList<>(terms.size());
        Set<NodeHandle> distinct = new LinkedHashSet<>();
        for (List<NodeHandle> term : terms) {
            copy.add(List.copyOf(term));
            distinct.addAll(term);
        }
        this.terms = List.copyOf(copy);
        this.children = List.copyOf(distinct);
    }

    /**
     * Expands the product rule over one product of factors: one term per
     * factor, with that factor replaced by its derivative.
     */
    static List<List<NodeHandle>> productRule(List<NodeHandle> factors, Map<NodeHandle, NodeHandle> derivatives) {
        List<List<NodeHandle>> out = new ArrayList<>(factors.size());
        for (int i = 0; i < factors.size(); i++) {
            List<NodeHandle> term = new ArrayList<>(factors.size());
            term.add(Values.derivative(derivatives, factors.get(i)));
            for (int j = 0; j < factors.size(); j++) {
                if (j != i)
                    term.add(factors.get(j));
            }
            out.add(term);
        }
        return out;
    }

    @Override
    public double value(NodeHandle self, Map<NodeHandle, Double> values) {
        double total = 0.0;
        for (List<NodeHandle> term : terms) {
            double p = 1.0;
            for (NodeHandle factor : term)
                p *= Values.value(values, factor);
            total += p;
        }
        return total;
    }

    @Override
    public Node derivative(NodeHandle self, Set<NodeHandle> wrt, Map<NodeHandle, NodeHandle> derivatives) {
        List<List<NodeHandle>> out = new ArrayList<>();
        for (List<NodeHandle> term : terms)
            out.addAll(productRule(term, derivatives));
        return new SumOfProducts(out);
    }

    /** Distinct handles referenced by any term, in first-seen order. */
    @Override
    public List<NodeHandle> children() {
        return children;
    }

    public List<List<NodeHandle>> terms() {
        return terms;
    }

    @Override
    public String toString() {
        return "SumOfProducts" + terms;
    }
}
