package com.compgraph.dsl;

import com.compgraph.core.NodeHandle;

/**
 * A node handle paired with the builder that created it, so expressions can be
 * combined with infix-style calls: {@code x.times(2.0).plus(y)}.
 *
 * Each call appends a new node; nothing is simplified or cached. Reusing the
 * same Expr in several places shares the node, which is what keeps DAGs small.
 */
public final class Expr {
    private final GraphBuilder builder;
    private final NodeHandle handle;

    Expr(GraphBuilder builder, NodeHandle handle) {
        this.builder = builder;
        this.handle = handle;
    }

    public NodeHandle handle() {
        return handle;
    }

    GraphBuilder builder() {
        return builder;
    }

    /** this + others. */
    public Expr plus(Expr... others) {
        Expr[] terms = new Expr[others.length + 1];
        terms[0] = this;
        System.arraycopy(others, 0, terms, 1, others.length);
        return builder.sum(terms);
    }

    /** this + c. Appends the constant as its own node. */
    public Expr plus(double c) {
        return builder.sum(this, builder.constant(c));
    }

    /** this * others. */
    public Expr times(Expr... others) {
        Expr[] factors = new Expr[others.length + 1];
        factors[0] = this;
        System.arraycopy(others, 0, factors, 1, others.length);
        return builder.product(factors);
    }

    /** this * c. Appends the constant as its own node. */
    public Expr times(double c) {
        return builder.product(this, builder.constant(c));
    }

    @Override
    public String toString() {
        return "Expr" + handle;
    }
}
