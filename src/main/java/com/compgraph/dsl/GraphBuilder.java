package com.compgraph.dsl;

import com.compgraph.core.Graph;
import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.node.Constant;
import com.compgraph.node.Product;
import com.compgraph.node.Sum;
import com.compgraph.node.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph Builder -- fluent construction API.
 *
 * Every call appends to the underlying {@link Graph} immediately; there is no
 * separate build step, since the graph is valid after every append.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create();
 * 2. Define inputs: Expr x = g.variable(); Expr y = g.variable();
 * 3. Combine: Expr z = x.times(2.0).plus(y);
 * 4. Hand z.handle() to the Evaluator or Differentiator along with g.graph().
 *
 * Expressions from one builder cannot be mixed into another; doing so fails
 * with IllegalArgumentException.
 */
public final class GraphBuilder {
    private final Graph graph;

    private GraphBuilder(Graph graph) {
        this.graph = graph;
    }

    /** Creates a builder over a new, empty graph. */
    public static GraphBuilder create() {
        return new GraphBuilder(new Graph());
    }

    /** Creates a builder that appends to an existing graph. */
    public static GraphBuilder on(Graph graph) {
        return new GraphBuilder(graph);
    }

    public Graph graph() {
        return graph;
    }

    // ── Leaves ───────────────────────────────────────────────────

    /** Appends a constant. */
    public Expr constant(double value) {
        return append(new Constant(value));
    }

    /** Appends a variable. Bind its value under {@code expr.handle()}. */
    public Expr variable() {
        return append(new Variable());
    }

    // ── Combinators ─────────────────────────────────────────────

    public Expr sum(Expr... terms) {
        return append(new Sum(handles(terms)));
    }

    public Expr product(Expr... factors) {
        return append(new Product(handles(factors)));
    }

    /**
     * Appends a node of any kind. Use this for custom node kinds.
     */
    public Expr append(Node node) {
        return new Expr(this, graph.append(node));
    }

    /** Wraps a handle already in this builder's graph. */
    public Expr wrap(NodeHandle handle) {
        if (!graph.contains(handle))
            throw new IllegalArgumentException("Handle " + handle + " is not in this graph");
        return new Expr(this, handle);
    }

    private List<NodeHandle> handles(Expr[] exprs) {
        List<NodeHandle> out = new ArrayList<>(exprs.length);
        for (Expr e : exprs) {
            if (e.builder() != this)
                throw new IllegalArgumentException("Expression " + e + " belongs to a different graph");
            out.add(e.handle());
        }
        return out;
    }
}
