package com.compgraph;

import com.compgraph.api.EvaluationListener;
import com.compgraph.core.Graph;
import com.compgraph.core.NodeHandle;
import com.compgraph.core.Subgraph;
import com.compgraph.dsl.GraphBuilder;
import com.compgraph.engine.Derivative;
import com.compgraph.engine.Differentiator;
import com.compgraph.engine.Evaluator;
import com.compgraph.util.CompositeEvaluationListener;
import com.compgraph.util.GraphExplain;

import java.util.Map;
import java.util.Set;

/**
 * compgraph -- expression DAGs with forward evaluation and symbolic
 * differentiation.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Graph:</b> an append-only arena of nodes addressed by
 * {@link NodeHandle}. Children always precede parents, so ascending handle order
 * is a topological order.</li>
 * <li><b>Evaluation:</b> one ascending pass computing every node once,
 * memoized in a value map.</li>
 * <li><b>Differentiation:</b> one ascending pass appending a derivative node
 * for every existing node. Derivative nodes are ordinary nodes.</li>
 * </ul>
 *
 * <p>
 * This class bundles a graph with an evaluator and a differentiator. Like the
 * graph it wraps, it is single-threaded.
 */
public final class CompGraph {
    private final GraphBuilder builder;
    private final Evaluator evaluator = new Evaluator();
    private final Differentiator differentiator = new Differentiator();
    private final CompositeEvaluationListener listeners = new CompositeEvaluationListener();

    private CompGraph(GraphBuilder builder) {
        this.builder = builder;
        this.evaluator.setListener(listeners);
    }

    /** Entry point: a new, empty computation graph. */
    public static CompGraph create() {
        return new CompGraph(GraphBuilder.create());
    }

    /** Wraps an existing graph. */
    public static CompGraph of(Graph graph) {
        return new CompGraph(GraphBuilder.on(graph));
    }

    /** Fluent construction API over this graph. */
    public GraphBuilder builder() {
        return builder;
    }

    public Graph graph() {
        return builder.graph();
    }

    /** Adds a listener notified on every evaluation pass. */
    public void addListener(EvaluationListener listener) {
        listeners.addForComposite(listener);
    }

    /** Evaluates every node currently in the graph. */
    public Map<NodeHandle, Double> evaluate(Map<NodeHandle, Double> bindings) {
        return evaluator.evaluate(graph(), bindings);
    }

    public Map<NodeHandle, Double> evaluate(Subgraph subgraph, Map<NodeHandle, Double> bindings) {
        return evaluator.evaluate(graph(), subgraph, bindings);
    }

    public Derivative differentiate(NodeHandle target, Set<NodeHandle> wrt) {
        return differentiator.differentiate(graph(), target, wrt);
    }

    public GraphExplain explain() {
        return new GraphExplain(graph());
    }
}
