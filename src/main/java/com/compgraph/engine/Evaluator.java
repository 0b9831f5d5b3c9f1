package com.compgraph.engine;

import com.compgraph.api.EvaluationListener;
import com.compgraph.core.Graph;
import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.core.Subgraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Forward evaluation over a subgraph.
 *
 * Algorithm Details:
 *
 * 1. Seed: copy the caller's bindings (usually Variable handles mapped to
 * numbers) into a fresh value map. The caller's map is never mutated.
 *
 * 2. Iterate: visit the subgraph's handles in ascending order. Because every
 * node only references earlier handles, this is a topological order, so each
 * node's children have values by the time it is visited.
 *
 * 3. Record: compute each node's value and put it into the map, overwriting
 * any pre-seeded entry (last write wins).
 *
 * Each node is computed exactly once per pass, however many parents share it,
 * so the cost is linear in the subgraph size even when the number of paths
 * through the DAG is exponential.
 *
 * Fail Fast:
 * If a node throws (an unbound variable, a foreign handle), the pass stops,
 * the listener is notified, and the failure is rethrown as an
 * EvaluationException naming the node. There is no partial result.
 */
public final class Evaluator {
    private static final Logger log = LogManager.getLogger(Evaluator.class);

    private EvaluationListener listener;
    private long passes;

    public void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    /** Evaluates every node currently in the graph. */
    public Map<NodeHandle, Double> evaluate(Graph graph, Map<NodeHandle, Double> bindings) {
        return evaluate(graph, graph.asSubgraph(), bindings);
    }

    /**
     * Runs one evaluation pass.
     *
     * @param graph    The graph owning the subgraph's handles.
     * @param subgraph Handles to compute, ascending.
     * @param bindings Initial values, typically for Variable nodes.
     * @return The accumulated value map: the bindings plus an entry for every
     *         handle in the subgraph.
     * @throws EvaluationException if any node fails to evaluate.
     */
    public Map<NodeHandle, Double> evaluate(Graph graph, Subgraph subgraph, Map<NodeHandle, Double> bindings) {
        final long pass = ++passes;
        final EvaluationListener l = this.listener;
        final boolean hasListener = l != null;
        final long start = System.nanoTime();

        Map<NodeHandle, Double> values = new HashMap<>(Math.max(16, (bindings.size() + subgraph.size()) * 2));
        values.putAll(bindings);

        if (hasListener)
            l.onPassStart(pass, subgraph.size());

        int evaluated = 0;
        try {
            for (NodeHandle handle : subgraph) {
                Node node = graph.node(handle);

                long nodeStart = 0;
                if (hasListener)
                    nodeStart = System.nanoTime();

                double value;
                try {
                    value = node.value(handle, values);
                } catch (RuntimeException e) {
                    if (hasListener)
                        l.onNodeError(pass, handle, node.kind(), e);
                    log.error("Evaluation pass {} failed at node {} ({})", pass, handle, node.kind(), e);
                    throw new EvaluationException(handle, node.kind(), e);
                }

                values.put(handle, value);
                evaluated++;

                if (hasListener) {
                    l.onNodeEvaluated(pass, handle, node.kind(), value, System.nanoTime() - nodeStart);
                    if (Double.isNaN(value))
                        l.onNodeError(pass, handle, node.kind(), new ArithmeticException("Node evaluated to NaN"));
                }
            }
        } finally {
            if (hasListener)
                l.onPassEnd(pass, evaluated);
        }

        if (log.isDebugEnabled())
            log.debug("Evaluation pass {}: {} nodes in {} us", pass, evaluated, (System.nanoTime() - start) / 1000);
        return values;
    }

    /** Number of passes started by this evaluator. */
    public long passes() {
        return passes;
    }
}
