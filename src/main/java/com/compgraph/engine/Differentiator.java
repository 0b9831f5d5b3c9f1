package com.compgraph.engine;

import com.compgraph.core.Graph;
import com.compgraph.core.Node;
import com.compgraph.core.NodeHandle;
import com.compgraph.core.Subgraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Symbolic differentiation by graph transformation.
 *
 * Algorithm Details:
 * One forward pass over every node that exists when the pass starts, in
 * ascending handle order:
 *
 * 1. Ask the node for its derivative, passing the variables selected and the
 * derivative map built so far. Children precede parents, so every child's
 * derivative is already in the map.
 * 2. Append the returned node to the same graph.
 * 3. Record old handle -> new handle.
 *
 * Memoization:
 * Each original handle maps to exactly one derivative node. A child shared by
 * many parents is differentiated once and referenced by all of them, which
 * keeps the pass linear on diamond-shaped DAGs.
 *
 * Known Inefficiency:
 * Every node is differentiated, not just the ancestors of the target. This
 * avoids a separate reachability pass at the cost of derivative nodes for
 * unrelated branches.
 *
 * Derivative nodes are ordinary nodes: the returned subgraph can be evaluated
 * with the Evaluator, or differentiated again.
 */
@Log4j2
public final class Differentiator {

    /**
     * Differentiates {@code target} with respect to the variables in
     * {@code wrt}.
     *
     * @param graph  The graph to extend. Grows by exactly its current size.
     * @param target The node to differentiate.
     * @param wrt    Variable handles selected. An empty set yields an
     *               all-zero derivative.
     * @return The target's derivative handle and the subgraph of all appended
     *         nodes.
     * @throws IllegalArgumentException if the target is not in the graph.
     */
    public Derivative differentiate(Graph graph, NodeHandle target, Set<NodeHandle> wrt) {
        final int n = graph.size();
        if (target.index() < 0 || target.index() >= n)
            throw new IllegalArgumentException("Unknown target " + target + " for graph of size " + n);

        final long start = System.nanoTime();
        Map<NodeHandle, NodeHandle> derivatives = new HashMap<>(n * 2);
        List<NodeHandle> appended = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            NodeHandle old = graph.handle(i);
            Node d = graph.node(old).derivative(old, wrt, derivatives);
            NodeHandle fresh = graph.append(d);
            derivatives.put(old, fresh);
            appended.add(fresh);
        }

        if (log.isDebugEnabled())
            log.debug("Differentiated {} wrt {}: {} nodes appended in {} us", target, wrt, n,
                    (System.nanoTime() - start) / 1000);
        return new Derivative(derivatives.get(target), Subgraph.of(appended));
    }
}
