package com.compgraph.core;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node in the computation graph.
 *
 * This interface is the per-kind computation contract. Every kind of node --
 * constant, variable, sum, or anything added later -- implements it, and the
 * graph-level algorithms (evaluation, differentiation) only ever talk to nodes
 * through it. Adding a kind therefore never touches {@link Graph} or the
 * engine.
 *
 * Key Responsibilities:
 *
 * 1. Value: value() computes this node's scalar from values already computed
 * for its children.
 *
 * 2. Derivative: derivative() builds a new, unattached node representing the
 * partial derivative of this node.
 *
 * 3. Structure: children() exposes the handles this node reads, for
 * diagnostics and for the append-order check.
 *
 * Both computations must be pure. A node does not know its own handle; it is
 * passed in by the caller.
 */
public interface Node {

    /**
     * Computes this node's value.
     *
     * Ordering Contract:
     * values must already contain an entry for every child of this node (and,
     * for input kinds like Variable, for the node itself). The evaluator
     * guarantees this by visiting handles in ascending order.
     *
     * @param self   The handle of this node.
     * @param values Values computed or bound so far.
     * @return The scalar value of this node.
     */
    double value(NodeHandle self, Map<NodeHandle, Double> values);

    /**
     * Builds the derivative of this node with respect to the selected
     * variables.
     *
     * The returned node is not yet part of any graph. It may reference this
     * node's children and their derivatives (looked up in derivatives), all of
     * which already exist in the graph by the time the result is appended.
     *
     * @param self        The handle of this node.
     * @param wrt         Variables to differentiate with respect to.
     * @param derivatives Mapping from each earlier handle to its derivative's
     *                    handle.
     * @return A new, unattached derivative node.
     */
    Node derivative(NodeHandle self, Set<NodeHandle> wrt, Map<NodeHandle, NodeHandle> derivatives);

    /**
     * Handles this node reads its inputs from, in declaration order. Duplicates
     * are allowed (e.g. x + x).
     */
    default List<NodeHandle> children() {
        return List.of();
    }

    /** Short display name of this node's kind. */
    default String kind() {
        return getClass().getSimpleName();
    }
}
