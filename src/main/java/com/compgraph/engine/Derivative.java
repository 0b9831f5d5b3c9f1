package com.compgraph.engine;

import com.compgraph.core.NodeHandle;
import com.compgraph.core.Subgraph;

/**
 * Result of a differentiation pass.
 *
 * @param handle   The derivative node of the requested target.
 * @param subgraph Every node appended by the pass, ascending. Evaluating it
 *                 yields the value of {@code handle}. Graphs of constants,
 *                 variables and sums need no bindings; kinds whose rule reads
 *                 original children (Product) need the values of the original
 *                 pass as bindings.
 */
public record Derivative(NodeHandle handle, Subgraph subgraph) {
}
