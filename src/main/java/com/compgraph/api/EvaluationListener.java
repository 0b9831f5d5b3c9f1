package com.compgraph.api;

import com.compgraph.core.NodeHandle;

/**
 * Observability interface for monitoring evaluation passes.
 *
 * Implementations can be registered with the Evaluator to receive callbacks
 * during a pass. This is the hook for:
 *
 * - Profiling: measuring per-pass and per-node latency.
 * - Debugging: tracing which nodes were computed and to what value.
 * - Validation: catching NaN results or failing nodes.
 *
 * Performance Warning:
 * Callbacks run inside the evaluation loop. Keep them lightweight.
 */
public interface EvaluationListener {

    /**
     * Called immediately before a pass begins.
     *
     * @param pass      The pass number on this evaluator, starting at 1.
     * @param nodeCount Number of handles the pass will visit.
     */
    void onPassStart(long pass, int nodeCount);

    /**
     * Called after a node's value has been computed and recorded.
     *
     * @param pass          Current pass number.
     * @param handle        The node's handle.
     * @param kind          The node's kind, as reported by Node.kind().
     * @param value         The computed value.
     * @param durationNanos Time spent computing the node.
     */
    void onNodeEvaluated(long pass, NodeHandle handle, String kind, double value, long durationNanos);

    /**
     * Called when a node fails to evaluate, or evaluates to NaN.
     *
     * @param pass   Current pass number.
     * @param handle The failing node.
     * @param kind   The node's kind.
     * @param error  The exception raised (or a synthetic one for NaN).
     */
    void onNodeError(long pass, NodeHandle handle, String kind, Throwable error);

    /**
     * Called when the pass is over, whether it completed or failed.
     *
     * @param pass           Current pass number.
     * @param nodesEvaluated Number of nodes successfully evaluated.
     */
    void onPassEnd(long pass, int nodesEvaluated);
}
