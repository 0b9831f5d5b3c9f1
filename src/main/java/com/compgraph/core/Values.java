package com.compgraph.core;

import java.util.Map;

/**
 * Contract-checked lookups used by node implementations.
 *
 * A missing entry means the caller broke the ordering contract (or forgot to
 * bind a variable). We fail fast with the offending handle rather than let a
 * null unbox into a NullPointerException somewhere downstream.
 */
public final class Values {
    private Values() {
        // Utility class
    }

    /**
     * Returns the value recorded for a handle.
     *
     * @throws IllegalStateException if no value has been computed or bound.
     */
    public static double value(Map<NodeHandle, Double> values, NodeHandle handle) {
        Double v = values.get(handle);
        if (v == null)
            throw new IllegalStateException("No value for node " + handle);
        return v;
    }

    /**
     * Returns the derivative handle recorded for a handle.
     *
     * @throws IllegalStateException if the node has not been differentiated yet.
     */
    public static NodeHandle derivative(Map<NodeHandle, NodeHandle> derivatives, NodeHandle handle) {
        NodeHandle d = derivatives.get(handle);
        if (d == null)
            throw new IllegalStateException("No derivative for node " + handle);
        return d;
    }
}
