package com.compgraph.engine;

import com.compgraph.core.NodeHandle;

/**
 * Raised when a node fails during an evaluation pass.
 *
 * The core has no recoverable domain errors, so this always signals a broken
 * caller contract (typically an unbound variable). The original failure is
 * kept as the cause.
 */
public class EvaluationException extends RuntimeException {
    private final transient NodeHandle handle;

    public EvaluationException(NodeHandle handle, String kind, Throwable cause) {
        super("Evaluation failed at node " + handle + " (" + kind + "): " + cause.getMessage(), cause);
        this.handle = handle;
    }

    /** The handle of the node that failed. */
    public NodeHandle handle() {
        return handle;
    }
}
