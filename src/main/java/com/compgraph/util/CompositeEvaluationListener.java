package com.compgraph.util;

import com.compgraph.api.EvaluationListener;
import com.compgraph.core.NodeHandle;

import java.util.Arrays;

/**
 * Fans out {@link EvaluationListener} callbacks to several listeners, in
 * registration order.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private EvaluationListener[] listeners = new EvaluationListener[0];

    public void addForComposite(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPassStart(long pass, int nodeCount) {
        for (EvaluationListener l : listeners)
            l.onPassStart(pass, nodeCount);
    }

    @Override
    public void onNodeEvaluated(long pass, NodeHandle handle, String kind, double value, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onNodeEvaluated(pass, handle, kind, value, durationNanos);
    }

    @Override
    public void onNodeError(long pass, NodeHandle handle, String kind, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onNodeError(pass, handle, kind, error);
    }

    @Override
    public void onPassEnd(long pass, int nodesEvaluated) {
        for (EvaluationListener l : listeners)
            l.onPassEnd(pass, nodesEvaluated);
    }
}
