package com.compgraph.util;

import com.compgraph.api.EvaluationListener;
import com.compgraph.core.NodeHandle;

import java.util.Locale;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that tracks timing statistics for evaluation passes.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per pass (in nanoseconds).</li>
 * <li><b>Throughput:</b> Total number of passes.</li>
 * <li><b>Workload:</b> Number of nodes evaluated in the last pass.</li>
 * <li><b>Errors:</b> Node errors, logged through an {@link ErrorRateLimiter}.</li>
 * </ul>
 */
public final class LatencyTrackingListener implements EvaluationListener {
    private static final Logger log = LogManager.getLogger(LatencyTrackingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long passStartNanos;
    private long totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;

    @Getter
    private long lastLatencyNanos;
    @Getter
    private int lastNodesEvaluated;
    @Getter
    private long totalPasses;
    @Getter
    private long totalErrors;

    @Override
    public void onPassStart(long pass, int nodeCount) {
        passStartNanos = System.nanoTime();
    }

    @Override
    public void onNodeEvaluated(long pass, NodeHandle handle, String kind, double value, long durationNanos) {
        // Per-pass timing only
    }

    @Override
    public void onNodeError(long pass, NodeHandle handle, String kind, Throwable error) {
        totalErrors++;
        errLimiter.log(String.format(Locale.ROOT, "Evaluation error at node %s (%s): %s",
                handle, kind, error.getMessage()), null);
    }

    @Override
    public void onPassEnd(long pass, int nodesEvaluated) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        lastNodesEvaluated = nodesEvaluated;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public double avgLatencyNanos() {
        return totalPasses > 0 ? (double) totalLatencyNanos / totalPasses : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalPasses = 0;
        totalErrors = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-14s | %10s | %10s | %10s | %10s%n",
                "Metric", "Value", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("----------------------------------------------------------------------\n");
        sb.append(String.format(Locale.ROOT, "%-14s | %10d | %10.2f | %10.2f | %10.2f%n",
                "Total Passes",
                totalPasses,
                avgLatencyNanos() / 1000.0,
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        return sb.toString();
    }
}
