package com.compgraph.util;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often an error is logged.
 *
 * Repeated evaluations of a broken graph report the same failure on every pass;
 * this keeps one line per interval.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private long lastLogTime;
    private boolean logged;
    private long suppressed;

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at error level unless a message went out within the interval.
     *
     * @return true if the message was logged.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        if (logged && now - lastLogTime < minIntervalNanos) {
            suppressed++;
            return false;
        }
        if (suppressed > 0)
            logger.error("{} ({} similar errors suppressed)", message, suppressed, t);
        else
            logger.error(message, t);
        lastLogTime = now;
        logged = true;
        suppressed = 0;
        return true;
    }

    /** Messages dropped since the last one logged. */
    public long suppressed() {
        return suppressed;
    }
}
