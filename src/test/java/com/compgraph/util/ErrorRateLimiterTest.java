package com.compgraph.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testSuppressesWithinInterval() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        assertTrue(limiter.log("first", null));
        assertFalse(limiter.log("second", null));
        assertFalse(limiter.log("third", null));
        assertEquals(2, limiter.suppressed());
    }

    @Test
    public void testZeroIntervalLogsEverything() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 0);
        assertTrue(limiter.log("first", null));
        assertTrue(limiter.log("second", null));
        assertEquals(0, limiter.suppressed());
    }
}
