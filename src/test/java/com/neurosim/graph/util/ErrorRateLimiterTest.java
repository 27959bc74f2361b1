package com.neurosim.graph.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testFirstMessagePassesRepeatsAreCounted() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        limiter.warn("first");
        assertEquals(0, limiter.suppressedCount());
        limiter.warn("second");
        limiter.error("third", new IllegalStateException());
        assertEquals(2, limiter.suppressedCount());
    }
}
