package com.neurosim.graph.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of repeated warnings and errors.
 * Useful when the same condition recurs on every trial (a mechanism that
 * never converges, for instance) and would otherwise flood the log.
 * Messages dropped within an interval are counted and reported with the
 * next one that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    public void warn(String message) {
        if (acquire())
            logger.warn(decorate(message));
    }

    public void error(String message, Throwable t) {
        if (acquire())
            logger.error(decorate(message), t);
    }

    /** Number of messages dropped since the last one logged. */
    public long suppressedCount() {
        return suppressed.get();
    }

    private boolean acquire() {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // Only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now))
                return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    private String decorate(String message) {
        long dropped = suppressed.getAndSet(0);
        return dropped == 0 ? message : message + " (" + dropped + " similar messages throttled)";
    }
}
