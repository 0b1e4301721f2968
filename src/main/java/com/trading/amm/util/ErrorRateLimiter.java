package com.trading.amm.util;

import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of failure logging per key.
 * A bridge that keeps throwing on every quote produces one warning per interval
 * instead of one per call; different keys are throttled independently.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final Map<String, AtomicLong> lastLogTime = new ConcurrentHashMap<>();
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** Logs at WARN unless {@code key} already logged within the interval. */
    public boolean log(String key, String message, Throwable t) {
        AtomicLong last = lastLogTime.computeIfAbsent(key, k -> new AtomicLong(Long.MIN_VALUE));
        long now = System.nanoTime();
        long prev = last.get();
        if (prev == Long.MIN_VALUE || now - prev > minIntervalNanos) {
            // Check-and-set so only one thread logs per interval
            if (last.compareAndSet(prev, now)) {
                logger.warn(message + " (Throttled)", t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
