package com.trading.flow.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits error logging to one line per key per interval.
 *
 * A node that fails in every run of a busy workflow would otherwise flood the
 * log; keying by node name keeps one noisy node from hiding the others.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final ConcurrentHashMap<String, AtomicLong> lastLogTimes = new ConcurrentHashMap<>();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * @return true if the message was logged, false if it was throttled.
     */
    public boolean log(String key, String message, Throwable t) {
        long now = System.nanoTime();
        AtomicLong lastLogTime = lastLogTimes.computeIfAbsent(key, k -> new AtomicLong(now - minIntervalNanos - 1));
        long last = lastLogTime.get();
        // Check-and-set so only one thread logs per key and interval
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            logger.error(message + " (Throttled)", t);
            return true;
        }
        return false;
    }
}
