package com.umitunal.jobqueue.config;

import java.time.Duration;

/**
 * Delay an operation waits before its next attempt, given how many
 * failures its record has accumulated so far.
 */
@FunctionalInterface
public interface BackoffPolicy {

    Duration DEFAULT_INITIAL = Duration.ofMillis(100);
    Duration DEFAULT_MAX = Duration.ofMinutes(15);

    Duration retryInterval(long failureCount);

    /**
     * 100 ms doubling per failure, capped at 15 minutes.
     */
    static BackoffPolicy exponential() {
        return exponential(DEFAULT_INITIAL, DEFAULT_MAX);
    }

    static BackoffPolicy exponential(Duration initial, Duration max) {
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("invalid backoff bounds: " + initial + " / " + max);
        }
        long initialMillis = initial.toMillis();
        long maxMillis = max.toMillis();
        return failureCount -> {
            if (failureCount <= 1) {
                return Duration.ofMillis(initialMillis);
            }
            // 2^62 overflows once multiplied; anything past that is the cap anyway
            int shift = (int) Math.min(failureCount - 1, 62);
            long factor = 1L << shift;
            if (initialMillis != 0 && factor > maxMillis / initialMillis) {
                return Duration.ofMillis(maxMillis);
            }
            return Duration.ofMillis(Math.min(initialMillis * factor, maxMillis));
        };
    }

    static BackoffPolicy fixed(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("negative delay: " + delay);
        }
        return failureCount -> delay;
    }
}
