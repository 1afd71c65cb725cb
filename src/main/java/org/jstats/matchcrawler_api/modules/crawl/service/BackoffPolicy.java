package org.jstats.matchcrawler_api.modules.crawl.service;

import java.time.Duration;

/**
 * Exponential retry delay: {@code min(base * 2^(attempts-1), max)}.
 */
final class BackoffPolicy {

    private final Duration base;
    private final Duration max;

    BackoffPolicy(Duration base, Duration max) {
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff needs 0 <= base <= max, got " + base + " / " + max);
        }
        this.base = base;
        this.max = max;
    }

    /**
     * @param attempts failures so far, at least 1
     */
    Duration delay(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        // 2^30 already exceeds any sane cap
        if (exponent >= 30) {
            return max;
        }
        long millis = base.toMillis() << exponent;
        if (millis < 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }
}
