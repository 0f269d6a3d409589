package com.bybot.backend.service.ratelimit;

import java.time.Duration;

/**
 * {@code maxTokens} calls per {@code interval}; the bucket refills at {@code maxTokens / interval}.
 */
public record LimitDefinition(double maxTokens, Duration interval) {

    public LimitDefinition {
        if (!(maxTokens > 0)) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    public static LimitDefinition of(double maxTokens, long intervalSeconds) {
        return new LimitDefinition(maxTokens, Duration.ofSeconds(intervalSeconds));
    }

    public double refillRate() {
        return maxTokens / (interval.toNanos() / 1_000_000_000.0);
    }
}
