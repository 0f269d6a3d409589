package com.bybot.backend.service.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily refilled token bucket.
 *
 * <p>The lock is held across the wait of a blocking {@link #consume(double, boolean, Duration)},
 * so consumers of one bucket are fully serialized and the token accounting stays exact.
 */
@Slf4j
public class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double maxTokens;
    private final double refillRate;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(double maxTokens, double refillRate) {
        this(maxTokens, refillRate, maxTokens);
    }

    public TokenBucket(double maxTokens, double refillRate, double initialTokens) {
        if (!(maxTokens > 0)) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (!(refillRate > 0)) {
            throw new IllegalArgumentException("refillRate must be positive: " + refillRate);
        }
        if (initialTokens < 0 || initialTokens > maxTokens) {
            throw new IllegalArgumentException("initialTokens must be within [0, " + maxTokens + "]: " + initialTokens);
        }
        this.maxTokens = maxTokens;
        this.refillRate = refillRate;
        this.tokens = initialTokens;
        this.lastRefillNanos = System.nanoTime();
    }

    public boolean consume() {
        return consume(1, true, null);
    }

    public boolean consume(double requested) {
        return consume(requested, true, null);
    }

    /**
     * @param requested tokens to take, must be positive
     * @param block     wait for the refill when the bucket is short
     * @param timeout   longest acceptable wait, {@code null} for unbounded
     * @return {@code true} when the tokens were taken
     */
    public boolean consume(double requested, boolean block, Duration timeout) {
        if (!(requested > 0)) {
            throw new IllegalArgumentException("requested tokens must be positive: " + requested);
        }
        long startNanos = System.nanoTime();
        lock.lock();
        try {
            refill();
            if (tokens >= requested) {
                tokens -= requested;
                return true;
            }
            if (!block) {
                log.debug("Rate limit hit, not enough tokens ({}/{})", tokens, requested);
                return false;
            }
            if (requested > maxTokens) {
                log.warn("Rate limit request of {} tokens exceeds bucket capacity {}", requested, maxTokens);
                return false;
            }
            double waitSeconds = (requested - tokens) / refillRate;
            if (timeout != null && waitSeconds > toSeconds(timeout)) {
                log.debug("Rate limit hit, wait time {}s exceeds timeout {}s",
                        String.format("%.2f", waitSeconds), String.format("%.2f", toSeconds(timeout)));
                return false;
            }
            log.debug("Rate limit hit, waiting {}s for tokens to refill", String.format("%.2f", waitSeconds));
            try {
                TimeUnit.NANOSECONDS.sleep((long) Math.ceil(waitSeconds * NANOS_PER_SECOND));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Interrupted while waiting for rate limit tokens");
                return false;
            }
            refill();
            tokens = Math.max(0.0, tokens - requested);
            log.debug("Resumed after waiting {}s for rate limit",
                    String.format("%.2f", (System.nanoTime() - startNanos) / NANOS_PER_SECOND));
            return true;
        } finally {
            lock.unlock();
        }
    }

    public double getTokenCount() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public double getMaxTokens() {
        return maxTokens;
    }

    public double getRefillRate() {
        return refillRate;
    }

    private void refill() {
        long now = System.nanoTime();
        double added = (now - lastRefillNanos) / NANOS_PER_SECOND * refillRate;
        if (added > 0) {
            tokens = Math.min(maxTokens, tokens + added);
            lastRefillNanos = now;
        }
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / NANOS_PER_SECOND;
    }
}
