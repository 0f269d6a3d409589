package com.bybot.backend.service.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Named registry of {@link TokenBucket}s, one per call class.
 *
 * <p>A {@value RateLimitKeys#DEFAULT} bucket always exists; calls with an unknown key are charged to it.
 */
@Slf4j
public class RateLimiter {

    static final LimitDefinition FALLBACK_DEFAULT = LimitDefinition.of(100, 10);

    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> calls = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> rejections = new ConcurrentHashMap<>();

    public RateLimiter(Map<String, LimitDefinition> limits) {
        limits.forEach(this::addLimit);
        if (!buckets.containsKey(RateLimitKeys.DEFAULT)) {
            addLimit(RateLimitKeys.DEFAULT, FALLBACK_DEFAULT);
        }
        log.info("Rate limiter initialized with buckets {}", new TreeMap<>(buckets).keySet());
    }

    public void addLimit(String key, double maxTokens, Duration interval) {
        addLimit(key, new LimitDefinition(maxTokens, interval));
    }

    public void addLimit(String key, LimitDefinition definition) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Rate limit key must not be blank");
        }
        buckets.put(key, new TokenBucket(definition.maxTokens(), definition.refillRate()));
        log.debug("Rate limit '{}' set to {} tokens per {}", key, definition.maxTokens(), definition.interval());
    }

    public boolean limit(String key) {
        return limit(key, 1, true, null);
    }

    public boolean limit(String key, double tokens, boolean block, Duration timeout) {
        String statsKey = key == null ? RateLimitKeys.DEFAULT : key;
        TokenBucket bucket = buckets.get(statsKey);
        if (bucket == null) {
            log.warn("Rate limit key '{}' not found, using default", statsKey);
            bucket = buckets.get(RateLimitKeys.DEFAULT);
        }
        calls.computeIfAbsent(statsKey, ignored -> new AtomicLong()).incrementAndGet();
        boolean granted = bucket.consume(tokens, block, timeout);
        if (!granted) {
            rejections.computeIfAbsent(statsKey, ignored -> new AtomicLong()).incrementAndGet();
        }
        return granted;
    }

    public double getTokenCount(String key) {
        TokenBucket bucket = buckets.get(key);
        return bucket == null ? 0.0 : bucket.getTokenCount();
    }

    public Map<String, LimitSnapshot> getLimits() {
        Map<String, LimitSnapshot> limits = new TreeMap<>();
        buckets.forEach((key, bucket) -> limits.put(key,
                new LimitSnapshot(bucket.getMaxTokens(), bucket.getRefillRate(), bucket.getTokenCount())));
        return limits;
    }

    public Map<String, Long> getStats() {
        return copy(calls);
    }

    public Map<String, Long> getRejections() {
        return copy(rejections);
    }

    public void resetStats() {
        calls.clear();
        rejections.clear();
    }

    private static Map<String, Long> copy(Map<String, AtomicLong> counters) {
        Map<String, Long> result = new LinkedHashMap<>();
        new TreeMap<>(counters).forEach((key, value) -> result.put(key, value.get()));
        return result;
    }
}
