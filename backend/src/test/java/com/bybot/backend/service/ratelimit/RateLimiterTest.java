package com.bybot.backend.service.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    @Test
    void alwaysHasDefaultBucket() {
        RateLimiter limiter = new RateLimiter(Map.of());

        assertThat(limiter.getLimits()).containsOnlyKeys(RateLimitKeys.DEFAULT);
        assertThat(limiter.getLimits().get(RateLimitKeys.DEFAULT).maxTokens()).isEqualTo(100.0);
    }

    @Test
    void exchangeDefaultsExposeAllCallClasses() {
        RateLimiter limiter = new RateLimiter(RateLimitKeys.exchangeDefaults());

        assertThat(limiter.getLimits()).containsKeys(
                RateLimitKeys.DEFAULT,
                RateLimitKeys.ORDER,
                RateLimitKeys.POSITION,
                RateLimitKeys.MARKET,
                RateLimitKeys.ACCOUNT);
    }

    @Test
    void unknownKeyIsChargedToDefaultBucketButCountedUnderItsOwnName() {
        RateLimiter limiter = new RateLimiter(Map.of(RateLimitKeys.DEFAULT, LimitDefinition.of(2, 3600)));

        assertThat(limiter.limit("unknown", 1, false, null)).isTrue();
        assertThat(limiter.limit("unknown", 1, false, null)).isTrue();
        assertThat(limiter.limit(RateLimitKeys.DEFAULT, 1, false, null)).isFalse();

        assertThat(limiter.getStats()).containsEntry("unknown", 2L).containsEntry(RateLimitKeys.DEFAULT, 1L);
        assertThat(limiter.getRejections()).containsOnlyKeys(RateLimitKeys.DEFAULT);
    }

    @Test
    void bucketsAreIndependent() {
        RateLimiter limiter = new RateLimiter(Map.of(
                RateLimitKeys.ORDER, LimitDefinition.of(1, 3600),
                RateLimitKeys.MARKET, LimitDefinition.of(1, 3600)));

        assertThat(limiter.limit(RateLimitKeys.ORDER, 1, false, null)).isTrue();
        assertThat(limiter.limit(RateLimitKeys.ORDER, 1, false, null)).isFalse();
        assertThat(limiter.limit(RateLimitKeys.MARKET, 1, false, null)).isTrue();
        assertThat(limiter.getRejections()).containsExactly(Map.entry(RateLimitKeys.ORDER, 1L));
    }

    @Test
    void addLimitReplacesBucketWithFreshCapacity() {
        RateLimiter limiter = new RateLimiter(Map.of(RateLimitKeys.ORDER, LimitDefinition.of(1, 3600)));
        limiter.limit(RateLimitKeys.ORDER, 1, false, null);

        limiter.addLimit(RateLimitKeys.ORDER, 4, Duration.ofSeconds(2));

        LimitSnapshot snapshot = limiter.getLimits().get(RateLimitKeys.ORDER);
        assertThat(snapshot.maxTokens()).isEqualTo(4.0);
        assertThat(snapshot.refillRate()).isEqualTo(2.0);
        assertThat(limiter.getTokenCount(RateLimitKeys.ORDER)).isEqualTo(4.0);
    }

    @Test
    void resetStatsClearsCountersOnly() {
        RateLimiter limiter = new RateLimiter(Map.of(RateLimitKeys.DEFAULT, LimitDefinition.of(1, 3600)));
        limiter.limit(RateLimitKeys.DEFAULT, 1, false, null);
        limiter.limit(RateLimitKeys.DEFAULT, 1, false, null);

        limiter.resetStats();

        assertThat(limiter.getStats()).isEmpty();
        assertThat(limiter.getRejections()).isEmpty();
        assertThat(limiter.getTokenCount(RateLimitKeys.DEFAULT)).isLessThan(1.0);
    }

    @Test
    void tokenCountOfUnknownKeyIsZero() {
        assertThat(new RateLimiter(Map.of()).getTokenCount("missing")).isZero();
    }
}
