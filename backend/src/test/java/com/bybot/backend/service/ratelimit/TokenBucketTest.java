package com.bybot.backend.service.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketTest {

    @Test
    void startsFullAndDrainsOneTokenPerCall() {
        TokenBucket bucket = new TokenBucket(3, 0.001);

        assertThat(bucket.consume(1, false, null)).isTrue();
        assertThat(bucket.consume(1, false, null)).isTrue();
        assertThat(bucket.consume(1, false, null)).isTrue();
        assertThat(bucket.consume(1, false, null)).isFalse();
        assertThat(bucket.getTokenCount()).isLessThan(1.0);
    }

    @Test
    void nonBlockingRejectionLeavesTokensUntouched() {
        TokenBucket bucket = new TokenBucket(10, 0.001, 2);

        assertThat(bucket.consume(5, false, null)).isFalse();
        assertThat(bucket.getTokenCount()).isGreaterThanOrEqualTo(2.0).isLessThan(2.1);
    }

    @Test
    void blockingCallWaitsForRefill() {
        TokenBucket bucket = new TokenBucket(1, 20, 0);

        long start = System.nanoTime();
        assertThat(bucket.consume(1, true, Duration.ofSeconds(2))).isTrue();
        long waitedMillis = (System.nanoTime() - start) / 1_000_000;

        assertThat(waitedMillis).isGreaterThanOrEqualTo(30);
    }

    @Test
    void blockingCallGivesUpWhenWaitExceedsTimeout() {
        TokenBucket bucket = new TokenBucket(10, 1, 2);

        long start = System.nanoTime();
        assertThat(bucket.consume(5, true, Duration.ofMillis(100))).isFalse();
        long waitedMillis = (System.nanoTime() - start) / 1_000_000;

        assertThat(waitedMillis).isLessThan(1000);
        assertThat(bucket.getTokenCount()).isGreaterThanOrEqualTo(2.0).isLessThan(3.0);
    }

    @Test
    void refillBelowCapacityGrowsWithElapsedTime() throws InterruptedException {
        TokenBucket bucket = new TokenBucket(10, 20, 0);

        Thread.sleep(100);
        double first = bucket.getTokenCount();
        Thread.sleep(50);
        double second = bucket.getTokenCount();

        assertThat(first).isBetween(2.0, 6.0);
        assertThat(second).isGreaterThanOrEqualTo(first + 0.9);
    }

    @Test
    void concurrentConsumersNeverTakeMoreThanAvailable() throws Exception {
        TokenBucket bucket = new TokenBucket(50, 0.001);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return bucket.consume(1, false, null);
                }));
            }
            start.countDown();
            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }

            assertThat(granted).isEqualTo(50);
            assertThat(bucket.getTokenCount()).isLessThan(1.0);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void requestAboveCapacityIsRejectedEvenWhenBlocking() {
        TokenBucket bucket = new TokenBucket(2, 100);

        assertThat(bucket.consume(3, true, null)).isFalse();
        assertThat(bucket.getTokenCount()).isEqualTo(2.0);
    }

    @Test
    void refillNeverExceedsCapacity() throws InterruptedException {
        TokenBucket bucket = new TokenBucket(5, 1000);
        Thread.sleep(20);

        assertThat(bucket.getTokenCount()).isEqualTo(5.0);
    }

    @Test
    void interruptedWaitReturnsFalseAndKeepsInterruptFlag() {
        TokenBucket bucket = new TokenBucket(1, 0.1, 0);
        Thread.currentThread().interrupt();
        try {
            assertThat(bucket.consume(1, true, null)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new TokenBucket(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucket(1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucket(1, 1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucket(1, 1).consume(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
