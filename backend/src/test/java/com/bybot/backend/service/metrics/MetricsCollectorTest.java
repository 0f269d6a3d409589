package com.bybot.backend.service.metrics;

import com.bybot.backend.config.MetricsProperties;
import com.bybot.backend.dto.MetricStatistics;
import com.bybot.backend.service.MetricsService;
import com.bybot.backend.service.ScheduledTaskGuard;
import com.bybot.backend.service.circuit.CircuitBreaker;
import com.bybot.backend.service.circuit.CircuitBreakerRegistry;
import com.bybot.backend.service.circuit.CircuitBreakerSettings;
import com.bybot.backend.service.failover.FailoverManager;
import com.bybot.backend.service.failover.FailoverSettings;
import com.bybot.backend.service.ratelimit.RateLimitKeys;
import com.bybot.backend.service.ratelimit.RateLimiter;
import com.bybot.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MetricsCollectorTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;
    private CircuitBreakerRegistry registry;
    private MetricsSink sink;
    private MetricsProperties properties;
    private ScheduledTaskGuard guard;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        rateLimiter = new RateLimiter(RateLimitKeys.exchangeDefaults());
        registry = new CircuitBreakerRegistry(
                new CircuitBreakerSettings(1, Duration.ofSeconds(60), Duration.ofSeconds(300)), clock);
        FailoverManager failoverManager = new FailoverManager(FailoverSettings.DEFAULTS, List.of(),
                message -> { }, reason -> { }, mock(MetricsService.class), Runnable::run, clock);
        sink = mock(MetricsSink.class);
        properties = new MetricsProperties();
        guard = new ScheduledTaskGuard();
        collector = new MetricsCollector(rateLimiter, registry, failoverManager, sink, properties, guard, clock);
    }

    @Test
    void collectSamplesEveryCategoryAndWritesThemToSink() {
        rateLimiter.limit(RateLimitKeys.ORDER);
        rateLimiter.limit(RateLimitKeys.MARKET);
        CircuitBreaker breaker = registry.getCircuitBreaker("place_order");
        breaker.recordError();

        List<MetricSample> samples = collector.collect();

        assertThat(samples).allSatisfy(sample -> assertThat(sample.timestamp()).isEqualTo(clock.instant()));
        Map<String, Map<String, Double>> metrics = collector.getMetrics();
        assertThat(metrics).containsOnlyKeys(
                MetricsCollector.CATEGORY_API, MetricsCollector.CATEGORY_FAILOVER, MetricsCollector.CATEGORY_SYSTEM);
        assertThat(metrics.get(MetricsCollector.CATEGORY_API))
                .containsEntry("calls_total", 2.0)
                .containsEntry("rate_limit_hits", 0.0)
                .containsEntry("open_circuits", 1.0)
                .containsEntry("half_open_circuits", 0.0);
        assertThat(metrics.get(MetricsCollector.CATEGORY_FAILOVER))
                .containsEntry("state", 0.0)
                .containsEntry("failed_components", 0.0);
        assertThat(metrics.get(MetricsCollector.CATEGORY_SYSTEM))
                .containsKeys("memory_usage", "thread_count")
                .containsEntry("scheduled_task_failures", 0.0);
        verify(sink).write(samples);
    }

    @Test
    void historyIsBoundedAndOldestFirst() {
        properties.setMaxPoints(2);

        for (int call = 0; call < 3; call++) {
            rateLimiter.limit(RateLimitKeys.MARKET);
            collector.collect();
            clock.advanceSeconds(1);
        }

        assertThat(collector.getMetricHistory(MetricsCollector.CATEGORY_API, "calls_total", 100))
                .extracting(MetricSample::value)
                .containsExactly(2.0, 3.0);
        assertThat(collector.getMetricHistory(MetricsCollector.CATEGORY_API, "calls_total", 1))
                .extracting(MetricSample::value)
                .containsExactly(3.0);
        assertThat(collector.getMetrics(MetricsCollector.CATEGORY_API)).containsEntry("calls_total", 3.0);
        verify(sink, never()).history(anyString(), anyString(), anyInt());
    }

    @Test
    void historyOfUnseenMetricComesFromSink() {
        MetricSample stored = new MetricSample("api", "calls_total", 7.0, Instant.parse("2023-12-31T00:00:00Z"));
        when(sink.history("api", "calls_total", 10)).thenReturn(List.of(stored));

        assertThat(collector.getMetricHistory("api", "calls_total", 10)).containsExactly(stored);
    }

    @Test
    void sinkFailuresAreContained() {
        doThrow(new IllegalStateException("db down")).when(sink).write(anyList());
        when(sink.history(anyString(), anyString(), anyInt())).thenThrow(new IllegalStateException("db down"));

        collector.collect();

        assertThat(collector.getMetrics(MetricsCollector.CATEGORY_FAILOVER)).containsEntry("state", 0.0);
        assertThat(collector.getMetricHistory("other", "value", 5)).isEmpty();
    }

    @Test
    void timeRangeQueriesSink() {
        Instant from = Instant.parse("2023-12-31T00:00:00Z");
        MetricSample stored = new MetricSample("api", "calls_total", 7.0, from.plusSeconds(60));
        when(sink.range("api", "calls_total", from, clock.instant())).thenReturn(List.of(stored));

        assertThat(collector.getMetricsByTimeRange("api", "calls_total", from, clock.instant())).containsExactly(stored);
    }

    @Test
    void timeRangeRejectsInvertedBoundsAndContainsSinkFailures() {
        Instant from = clock.instant();
        assertThatThrownBy(() -> collector.getMetricsByTimeRange("api", "calls_total", from, from.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);

        when(sink.range(anyString(), anyString(), any(), any())).thenThrow(new IllegalStateException("db down"));

        assertThat(collector.getMetricsByTimeRange("api", "calls_total", from.minusSeconds(60), from)).isEmpty();
    }

    @Test
    void unknownPeriodFallsBackToOneDay() {
        MetricStatistics stats = new MetricStatistics(1.0, 3.0, 2.0, 3, "1d");
        when(sink.statistics("api", "calls_total", StatisticsPeriod.ONE_DAY, clock.instant())).thenReturn(stats);

        assertThat(collector.getStatistics("api", "calls_total", "2w")).isEqualTo(stats);
    }

    @Test
    void statisticsFailureReturnsEmptyStatistics() {
        when(sink.statistics(anyString(), anyString(), any(), any())).thenThrow(new IllegalStateException("db down"));

        MetricStatistics stats = collector.getStatistics("api", "calls_total", "7d");

        assertThat(stats.count()).isZero();
        assertThat(stats.period()).isEqualTo("7d");
        assertThat(stats.avg()).isZero();
    }

    @Test
    void purgeUsesRetentionWindow() {
        properties.setRetention(Duration.ofDays(2));
        when(sink.purgeOlderThan(any())).thenReturn(4);

        assertThat(collector.purgeExpired()).isEqualTo(4);
        verify(sink).purgeOlderThan(Instant.parse("2023-12-30T00:00:00Z"));
    }

    @Test
    void scheduledCollectionIsSkippedWhenDisabled() {
        properties.setEnabled(false);

        collector.scheduledCollection();

        verifyNoInteractions(sink);
    }

    @Test
    void scheduledCollectionRunsCollectAndRetention() {
        collector.scheduledCollection();

        verify(sink).write(anyList());
        verify(sink).purgeOlderThan(eq(clock.instant().minus(properties.getRetention())));
        assertThat(guard.failureCounts()).isEmpty();
    }

    @Test
    void scheduledTaskFailuresAreSampled() {
        guard.run("metrics-retention", () -> {
            throw new IllegalStateException("boom");
        });

        collector.collect();

        assertThat(collector.getMetrics(MetricsCollector.CATEGORY_SYSTEM)).containsEntry("scheduled_task_failures", 1.0);
    }
}
