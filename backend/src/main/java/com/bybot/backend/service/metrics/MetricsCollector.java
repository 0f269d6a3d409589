package com.bybot.backend.service.metrics;

import com.bybot.backend.config.MetricsProperties;
import com.bybot.backend.dto.MetricStatistics;
import com.bybot.backend.service.ScheduledTaskGuard;
import com.bybot.backend.service.circuit.CircuitBreakerRegistry;
import com.bybot.backend.service.circuit.CircuitState;
import com.bybot.backend.service.failover.ComponentStatus;
import com.bybot.backend.service.failover.ComponentStatusView;
import com.bybot.backend.service.failover.FailoverManager;
import com.bybot.backend.service.failover.FailoverStatusView;
import com.bybot.backend.service.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Samples the resilience components on a fixed delay, keeps the latest value and a bounded
 * in-memory history per metric, and forwards every sample to the {@link MetricsSink}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsCollector {

    public static final String CATEGORY_SYSTEM = "system";
    public static final String CATEGORY_API = "api";
    public static final String CATEGORY_FAILOVER = "failover";

    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final FailoverManager failoverManager;
    private final MetricsSink metricsSink;
    private final MetricsProperties properties;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, Double>> current = new TreeMap<>();
    private final Map<String, Deque<MetricSample>> history = new HashMap<>();

    @Scheduled(fixedDelayString = "${bybot.metrics.collection-interval-ms:10000}",
            initialDelayString = "${bybot.metrics.collection-interval-ms:10000}")
    public void scheduledCollection() {
        if (!properties.isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("metrics-collection", this::collect);
        scheduledTaskGuard.run("metrics-retention", this::purgeExpired);
    }

    public List<MetricSample> collect() {
        Instant now = clock.instant();
        List<MetricSample> samples = new ArrayList<>();

        Runtime runtime = Runtime.getRuntime();
        double usedMemory = runtime.totalMemory() - runtime.freeMemory();
        samples.add(record(CATEGORY_SYSTEM, "memory_usage", 100.0 * usedMemory / runtime.maxMemory(), now));
        samples.add(record(CATEGORY_SYSTEM, "thread_count", ManagementFactory.getThreadMXBean().getThreadCount(), now));
        samples.add(record(CATEGORY_SYSTEM, "scheduled_task_failures", sum(scheduledTaskGuard.failureCounts()), now));

        samples.add(record(CATEGORY_API, "calls_total", sum(rateLimiter.getStats()), now));
        samples.add(record(CATEGORY_API, "rate_limit_hits", sum(rateLimiter.getRejections()), now));
        samples.add(record(CATEGORY_API, "open_circuits", circuitBreakerRegistry.countInState(CircuitState.OPEN), now));
        samples.add(record(CATEGORY_API, "half_open_circuits", circuitBreakerRegistry.countInState(CircuitState.HALF_OPEN), now));

        FailoverStatusView status = failoverManager.getFailoverStatus();
        long failed = status.components().values().stream()
                .map(ComponentStatusView::status)
                .filter(ComponentStatus::isFailure)
                .count();
        samples.add(record(CATEGORY_FAILOVER, "state", status.state().ordinal(), now));
        samples.add(record(CATEGORY_FAILOVER, "failed_components", failed, now));

        store(samples);
        return samples;
    }

    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getRetention());
        try {
            return metricsSink.purgeOlderThan(cutoff);
        } catch (Exception e) {
            log.error("Error cleaning up old metrics cutoff={}", cutoff, e);
            return 0;
        }
    }

    public Map<String, Map<String, Double>> getMetrics() {
        lock.lock();
        try {
            Map<String, Map<String, Double>> copy = new TreeMap<>();
            current.forEach((category, values) -> copy.put(category, new TreeMap<>(values)));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Double> getMetrics(String category) {
        lock.lock();
        try {
            return new TreeMap<>(current.getOrDefault(category, Map.of()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest {@code limit} samples, oldest first. Falls back to the sink for metrics this
     * process has not recorded.
     */
    public List<MetricSample> getMetricHistory(String category, String name, int limit) {
        lock.lock();
        try {
            Deque<MetricSample> samples = history.get(key(category, name));
            if (samples != null) {
                List<MetricSample> all = new ArrayList<>(samples);
                return limit > 0 && all.size() > limit ? all.subList(all.size() - limit, all.size()) : all;
            }
        } finally {
            lock.unlock();
        }
        try {
            return metricsSink.history(category, name, limit);
        } catch (Exception e) {
            log.error("Error getting metric history for {}.{}", category, name, e);
            return List.of();
        }
    }

    /**
     * Stored samples of one metric inside {@code [from, to]}, oldest first.
     */
    public List<MetricSample> getMetricsByTimeRange(String category, String name, Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
        }
        try {
            return metricsSink.range(category, name, from, to);
        } catch (Exception e) {
            log.error("Error getting metrics by time range for {}.{}", category, name, e);
            return List.of();
        }
    }

    public MetricStatistics getStatistics(String category, String name, String period) {
        StatisticsPeriod resolved = StatisticsPeriod.fromCode(period);
        try {
            return metricsSink.statistics(category, name, resolved, clock.instant());
        } catch (Exception e) {
            log.error("Error getting metric statistics for {}.{}", category, name, e);
            return MetricStatistics.empty(resolved.code());
        }
    }

    private MetricSample record(String category, String name, double value, Instant timestamp) {
        MetricSample sample = new MetricSample(category, name, value, timestamp);
        lock.lock();
        try {
            current.computeIfAbsent(category, c -> new TreeMap<>()).put(name, value);
            Deque<MetricSample> samples = history.computeIfAbsent(key(category, name), k -> new ArrayDeque<>());
            samples.addLast(sample);
            while (samples.size() > properties.getMaxPoints()) {
                samples.removeFirst();
            }
        } finally {
            lock.unlock();
        }
        return sample;
    }

    private void store(List<MetricSample> samples) {
        try {
            metricsSink.write(samples);
        } catch (Exception e) {
            log.error("Error storing {} metric samples", samples.size(), e);
        }
    }

    private static double sum(Map<String, Long> counts) {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    private static String key(String category, String name) {
        return category + "." + name;
    }
}
