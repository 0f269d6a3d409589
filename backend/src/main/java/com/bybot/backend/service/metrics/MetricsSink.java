package com.bybot.backend.service.metrics;

import com.bybot.backend.dto.MetricStatistics;

import java.time.Instant;
import java.util.List;

/**
 * Time-series store for collected metric samples.
 */
public interface MetricsSink {

    void write(List<MetricSample> samples);

    int purgeOlderThan(Instant cutoff);

    /**
     * Most recent samples, oldest first.
     */
    List<MetricSample> history(String category, String name, int limit);

    /**
     * Samples recorded between {@code from} and {@code to}, both inclusive, oldest first.
     */
    List<MetricSample> range(String category, String name, Instant from, Instant to);

    MetricStatistics statistics(String category, String name, StatisticsPeriod period, Instant now);

    boolean isAvailable();
}
