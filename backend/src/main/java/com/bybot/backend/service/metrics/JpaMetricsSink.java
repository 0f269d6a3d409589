package com.bybot.backend.service.metrics;

import com.bybot.backend.dto.MetricStatistics;
import com.bybot.backend.model.MetricPoint;
import com.bybot.backend.repository.MetricPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaMetricsSink implements MetricsSink {

    private final MetricPointRepository metricPointRepository;

    @Override
    @Transactional
    public void write(List<MetricSample> samples) {
        if (samples.isEmpty()) {
            return;
        }
        List<MetricPoint> points = samples.stream()
                .map(sample -> MetricPoint.builder()
                        .category(sample.category())
                        .name(sample.name())
                        .metricValue(sample.value())
                        .recordedAt(sample.timestamp())
                        .build())
                .toList();
        metricPointRepository.saveAll(points);
    }

    @Override
    @Transactional
    public int purgeOlderThan(Instant cutoff) {
        int removed = metricPointRepository.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.debug("Cleaned up {} old metric points", removed);
        }
        return removed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MetricSample> history(String category, String name, int limit) {
        List<MetricSample> samples = new ArrayList<>();
        metricPointRepository.findByCategoryAndNameOrderByRecordedAtDesc(category, name, PageRequest.of(0, Math.max(1, limit)))
                .forEach(point -> samples.add(toSample(point)));
        Collections.reverse(samples);
        return samples;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MetricSample> range(String category, String name, Instant from, Instant to) {
        return metricPointRepository.findByCategoryAndNameAndRecordedAtBetweenOrderByRecordedAtAsc(category, name, from, to)
                .stream()
                .map(JpaMetricsSink::toSample)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public MetricStatistics statistics(String category, String name, StatisticsPeriod period, Instant now) {
        MetricPointRepository.MetricAggregate aggregate =
                metricPointRepository.aggregate(category, name, now.minus(period.window()));
        long count = aggregate == null || aggregate.getSampleCount() == null ? 0 : aggregate.getSampleCount();
        if (count == 0) {
            return MetricStatistics.empty(period.code());
        }
        return new MetricStatistics(aggregate.getMinValue(), aggregate.getMaxValue(), aggregate.getAvgValue(),
                count, period.code());
    }

    private static MetricSample toSample(MetricPoint point) {
        return new MetricSample(point.getCategory(), point.getName(), point.getMetricValue(), point.getRecordedAt());
    }

    @Override
    public boolean isAvailable() {
        try {
            metricPointRepository.count();
            return true;
        } catch (RuntimeException e) {
            log.warn("Metrics store unreachable: {}", e.getMessage());
            return false;
        }
    }
}
