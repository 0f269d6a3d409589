package com.bybot.backend.controller;

import com.bybot.backend.dto.MetricStatistics;
import com.bybot.backend.dto.MetricsSnapshot;
import com.bybot.backend.service.MetricsService;
import com.bybot.backend.service.metrics.MetricSample;
import com.bybot.backend.service.metrics.MetricsCollector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
@Tag(name = "Metrics")
public class MetricsController {

    private final MetricsService metricsService;
    private final MetricsCollector metricsCollector;

    @GetMapping
    @Operation(summary = "Resilience counters since startup")
    public MetricsSnapshot snapshot() {
        return metricsService.snapshot();
    }

    @GetMapping("/current")
    @Operation(summary = "Latest collected value of every metric, optionally for one category")
    public Map<String, ?> current(@RequestParam(required = false) String category) {
        if (category != null) {
            return metricsCollector.getMetrics(category);
        }
        return metricsCollector.getMetrics();
    }

    @GetMapping("/{category}/{name}/history")
    @Operation(summary = "Recent samples of one metric, oldest first")
    public List<MetricSample> history(@PathVariable String category, @PathVariable String name,
                                      @RequestParam(defaultValue = "100") int limit) {
        return metricsCollector.getMetricHistory(category, name, limit);
    }

    @GetMapping("/{category}/{name}/range")
    @Operation(summary = "Stored samples of one metric between two ISO-8601 instants, inclusive")
    public List<MetricSample> range(@PathVariable String category, @PathVariable String name,
                                    @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                    @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return metricsCollector.getMetricsByTimeRange(category, name, from, to);
    }

    @GetMapping("/{category}/{name}/statistics")
    @Operation(summary = "Min, max, average and count over 1h, 1d, 7d or 30d")
    public MetricStatistics statistics(@PathVariable String category, @PathVariable String name,
                                       @RequestParam(defaultValue = "1d") String period) {
        return metricsCollector.getStatistics(category, name, period);
    }
}
