package com.bybot.backend.dto;

public record MetricStatistics(Double min, Double max, Double avg, long count, String period) {

    public static MetricStatistics empty(String period) {
        return new MetricStatistics(0.0, 0.0, 0.0, 0, period);
    }
}
