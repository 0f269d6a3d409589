package com.bybot.backend.service.metrics;

import java.time.Instant;

public record MetricSample(String category, String name, double value, Instant timestamp) {}
