package com.bybot.backend.dto;

import java.util.Map;

public record MetricsSnapshot(
        Map<String, Long> rateLimitRejections,
        Map<String, Long> circuitTransitions,
        long exchangeFailures,
        long recoveryAttempts,
        long recoveryFailures,
        long emergencyShutdowns,
        String failoverState
) {}
