package com.bybot.backend.service.failover;

import java.time.Instant;

public record ComponentStatusView(
        String name,
        ComponentStatus status,
        boolean critical,
        int failureCount,
        Instant lastCheck,
        Instant lastFailure,
        int recoveryAttempts,
        Instant lastRecoveryAt,
        boolean monitored
) {}
