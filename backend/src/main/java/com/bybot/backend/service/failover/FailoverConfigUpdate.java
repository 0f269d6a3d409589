package com.bybot.backend.service.failover;

import java.time.Duration;

/**
 * Partial settings change; null fields keep their current value.
 */
public record FailoverConfigUpdate(
        Boolean enabled,
        Boolean autoRecovery,
        Integer maxRecoveryAttempts,
        Duration recoveryBackoff,
        Boolean emergencyShutdown,
        Boolean notificationEnabled,
        Duration checkInterval
) {}
