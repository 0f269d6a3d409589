package com.bybot.backend.service.failover;

import java.time.Duration;

public record FailoverSettings(
        boolean enabled,
        boolean autoRecovery,
        int maxRecoveryAttempts,
        Duration recoveryBackoff,
        boolean emergencyShutdown,
        boolean notificationEnabled,
        Duration checkInterval
) {

    public static final FailoverSettings DEFAULTS = new FailoverSettings(
            true, true, 3, Duration.ofSeconds(60), true, true, Duration.ofSeconds(30));

    public FailoverSettings {
        if (maxRecoveryAttempts < 0) {
            throw new IllegalArgumentException("maxRecoveryAttempts must not be negative: " + maxRecoveryAttempts);
        }
        if (recoveryBackoff == null || recoveryBackoff.isNegative()) {
            throw new IllegalArgumentException("recoveryBackoff must not be negative: " + recoveryBackoff);
        }
        if (checkInterval == null || checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must be positive: " + checkInterval);
        }
    }

    public FailoverSettings merge(FailoverConfigUpdate update) {
        if (update == null) {
            return this;
        }
        return new FailoverSettings(
                update.enabled() != null ? update.enabled() : enabled,
                update.autoRecovery() != null ? update.autoRecovery() : autoRecovery,
                update.maxRecoveryAttempts() != null ? update.maxRecoveryAttempts() : maxRecoveryAttempts,
                update.recoveryBackoff() != null ? update.recoveryBackoff() : recoveryBackoff,
                update.emergencyShutdown() != null ? update.emergencyShutdown() : emergencyShutdown,
                update.notificationEnabled() != null ? update.notificationEnabled() : notificationEnabled,
                update.checkInterval() != null ? update.checkInterval() : checkInterval
        );
    }
}
