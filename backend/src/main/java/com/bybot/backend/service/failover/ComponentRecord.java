package com.bybot.backend.service.failover;

import java.time.Instant;

/**
 * Mutable per-component bookkeeping. Only touched while holding the manager lock.
 */
final class ComponentRecord {

    final SupervisedComponent component;
    ComponentStatus status = ComponentStatus.HEALTHY;
    Instant lastCheck;
    Instant lastFailure;
    int failureCount;
    int recoveryAttempts;
    Instant lastRecoveryTime;

    ComponentRecord(SupervisedComponent component) {
        this.component = component;
    }

    void markHealthy() {
        status = ComponentStatus.HEALTHY;
        failureCount = 0;
        lastFailure = null;
    }

    ComponentStatusView toView(boolean probeRegistered) {
        return new ComponentStatusView(
                component.wireName(),
                status,
                component.isCritical(),
                failureCount,
                lastCheck,
                lastFailure,
                recoveryAttempts,
                lastRecoveryTime,
                probeRegistered
        );
    }
}
