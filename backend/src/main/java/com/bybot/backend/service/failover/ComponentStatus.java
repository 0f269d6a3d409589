package com.bybot.backend.service.failover;

public enum ComponentStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    FAILED,
    RECOVERING;

    public boolean isFailure() {
        return this == CRITICAL || this == FAILED;
    }
}
