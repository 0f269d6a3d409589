package com.bybot.backend.service.failover;

public enum FailoverState {
    NORMAL,
    DEGRADED,
    FAILOVER,
    RECOVERY,
    EMERGENCY
}
