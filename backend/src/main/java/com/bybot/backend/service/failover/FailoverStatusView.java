package com.bybot.backend.service.failover;

import java.util.Map;

public record FailoverStatusView(
        FailoverState state,
        boolean running,
        boolean shutdownTriggered,
        Map<String, ComponentStatusView> components,
        Map<String, Integer> recoveryAttempts,
        FailoverSettings config
) {}
