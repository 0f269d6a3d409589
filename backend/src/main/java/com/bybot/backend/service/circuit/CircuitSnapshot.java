package com.bybot.backend.service.circuit;

import java.time.Instant;

public record CircuitSnapshot(
        String name,
        CircuitState state,
        int errorCount,
        int errorThreshold,
        Instant lastErrorAt,
        Instant openedAt
) {}
