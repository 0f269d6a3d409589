package com.bybot.backend.service.failover.probe;

import java.time.Instant;
import java.util.Optional;

public interface StrategyEngine {

    Optional<Instant> lastSignalAt();

    void reinitialize();
}
