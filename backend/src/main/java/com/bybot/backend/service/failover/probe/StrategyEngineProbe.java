package com.bybot.backend.service.failover.probe;

import com.bybot.backend.service.failover.ComponentProbe;
import com.bybot.backend.service.failover.ComponentStatus;
import com.bybot.backend.service.failover.SupervisedComponent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

@Slf4j
public class StrategyEngineProbe implements ComponentProbe {

    public static final Duration DEFAULT_SIGNAL_TIMEOUT = Duration.ofHours(1);

    private final StrategyEngine engine;
    private final Clock clock;
    private final Duration signalTimeout;

    public StrategyEngineProbe(StrategyEngine engine, Clock clock, Duration signalTimeout) {
        this.engine = engine;
        this.clock = clock;
        this.signalTimeout = signalTimeout;
    }

    @Override
    public SupervisedComponent component() {
        return SupervisedComponent.STRATEGY_ENGINE;
    }

    @Override
    public ComponentStatus check() {
        try {
            boolean stale = engine.lastSignalAt()
                    .map(last -> Duration.between(last, clock.instant()).compareTo(signalTimeout) > 0)
                    .orElse(false);
            return stale ? ComponentStatus.WARNING : ComponentStatus.HEALTHY;
        } catch (Exception e) {
            log.error("Error checking strategy engine", e);
            return ComponentStatus.FAILED;
        }
    }

    @Override
    public boolean recover() {
        try {
            engine.reinitialize();
            return true;
        } catch (Exception e) {
            log.error("Error recovering strategy engine", e);
            return false;
        }
    }
}
