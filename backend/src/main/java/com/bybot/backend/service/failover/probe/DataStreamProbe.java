package com.bybot.backend.service.failover.probe;

import com.bybot.backend.service.failover.ComponentProbe;
import com.bybot.backend.service.failover.ComponentStatus;
import com.bybot.backend.service.failover.SupervisedComponent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Slf4j
public class DataStreamProbe implements ComponentProbe {

    public static final Duration DEFAULT_STALE_AFTER = Duration.ofSeconds(60);

    private final MarketDataStream stream;
    private final Clock clock;
    private final Duration staleAfter;

    public DataStreamProbe(MarketDataStream stream, Clock clock, Duration staleAfter) {
        this.stream = stream;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    @Override
    public SupervisedComponent component() {
        return SupervisedComponent.DATA_STREAM;
    }

    @Override
    public ComponentStatus check() {
        try {
            if (!stream.isEnabled()) {
                return ComponentStatus.HEALTHY;
            }
            if (!stream.isConnected()) {
                return ComponentStatus.CRITICAL;
            }
            Optional<Instant> lastMessage = stream.lastMessageAt();
            if (lastMessage.isPresent()
                    && Duration.between(lastMessage.get(), clock.instant()).compareTo(staleAfter) > 0) {
                return ComponentStatus.WARNING;
            }
            return ComponentStatus.HEALTHY;
        } catch (Exception e) {
            log.error("Error checking market data stream", e);
            return ComponentStatus.FAILED;
        }
    }

    @Override
    public boolean recover() {
        try {
            stream.restart();
            return stream.isConnected();
        } catch (Exception e) {
            log.error("Error recovering market data stream", e);
            return false;
        }
    }
}
