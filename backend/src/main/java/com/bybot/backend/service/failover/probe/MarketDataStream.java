package com.bybot.backend.service.failover.probe;

import java.time.Instant;
import java.util.Optional;

/**
 * Streaming market data connection owned by the trading side of the application.
 */
public interface MarketDataStream {

    boolean isEnabled();

    boolean isConnected();

    Optional<Instant> lastMessageAt();

    void restart();
}
