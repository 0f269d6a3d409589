package com.bybot.backend.service.circuit;

import java.time.Duration;

/**
 * @param errorThreshold errors within {@code errorTimeout} of each other that open the circuit
 * @param errorTimeout   idle time after which the error count starts over
 * @param circuitTimeout time the circuit stays open before a probe is let through
 */
public record CircuitBreakerSettings(int errorThreshold, Duration errorTimeout, Duration circuitTimeout) {

    public static final CircuitBreakerSettings DEFAULTS =
            new CircuitBreakerSettings(5, Duration.ofSeconds(60), Duration.ofSeconds(300));

    public CircuitBreakerSettings {
        if (errorThreshold < 1) {
            throw new IllegalArgumentException("errorThreshold must be at least 1: " + errorThreshold);
        }
        requirePositive("errorTimeout", errorTimeout);
        requirePositive("circuitTimeout", circuitTimeout);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
