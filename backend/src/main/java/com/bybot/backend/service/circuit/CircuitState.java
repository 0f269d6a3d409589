package com.bybot.backend.service.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
