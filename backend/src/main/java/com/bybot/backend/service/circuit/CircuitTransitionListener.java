package com.bybot.backend.service.circuit;

@FunctionalInterface
public interface CircuitTransitionListener {

    void onTransition(String circuitName, CircuitState from, CircuitState to);
}
