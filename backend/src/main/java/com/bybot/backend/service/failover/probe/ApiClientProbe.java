package com.bybot.backend.service.failover.probe;

import com.bybot.backend.service.circuit.CircuitState;
import com.bybot.backend.service.exchange.ExchangeEndpoints;
import com.bybot.backend.service.exchange.ResilientExchangeClient;
import com.bybot.backend.service.failover.ComponentProbe;
import com.bybot.backend.service.failover.ComponentStatus;
import com.bybot.backend.service.failover.SupervisedComponent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pings the exchange server time through the guarded client. Any open circuit degrades the
 * component to WARNING even when the ping succeeds.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiClientProbe implements ComponentProbe {

    private final ResilientExchangeClient exchangeClient;

    @Override
    public SupervisedComponent component() {
        return SupervisedComponent.API_CLIENT;
    }

    @Override
    public ComponentStatus check() {
        try {
            if (exchangeClient.getServerTime().isEmpty()) {
                return ComponentStatus.CRITICAL;
            }
            long open = exchangeClient.getCircuitBreakers().countInState(CircuitState.OPEN);
            if (open > 0) {
                log.debug("API client reachable but {} circuit(s) open", open);
                return ComponentStatus.WARNING;
            }
            return ComponentStatus.HEALTHY;
        } catch (Exception e) {
            log.error("Error checking API client", e);
            return ComponentStatus.FAILED;
        }
    }

    @Override
    public boolean recover() {
        try {
            exchangeClient.getCircuitBreakers().reset(ExchangeEndpoints.GET_SERVER_TIME);
            return exchangeClient.getServerTime().isPresent();
        } catch (Exception e) {
            log.error("Error recovering API client", e);
            return false;
        }
    }
}
