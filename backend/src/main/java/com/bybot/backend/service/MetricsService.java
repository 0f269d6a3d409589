package com.bybot.backend.service;

import com.bybot.backend.dto.MetricsSnapshot;
import com.bybot.backend.service.circuit.CircuitState;
import com.bybot.backend.service.failover.FailoverState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong exchangeFailures = new AtomicLong();
    private final AtomicLong recoveryAttempts = new AtomicLong();
    private final AtomicLong recoveryFailures = new AtomicLong();
    private final AtomicLong emergencyShutdowns = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectionsByKey = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> transitionsByState = new ConcurrentHashMap<>();
    private final AtomicInteger failoverStateOrdinal = new AtomicInteger();
    private final AtomicReference<FailoverState> failoverState = new AtomicReference<>(FailoverState.NORMAL);

    private Counter exchangeErrorsCounter;
    private Counter emergencyShutdownsCounter;

    @PostConstruct
    void init() {
        exchangeErrorsCounter = Counter.builder("exchange_errors_total").register(meterRegistry);
        emergencyShutdownsCounter = Counter.builder("emergency_shutdowns_total").register(meterRegistry);
        Gauge.builder("failover_state", failoverStateOrdinal, AtomicInteger::get).register(meterRegistry);
    }

    public void incrementExchangeFailures() {
        exchangeFailures.incrementAndGet();
        if (exchangeErrorsCounter != null) {
            exchangeErrorsCounter.increment();
        }
    }

    public void recordRateLimitRejection(String key) {
        rejectionsByKey.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        Counter.builder("rate_limit_rejections_total")
                .tag("key", key)
                .register(meterRegistry)
                .increment();
    }

    public void recordCircuitTransition(String circuit, CircuitState from, CircuitState to) {
        transitionsByState.computeIfAbsent(to.name(), k -> new AtomicLong()).incrementAndGet();
        Counter.builder("circuit_transitions_total")
                .tag("circuit", circuit)
                .tag("from", from.name())
                .tag("to", to.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordRecoveryAttempt(String component, boolean success) {
        recoveryAttempts.incrementAndGet();
        if (!success) {
            recoveryFailures.incrementAndGet();
        }
        Counter.builder("recovery_attempts_total")
                .tag("component", component)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
    }

    public void recordEmergencyShutdown() {
        emergencyShutdowns.incrementAndGet();
        if (emergencyShutdownsCounter != null) {
            emergencyShutdownsCounter.increment();
        }
    }

    public void updateFailoverState(FailoverState state) {
        failoverState.set(state);
        failoverStateOrdinal.set(state.ordinal());
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                toCounts(rejectionsByKey),
                toCounts(transitionsByState),
                exchangeFailures.get(),
                recoveryAttempts.get(),
                recoveryFailures.get(),
                emergencyShutdowns.get(),
                failoverState.get().name()
        );
    }

    private static Map<String, Long> toCounts(Map<String, AtomicLong> counters) {
        return counters.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
