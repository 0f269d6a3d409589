package com.bybot.backend.service.circuit;

import com.bybot.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerRegistryTest {

    private MutableClock clock;
    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        registry = new CircuitBreakerRegistry(
                new CircuitBreakerSettings(2, Duration.ofSeconds(60), Duration.ofSeconds(300)), clock);
    }

    @Test
    void returnsSameBreakerForSameName() {
        CircuitBreaker first = registry.getCircuitBreaker("place_order");
        CircuitBreaker second = registry.getCircuitBreaker("place_order");

        assertThat(first).isSameAs(second);
        assertThat(first.getSettings())
                .isEqualTo(new CircuitBreakerSettings(2, Duration.ofSeconds(60), Duration.ofSeconds(300)));
    }

    @Test
    void overridesOnlyApplyOnFirstCreation() {
        CircuitBreakerSettings custom = new CircuitBreakerSettings(10, Duration.ofSeconds(5), Duration.ofSeconds(5));

        CircuitBreaker created = registry.getCircuitBreaker("get_kline", custom);
        CircuitBreaker again = registry.getCircuitBreaker("get_kline",
                new CircuitBreakerSettings(1, Duration.ofSeconds(1), Duration.ofSeconds(1)));

        assertThat(again).isSameAs(created);
        assertThat(again.getSettings()).isEqualTo(custom);
    }

    @Test
    void findDoesNotCreate() {
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.getAllStates()).isEmpty();
    }

    @Test
    void reportsStatesSortedByNameAndCountsByState() {
        registry.getCircuitBreaker("set_leverage");
        CircuitBreaker failing = registry.getCircuitBreaker("cancel_order");
        failing.recordError();
        failing.recordError();

        assertThat(registry.getAllStates()).containsExactly(
                Map.entry("cancel_order", CircuitState.OPEN),
                Map.entry("set_leverage", CircuitState.CLOSED));
        assertThat(registry.countInState(CircuitState.OPEN)).isEqualTo(1);
        assertThat(registry.getSnapshots()).extracting(CircuitSnapshot::name)
                .containsExactly("cancel_order", "set_leverage");
    }

    @Test
    void resetByNameReportsWhetherBreakerExists() {
        CircuitBreaker breaker = registry.getCircuitBreaker("get_positions");
        breaker.recordError();
        breaker.recordError();

        assertThat(registry.reset("get_positions")).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.reset("unknown")).isFalse();
    }

    @Test
    void resetAllClosesEveryBreaker() {
        for (String name : List.of("a", "b")) {
            CircuitBreaker breaker = registry.getCircuitBreaker(name);
            breaker.recordError();
            breaker.recordError();
        }

        registry.resetAll();

        assertThat(registry.countInState(CircuitState.CLOSED)).isEqualTo(2);
    }

    @Test
    void listenersApplyToExistingAndFutureBreakers() {
        List<String> events = new ArrayList<>();
        CircuitBreaker existing = registry.getCircuitBreaker("existing");
        registry.addTransitionListener((name, from, to) -> events.add(name + ":" + to));
        CircuitBreaker later = registry.getCircuitBreaker("later");

        existing.recordError();
        existing.recordError();
        later.recordError();
        later.recordError();

        assertThat(events).containsExactly("existing:OPEN", "later:OPEN");
    }
}
