package com.bybot.backend.service.circuit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily populated map of operation name to {@link CircuitBreaker}.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final CircuitBreakerSettings defaults;
    private final Clock clock;
    private final Map<String, CircuitBreaker> circuitBreakers = new TreeMap<>();
    private final List<CircuitTransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    public CircuitBreakerRegistry(CircuitBreakerSettings defaults, Clock clock) {
        this.defaults = defaults;
        this.clock = clock;
    }

    public CircuitBreaker getCircuitBreaker(String name) {
        return getCircuitBreaker(name, null);
    }

    /**
     * Returns the breaker for {@code name}, creating it on first use. {@code overrides} only apply
     * to that first creation; an existing breaker is never rebuilt.
     */
    public CircuitBreaker getCircuitBreaker(String name, CircuitBreakerSettings overrides) {
        lock.lock();
        try {
            CircuitBreaker existing = circuitBreakers.get(name);
            if (existing != null) {
                return existing;
            }
            CircuitBreaker created = new CircuitBreaker(name, overrides != null ? overrides : defaults, clock);
            listeners.forEach(created::addListener);
            circuitBreakers.put(name, created);
            log.debug("Created new circuit breaker '{}'", name);
            return created;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CircuitBreaker> find(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(circuitBreakers.get(name));
        } finally {
            lock.unlock();
        }
    }

    public void addTransitionListener(CircuitTransitionListener listener) {
        lock.lock();
        try {
            listeners.add(listener);
            circuitBreakers.values().forEach(breaker -> breaker.addListener(listener));
        } finally {
            lock.unlock();
        }
    }

    public Map<String, CircuitState> getAllStates() {
        Map<String, CircuitState> states = new LinkedHashMap<>();
        breakers().forEach(breaker -> states.put(breaker.getName(), breaker.getState()));
        return states;
    }

    public List<CircuitSnapshot> getSnapshots() {
        return breakers().stream().map(CircuitBreaker::snapshot).toList();
    }

    public long countInState(CircuitState state) {
        return getAllStates().values().stream().filter(state::equals).count();
    }

    public boolean reset(String name) {
        Optional<CircuitBreaker> breaker = find(name);
        breaker.ifPresent(CircuitBreaker::reset);
        return breaker.isPresent();
    }

    public void resetAll() {
        List<CircuitBreaker> all = breakers();
        all.forEach(CircuitBreaker::reset);
        log.info("Reset all circuit breakers ({})", all.size());
    }

    private List<CircuitBreaker> breakers() {
        lock.lock();
        try {
            return List.copyOf(circuitBreakers.values());
        } finally {
            lock.unlock();
        }
    }
}
