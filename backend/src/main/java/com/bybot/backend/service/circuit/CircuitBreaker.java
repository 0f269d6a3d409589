package com.bybot.backend.service.circuit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-operation failure tracker.
 *
 * <pre>
 *   CLOSED    --(errorThreshold errors, none further apart than errorTimeout)--> OPEN
 *   OPEN      --(circuitTimeout elapsed, next allowRequest)--------------------> HALF_OPEN
 *   HALF_OPEN --(recordSuccess)------------------------------------------------> CLOSED
 *   HALF_OPEN --(recordError)--------------------------------------------------> OPEN
 * </pre>
 *
 * <p>HALF_OPEN admits one probe at a time: the caller whose {@link #allowRequest()} moved the
 * circuit out of OPEN owns the probe, and later callers are refused until it reports a result.
 * A probe that never reports is released once {@code circuitTimeout} has passed.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CircuitTransitionListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private int errorCount;
    private Instant lastErrorTime = Instant.EPOCH;
    private Instant openTime = Instant.EPOCH;
    private Instant probeStartedAt;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Circuit name must not be blank");
        }
        this.name = name;
        this.settings = settings;
        this.clock = clock;
    }

    public boolean allowRequest() {
        CircuitState previous;
        lock.lock();
        try {
            Instant now = clock.instant();
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (!elapsed(openTime, now, settings.circuitTimeout())) {
                        return false;
                    }
                    previous = state;
                    state = CircuitState.HALF_OPEN;
                    probeStartedAt = now;
                    log.info("Circuit '{}' timeout elapsed, moving to half-open state", name);
                    break;
                case HALF_OPEN:
                    if (probeStartedAt != null && !elapsed(probeStartedAt, now, settings.circuitTimeout())) {
                        return false;
                    }
                    probeStartedAt = now;
                    return true;
                default:
                    return false;
            }
        } finally {
            lock.unlock();
        }
        notifyListeners(previous, CircuitState.HALF_OPEN);
        return true;
    }

    public void recordSuccess() {
        lock.lock();
        try {
            if (state != CircuitState.HALF_OPEN) {
                return;
            }
            state = CircuitState.CLOSED;
            errorCount = 0;
            probeStartedAt = null;
            log.info("Circuit '{}' closed, resuming normal operation", name);
        } finally {
            lock.unlock();
        }
        notifyListeners(CircuitState.HALF_OPEN, CircuitState.CLOSED);
    }

    public void recordError() {
        CircuitState previous;
        lock.lock();
        try {
            Instant now = clock.instant();
            previous = state;
            if (state == CircuitState.OPEN) {
                log.debug("Circuit '{}' is open, error recorded but ignored", name);
                return;
            }
            if (state == CircuitState.CLOSED) {
                if (elapsed(lastErrorTime, now, settings.errorTimeout())) {
                    if (errorCount > 0) {
                        log.debug("Circuit '{}' error timeout elapsed, resetting error count from {} to 0", name, errorCount);
                    }
                    errorCount = 0;
                }
                errorCount++;
                lastErrorTime = now;
                log.debug("Circuit '{}' error count: {}/{}", name, errorCount, settings.errorThreshold());
                if (errorCount < settings.errorThreshold()) {
                    return;
                }
            }
            open(now);
        } finally {
            lock.unlock();
        }
        notifyListeners(previous, CircuitState.OPEN);
    }

    public void reset() {
        CircuitState previous;
        lock.lock();
        try {
            previous = state;
            state = CircuitState.CLOSED;
            errorCount = 0;
            lastErrorTime = Instant.EPOCH;
            openTime = Instant.EPOCH;
            probeStartedAt = null;
            log.info("Circuit '{}' manually reset to closed state", name);
        } finally {
            lock.unlock();
        }
        if (previous != CircuitState.CLOSED) {
            notifyListeners(previous, CircuitState.CLOSED);
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getErrorCount() {
        lock.lock();
        try {
            return errorCount;
        } finally {
            lock.unlock();
        }
    }

    public CircuitSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitSnapshot(
                    name,
                    state,
                    errorCount,
                    settings.errorThreshold(),
                    Instant.EPOCH.equals(lastErrorTime) ? null : lastErrorTime,
                    state == CircuitState.CLOSED ? null : openTime
            );
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    void addListener(CircuitTransitionListener listener) {
        listeners.add(listener);
    }

    private void open(Instant now) {
        state = CircuitState.OPEN;
        openTime = now;
        errorCount = 0;
        probeStartedAt = null;
        log.warn("Circuit '{}' opened due to excessive errors", name);
    }

    private static boolean elapsed(Instant since, Instant now, Duration window) {
        return Duration.between(since, now).compareTo(window) > 0;
    }

    private void notifyListeners(CircuitState from, CircuitState to) {
        for (CircuitTransitionListener listener : listeners) {
            try {
                listener.onTransition(name, from, to);
            } catch (RuntimeException e) {
                log.warn("Circuit transition listener failed circuit={} from={} to={}", name, from, to, e);
            }
        }
    }
}
