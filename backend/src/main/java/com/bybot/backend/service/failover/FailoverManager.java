package com.bybot.backend.service.failover;

import com.bybot.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supervises the {@link SupervisedComponent}s: polls their probes every {@code checkInterval},
 * derives a global {@link FailoverState} and drives recovery or emergency shutdown.
 *
 * <p>Global state precedence: a critical component in CRITICAL or FAILED gives EMERGENCY, then any
 * RECOVERING component gives RECOVERY, then any WARNING gives DEGRADED, otherwise NORMAL.
 * FAILOVER is never derived by the poll.
 *
 * <p>All component bookkeeping happens under one lock. Probes, the notifier and the shutdown
 * handler are always called with the lock released.
 */
@Slf4j
public class FailoverManager {

    static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(1);

    private final Map<SupervisedComponent, ComponentProbe> probes;
    private final Map<SupervisedComponent, ComponentRecord> records = new EnumMap<>(SupervisedComponent.class);
    private final Notifier notifier;
    private final ShutdownHandler shutdownHandler;
    private final MetricsService metricsService;
    private final Executor executor;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private FailoverSettings settings;
    private FailoverState state = FailoverState.NORMAL;
    private boolean shutdownTriggered;
    private volatile LoopHandle loop;

    public FailoverManager(FailoverSettings settings, Collection<? extends ComponentProbe> probes, Notifier notifier,
                           ShutdownHandler shutdownHandler, MetricsService metricsService, Executor executor, Clock clock) {
        this.settings = settings;
        this.notifier = notifier;
        this.shutdownHandler = shutdownHandler;
        this.metricsService = metricsService;
        this.executor = executor;
        this.clock = clock;
        this.probes = new EnumMap<>(SupervisedComponent.class);
        for (ComponentProbe probe : probes) {
            if (this.probes.putIfAbsent(probe.component(), probe) != null) {
                throw new IllegalArgumentException("Duplicate probe for component " + probe.component().wireName());
            }
        }
        for (SupervisedComponent component : SupervisedComponent.values()) {
            records.put(component, new ComponentRecord(component));
        }
        log.info("Failover manager initialized monitored={} settings={}", this.probes.keySet(), settings);
    }

    public boolean start() {
        if (!getSettings().enabled()) {
            log.info("Failover manager is disabled in configuration");
            return false;
        }
        LoopHandle handle = new LoopHandle();
        lock.lock();
        try {
            if (loop != null && loop.active.get()) {
                log.warn("Failover manager already running");
                return false;
            }
            loop = handle;
        } finally {
            lock.unlock();
        }
        try {
            executor.execute(() -> runLoop(handle));
        } catch (RuntimeException e) {
            handle.finish();
            log.error("Failover manager could not be scheduled", e);
            return false;
        }
        log.info("Failover manager started checkInterval={}", getSettings().checkInterval());
        return true;
    }

    public void stop() {
        LoopHandle handle;
        lock.lock();
        try {
            handle = loop;
        } finally {
            lock.unlock();
        }
        if (handle == null || !handle.active.compareAndSet(true, false)) {
            log.warn("Failover manager not running");
            return;
        }
        handle.stopSignal.countDown();
        try {
            if (!handle.exited.await(STOP_JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Failover loop did not exit within {}", STOP_JOIN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Failover manager stopped");
    }

    public boolean isRunning() {
        LoopHandle handle = loop;
        return handle != null && handle.active.get();
    }

    private void runLoop(LoopHandle handle) {
        try {
            while (handle.active.get()) {
                try {
                    if (getSettings().enabled()) {
                        runCycle();
                    } else {
                        log.debug("Failover supervision disabled, skipping cycle");
                    }
                } catch (Exception e) {
                    log.error("Error in failover loop", e);
                }
                try {
                    if (handle.stopSignal.await(getSettings().checkInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            handle.finish();
        }
    }

    /**
     * Cooperative stop flag and join latch for one run of the supervision loop.
     */
    private static final class LoopHandle {
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final CountDownLatch exited = new CountDownLatch(1);

        private void finish() {
            active.set(false);
            exited.countDown();
        }
    }

    /**
     * One supervision iteration: check, derive state, act on it.
     */
    public void runCycle() {
        checkComponents();
        updateState();
        handleFailover();
    }

    public void checkComponents() {
        for (Map.Entry<SupervisedComponent, ComponentProbe> entry : probes.entrySet()) {
            SupervisedComponent component = entry.getKey();
            ComponentStatus status;
            try {
                status = entry.getValue().check();
                if (status == null) {
                    log.warn("Probe returned no status component={}", component.wireName());
                    status = ComponentStatus.FAILED;
                }
            } catch (Exception e) {
                log.error("Error checking component {}", component.wireName(), e);
                status = ComponentStatus.FAILED;
            }
            applyCheckResult(component, status);
            log.debug("Component {} status: {}", component.wireName(), status);
        }
    }

    private void applyCheckResult(SupervisedComponent component, ComponentStatus status) {
        lock.lock();
        try {
            ComponentRecord record = records.get(component);
            Instant now = clock.instant();
            record.status = status;
            record.lastCheck = now;
            if (status == ComponentStatus.HEALTHY) {
                record.failureCount = 0;
                record.lastFailure = null;
            } else {
                record.failureCount++;
                if (record.lastFailure == null) {
                    record.lastFailure = now;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public FailoverState updateState() {
        FailoverState previous;
        FailoverState next;
        boolean notify;
        lock.lock();
        try {
            next = deriveState();
            previous = state;
            state = next;
            if (next != FailoverState.EMERGENCY) {
                shutdownTriggered = false;
            }
            notify = settings.notificationEnabled();
        } finally {
            lock.unlock();
        }
        metricsService.updateFailoverState(next);
        if (next != previous) {
            log.info("Failover state changed from {} to {}", previous, next);
            if (notify) {
                sendNotification("Failover state changed from " + previous + " to " + next);
            }
        }
        return next;
    }

    private FailoverState deriveState() {
        boolean criticalFailure = false;
        boolean recovering = false;
        boolean warning = false;
        for (ComponentRecord record : records.values()) {
            criticalFailure |= record.component.isCritical() && record.status.isFailure();
            recovering |= record.status == ComponentStatus.RECOVERING;
            warning |= record.status == ComponentStatus.WARNING;
        }
        if (criticalFailure) {
            return FailoverState.EMERGENCY;
        }
        if (recovering) {
            return FailoverState.RECOVERY;
        }
        if (warning) {
            return FailoverState.DEGRADED;
        }
        return FailoverState.NORMAL;
    }

    public void handleFailover() {
        switch (getState()) {
            case DEGRADED -> componentsIn(List.of(ComponentStatus.WARNING), false).forEach(this::attemptRecovery);
            case FAILOVER -> componentsIn(List.of(ComponentStatus.CRITICAL, ComponentStatus.FAILED), true)
                    .forEach(component -> log.info("No backup system available for component {}", component.wireName()));
            case RECOVERY -> componentsIn(List.of(ComponentStatus.RECOVERING), false).forEach(this::continueRecovery);
            case EMERGENCY -> handleEmergency();
            default -> {
            }
        }
    }

    private void handleEmergency() {
        log.error("System in EMERGENCY state - critical components have failed");
        List<SupervisedComponent> failedCritical =
                componentsIn(List.of(ComponentStatus.CRITICAL, ComponentStatus.FAILED), true);
        failedCritical.forEach(this::attemptRecovery);

        String reason;
        boolean notify;
        lock.lock();
        try {
            if (failedCritical.isEmpty() || !settings.emergencyShutdown() || shutdownTriggered) {
                return;
            }
            int maxAttempts = settings.maxRecoveryAttempts();
            boolean exhausted = failedCritical.stream()
                    .allMatch(component -> records.get(component).recoveryAttempts >= maxAttempts);
            if (!exhausted) {
                return;
            }
            shutdownTriggered = true;
            notify = settings.notificationEnabled();
            reason = "Critical components could not be recovered: "
                    + failedCritical.stream().map(SupervisedComponent::wireName).toList();
        } finally {
            lock.unlock();
        }

        log.error("Emergency shutdown initiated - {}", reason);
        metricsService.recordEmergencyShutdown();
        if (notify) {
            sendNotification("EMERGENCY: Trading bot shutting down due to critical component failures");
        }
        try {
            shutdownHandler.shutdown(reason);
        } catch (Exception e) {
            log.error("Shutdown handler failed", e);
        }
    }

    /**
     * Runs the component's recovery hook if auto recovery is on, a probe is registered, attempts
     * remain and the fixed backoff since the last attempt has elapsed.
     *
     * @return true if the recovery ran and reported success
     */
    public boolean attemptRecovery(SupervisedComponent component) {
        ComponentProbe probe = probes.get(component);
        int attempt;
        lock.lock();
        try {
            ComponentRecord record = records.get(component);
            if (!settings.autoRecovery()) {
                log.warn("Auto recovery disabled - not attempting recovery for {}", component.wireName());
                return false;
            }
            if (probe == null) {
                log.warn("No recovery function for component {}", component.wireName());
                return false;
            }
            if (record.recoveryAttempts >= settings.maxRecoveryAttempts()) {
                log.warn("Max recovery attempts reached for component {}", component.wireName());
                return false;
            }
            Instant now = clock.instant();
            if (record.lastRecoveryTime != null
                    && Duration.between(record.lastRecoveryTime, now).compareTo(settings.recoveryBackoff()) < 0) {
                log.debug("Recovery backoff time not elapsed for component {}", component.wireName());
                return false;
            }
            record.recoveryAttempts++;
            record.lastRecoveryTime = now;
            record.status = ComponentStatus.RECOVERING;
            attempt = record.recoveryAttempts;
        } finally {
            lock.unlock();
        }

        log.info("Attempting recovery for component {} (attempt {})", component.wireName(), attempt);
        boolean success;
        try {
            success = probe.recover();
        } catch (Exception e) {
            log.error("Error during recovery for component {}", component.wireName(), e);
            success = false;
        }

        lock.lock();
        try {
            ComponentRecord record = records.get(component);
            if (success) {
                record.recoveryAttempts = 0;
                record.markHealthy();
            } else {
                record.status = ComponentStatus.FAILED;
            }
        } finally {
            lock.unlock();
        }
        metricsService.recordRecoveryAttempt(component.wireName(), success);
        if (success) {
            log.info("Recovery successful for component {}", component.wireName());
        } else {
            log.warn("Recovery failed for component {}", component.wireName());
        }
        return success;
    }

    private void continueRecovery(SupervisedComponent component) {
        ComponentProbe probe = probes.get(component);
        ComponentStatus status;
        try {
            status = probe != null ? probe.check() : ComponentStatus.FAILED;
        } catch (Exception e) {
            log.error("Error re-checking component {}", component.wireName(), e);
            status = ComponentStatus.FAILED;
        }
        if (status == ComponentStatus.HEALTHY) {
            lock.lock();
            try {
                ComponentRecord record = records.get(component);
                if (record.status != ComponentStatus.RECOVERING) {
                    return;
                }
                record.recoveryAttempts = 0;
                record.markHealthy();
            } finally {
                lock.unlock();
            }
            log.info("Component {} has recovered", component.wireName());
        } else {
            attemptRecovery(component);
        }
    }

    private List<SupervisedComponent> componentsIn(List<ComponentStatus> statuses, boolean criticalOnly) {
        lock.lock();
        try {
            List<SupervisedComponent> matching = new ArrayList<>();
            for (ComponentRecord record : records.values()) {
                if ((!criticalOnly || record.component.isCritical()) && statuses.contains(record.status)) {
                    matching.add(record.component);
                }
            }
            return matching;
        } finally {
            lock.unlock();
        }
    }

    private void sendNotification(String message) {
        log.info("Notification: {}", message);
        try {
            notifier.sendMessage(message);
        } catch (Exception e) {
            log.error("Error sending notification", e);
        }
    }

    public FailoverState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public FailoverSettings getSettings() {
        lock.lock();
        try {
            return settings;
        } finally {
            lock.unlock();
        }
    }

    public FailoverStatusView getFailoverStatus() {
        lock.lock();
        try {
            Map<String, ComponentStatusView> components = new LinkedHashMap<>();
            Map<String, Integer> attempts = new LinkedHashMap<>();
            for (ComponentRecord record : records.values()) {
                components.put(record.component.wireName(), record.toView(probes.containsKey(record.component)));
                attempts.put(record.component.wireName(), record.recoveryAttempts);
            }
            return new FailoverStatusView(state, isRunning(), shutdownTriggered, components, attempts, settings);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ComponentStatusView> getComponentStatus(String name) {
        return SupervisedComponent.fromName(name).map(component -> {
            lock.lock();
            try {
                return records.get(component).toView(probes.containsKey(component));
            } finally {
                lock.unlock();
            }
        });
    }

    /**
     * Operator reset: HEALTHY, counters cleared. The recovery backoff clock is left as is.
     */
    public boolean resetComponent(String name) {
        Optional<SupervisedComponent> component = SupervisedComponent.fromName(name);
        if (component.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            ComponentRecord record = records.get(component.get());
            record.markHealthy();
            record.recoveryAttempts = 0;
        } finally {
            lock.unlock();
        }
        log.info("Component {} reset", component.get().wireName());
        return true;
    }

    public FailoverSettings updateFailoverConfig(FailoverConfigUpdate update) {
        lock.lock();
        try {
            settings = settings.merge(update);
            log.info("Failover configuration updated: {}", settings);
            return settings;
        } finally {
            lock.unlock();
        }
    }
}
