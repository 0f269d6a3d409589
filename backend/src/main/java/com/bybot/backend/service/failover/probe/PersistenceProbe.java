package com.bybot.backend.service.failover.probe;

import com.bybot.backend.service.failover.ComponentProbe;
import com.bybot.backend.service.failover.ComponentStatus;
import com.bybot.backend.service.failover.SupervisedComponent;
import com.bybot.backend.service.metrics.MetricsSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reachability of the metrics store.
 */
@Slf4j
@RequiredArgsConstructor
public class PersistenceProbe implements ComponentProbe {

    private final MetricsSink sink;

    @Override
    public SupervisedComponent component() {
        return SupervisedComponent.PERSISTENCE;
    }

    @Override
    public ComponentStatus check() {
        try {
            return sink.isAvailable() ? ComponentStatus.HEALTHY : ComponentStatus.FAILED;
        } catch (Exception e) {
            log.error("Error checking metrics store", e);
            return ComponentStatus.FAILED;
        }
    }

    @Override
    public boolean recover() {
        try {
            return sink.isAvailable();
        } catch (Exception e) {
            log.error("Error recovering metrics store", e);
            return false;
        }
    }
}
