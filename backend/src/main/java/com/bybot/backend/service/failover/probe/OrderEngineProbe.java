package com.bybot.backend.service.failover.probe;

import com.bybot.backend.service.failover.ComponentProbe;
import com.bybot.backend.service.failover.ComponentStatus;
import com.bybot.backend.service.failover.SupervisedComponent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class OrderEngineProbe implements ComponentProbe {

    private final OrderEngine engine;

    @Override
    public SupervisedComponent component() {
        return SupervisedComponent.ORDER_ENGINE;
    }

    @Override
    public ComponentStatus check() {
        try {
            return engine.canPlaceOrders() ? ComponentStatus.HEALTHY : ComponentStatus.CRITICAL;
        } catch (Exception e) {
            log.error("Error checking order engine", e);
            return ComponentStatus.FAILED;
        }
    }

    @Override
    public boolean recover() {
        try {
            engine.reinitialize();
            return true;
        } catch (Exception e) {
            log.error("Error recovering order engine", e);
            return false;
        }
    }
}
