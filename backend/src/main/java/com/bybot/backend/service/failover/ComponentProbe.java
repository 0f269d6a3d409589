package com.bybot.backend.service.failover;

/**
 * Health check and recovery hook for one supervised component. Implementations should catch their
 * own failures and report FAILED or CRITICAL; anything thrown is treated as FAILED.
 */
public interface ComponentProbe {

    SupervisedComponent component();

    ComponentStatus check();

    /**
     * @return true if the component is usable again
     */
    boolean recover();
}
