package com.bybot.backend.service.failover;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of components the failover manager watches. Critical components drive EMERGENCY,
 * the others only DEGRADED.
 */
public enum SupervisedComponent {
    API_CLIENT("api_client", true),
    DATA_STREAM("data_stream", false),
    STRATEGY_ENGINE("strategy_engine", true),
    ORDER_ENGINE("order_engine", true),
    PERSISTENCE("persistence", false);

    private final String wireName;
    private final boolean critical;

    SupervisedComponent(String wireName, boolean critical) {
        this.wireName = wireName;
        this.critical = critical;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isCritical() {
        return critical;
    }

    public static Optional<SupervisedComponent> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(component -> component.wireName.equalsIgnoreCase(name) || component.name().equalsIgnoreCase(name))
                .findFirst();
    }
}
