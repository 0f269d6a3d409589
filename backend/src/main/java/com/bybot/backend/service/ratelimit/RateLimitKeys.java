package com.bybot.backend.service.ratelimit;

import java.util.LinkedHashMap;
import java.util.Map;

public final class RateLimitKeys {

    public static final String DEFAULT = "default";
    public static final String ORDER = "order";
    public static final String POSITION = "position";
    public static final String MARKET = "market";
    public static final String ACCOUNT = "account";

    private RateLimitKeys() {
    }

    /**
     * Per-class budgets of the exchange's v5 REST API, in calls per 10 seconds.
     */
    public static Map<String, LimitDefinition> exchangeDefaults() {
        Map<String, LimitDefinition> limits = new LinkedHashMap<>();
        limits.put(DEFAULT, LimitDefinition.of(100, 10));
        limits.put(ORDER, LimitDefinition.of(50, 10));
        limits.put(POSITION, LimitDefinition.of(50, 10));
        limits.put(MARKET, LimitDefinition.of(120, 10));
        limits.put(ACCOUNT, LimitDefinition.of(60, 10));
        return limits;
    }
}
