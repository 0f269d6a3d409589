package com.bybot.backend.service.metrics;

import java.time.Duration;
import java.util.Arrays;

public enum StatisticsPeriod {
    ONE_HOUR("1h", Duration.ofHours(1)),
    ONE_DAY("1d", Duration.ofDays(1)),
    SEVEN_DAYS("7d", Duration.ofDays(7)),
    THIRTY_DAYS("30d", Duration.ofDays(30));

    private final String code;
    private final Duration window;

    StatisticsPeriod(String code, Duration window) {
        this.code = code;
        this.window = window;
    }

    public String code() {
        return code;
    }

    public Duration window() {
        return window;
    }

    /**
     * Unknown or missing codes fall back to one day.
     */
    public static StatisticsPeriod fromCode(String code) {
        return Arrays.stream(values())
                .filter(period -> period.code.equalsIgnoreCase(code))
                .findFirst()
                .orElse(ONE_DAY);
    }
}
