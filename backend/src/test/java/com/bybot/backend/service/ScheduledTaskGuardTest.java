package com.bybot.backend.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledTaskGuardTest {

    @Test
    void failuresAreCountedPerTaskAndNotRethrown() {
        ScheduledTaskGuard guard = new ScheduledTaskGuard();

        assertThat(guard.run("metrics-collection", () -> { })).isTrue();
        assertThat(guard.run("metrics-collection", () -> {
            throw new IllegalStateException("db down");
        })).isFalse();
        assertThat(guard.run("metrics-collection", () -> {
            throw new IllegalStateException("db down");
        })).isFalse();

        assertThat(guard.failureCounts()).containsExactly(Map.entry("metrics-collection", 2L));
    }
}
