package com.bybot.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Keeps a scheduled job alive across failures: errors are logged and counted, never rethrown.
 */
@Service
@Slf4j
public class ScheduledTaskGuard {

    private final ConcurrentHashMap<String, AtomicLong> failuresByTask = new ConcurrentHashMap<>();

    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (Throwable t) {
            long failures = failuresByTask.computeIfAbsent(taskName, key -> new AtomicLong()).incrementAndGet();
            log.error("Scheduled task failed task={} failures={}", taskName, failures, t);
            return false;
        }
    }

    public Map<String, Long> failureCounts() {
        return Map.copyOf(failuresByTask.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get())));
    }
}
