package com.bybot.backend.service.failover;

@FunctionalInterface
public interface ShutdownHandler {

    void shutdown(String reason);
}
