package com.bybot.backend.service.failover;

@FunctionalInterface
public interface Notifier {

    /**
     * Best effort; implementations log delivery failures instead of throwing.
     */
    void sendMessage(String message);
}
