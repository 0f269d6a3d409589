package com.bybot.backend.service.lifecycle;

import com.bybot.backend.service.failover.ShutdownHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes the application context and exits the JVM with status 1. Runs on its own thread so the
 * caller (the failover loop) is not asked to join itself while the context shuts down.
 */
@Slf4j
public class ApplicationShutdownHandler implements ShutdownHandler {

    static final int EXIT_CODE = 1;

    private final ConfigurableApplicationContext context;
    private final boolean exitJvm;
    private final AtomicBoolean requested = new AtomicBoolean(false);

    public ApplicationShutdownHandler(ConfigurableApplicationContext context, boolean exitJvm) {
        this.context = context;
        this.exitJvm = exitJvm;
    }

    @Override
    public void shutdown(String reason) {
        if (!requested.compareAndSet(false, true)) {
            log.warn("Shutdown already requested, ignoring reason={}", reason);
            return;
        }
        log.error("Emergency shutdown requested reason={}", reason);
        Thread thread = new Thread(() -> {
            int code = SpringApplication.exit(context, () -> EXIT_CODE);
            if (exitJvm) {
                System.exit(code);
            }
        }, "emergency-shutdown");
        thread.setDaemon(false);
        thread.start();
    }

    public boolean isRequested() {
        return requested.get();
    }
}
