package com.bybot.backend.config;

import com.bybot.backend.service.failover.FailoverManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        log.error("FATAL Startup failure. Root cause: {}", root.getMessage(), exception);
    }

    /**
     * Failover supervision runs only between application ready and context close.
     */
    @Component
    @Slf4j
    @RequiredArgsConstructor
    public static class SupervisionLifecycle {

        private final FailoverManager failoverManager;

        @EventListener
        public void onReady(ApplicationReadyEvent event) {
            boolean started = failoverManager.start();
            log.info("Application ready, failover supervision {}", started ? "started" : "not started");
        }

        @EventListener
        public void onClosed(ContextClosedEvent event) {
            if (failoverManager.isRunning()) {
                failoverManager.stop();
            }
        }
    }

    private Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
