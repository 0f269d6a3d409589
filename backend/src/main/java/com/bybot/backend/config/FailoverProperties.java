package com.bybot.backend.config;

import com.bybot.backend.service.failover.FailoverSettings;
import com.bybot.backend.service.failover.probe.DataStreamProbe;
import com.bybot.backend.service.failover.probe.StrategyEngineProbe;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "bybot.failover")
@Data
@Validated
public class FailoverProperties {

    private boolean enabled = true;
    private boolean autoRecovery = true;

    @Min(0)
    private int maxRecoveryAttempts = 3;

    @NotNull
    private Duration recoveryBackoff = Duration.ofSeconds(60);

    private boolean emergencyShutdown = true;
    private boolean notificationEnabled = true;

    @NotNull
    private Duration checkInterval = Duration.ofSeconds(30);

    /**
     * Terminate the JVM after the context closes on emergency shutdown.
     */
    private boolean exitJvmOnShutdown = true;

    @NotNull
    private Duration dataStreamStaleAfter = DataStreamProbe.DEFAULT_STALE_AFTER;

    @NotNull
    private Duration strategySignalTimeout = StrategyEngineProbe.DEFAULT_SIGNAL_TIMEOUT;

    public FailoverSettings toSettings() {
        return new FailoverSettings(enabled, autoRecovery, maxRecoveryAttempts, recoveryBackoff,
                emergencyShutdown, notificationEnabled, checkInterval);
    }
}
