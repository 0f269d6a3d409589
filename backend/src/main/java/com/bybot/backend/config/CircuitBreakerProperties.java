package com.bybot.backend.config;

import com.bybot.backend.service.circuit.CircuitBreakerSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "bybot.circuit-breaker")
@Data
@Validated
public class CircuitBreakerProperties {

    @Min(1)
    private int errorThreshold = CircuitBreakerSettings.DEFAULTS.errorThreshold();

    @NotNull
    private Duration errorTimeout = CircuitBreakerSettings.DEFAULTS.errorTimeout();

    @NotNull
    private Duration circuitTimeout = CircuitBreakerSettings.DEFAULTS.circuitTimeout();

    public CircuitBreakerSettings toSettings() {
        return new CircuitBreakerSettings(errorThreshold, errorTimeout, circuitTimeout);
    }
}
