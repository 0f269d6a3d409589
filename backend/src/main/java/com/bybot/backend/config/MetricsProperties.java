package com.bybot.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "bybot.metrics")
@Data
@Validated
public class MetricsProperties {

    private boolean enabled = true;

    @Min(100)
    private long collectionIntervalMs = 10_000;

    @NotNull
    private Duration retention = Duration.ofDays(7);

    @Min(1)
    private int maxPoints = 10_000;
}
