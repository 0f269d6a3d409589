package com.bybot.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "bybot.exchange")
@Data
@Validated
public class ExchangeProperties {

    @NotBlank
    private String baseUrl = "https://api.bybit.com";

    private String apiKey = "";
    private String apiSecret = "";

    @Positive
    private long recvWindowMs = 5000;

    @Valid
    private Http http = new Http();

    @Valid
    private Retry retry = new Retry();

    @Data
    public static class Http {
        @Positive
        private int connectTimeoutMs = 10_000;

        @Positive
        private int readTimeoutMs = 10_000;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @Positive
        private long baseDelayMs = 5_000;

        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }
}
