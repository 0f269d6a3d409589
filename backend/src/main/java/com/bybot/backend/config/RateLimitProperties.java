package com.bybot.backend.config;

import com.bybot.backend.service.ratelimit.LimitDefinition;
import com.bybot.backend.service.ratelimit.RateLimitKeys;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "bybot.rate-limit")
@Data
@Validated
public class RateLimitProperties {

    /**
     * Longest a guarded exchange call may wait for tokens before it is rejected.
     */
    @NotNull
    private Duration blockTimeout = Duration.ofSeconds(5);

    @Valid
    private Map<String, Limit> limits = defaultLimits();

    @Data
    @NoArgsConstructor
    public static class Limit {
        @Positive
        private double maxTokens;

        @NotNull
        private Duration interval;

        Limit(double maxTokens, Duration interval) {
            this.maxTokens = maxTokens;
            this.interval = interval;
        }
    }

    public Map<String, LimitDefinition> toDefinitions() {
        Map<String, LimitDefinition> definitions = new LinkedHashMap<>();
        limits.forEach((key, limit) -> definitions.put(key, new LimitDefinition(limit.getMaxTokens(), limit.getInterval())));
        return definitions;
    }

    private static Map<String, Limit> defaultLimits() {
        Map<String, Limit> limits = new LinkedHashMap<>();
        RateLimitKeys.exchangeDefaults()
                .forEach((key, definition) -> limits.put(key, new Limit(definition.maxTokens(), definition.interval())));
        return limits;
    }
}
