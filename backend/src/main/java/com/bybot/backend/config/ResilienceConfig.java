package com.bybot.backend.config;

import com.bybot.backend.exception.ExchangeApiException;
import com.bybot.backend.exception.ExchangeRateLimitException;
import com.bybot.backend.service.MetricsService;
import com.bybot.backend.service.circuit.CircuitBreakerRegistry;
import com.bybot.backend.service.ratelimit.RateLimiter;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    public RateLimiter rateLimiter(RateLimitProperties properties) {
        return new RateLimiter(properties.toDefinitions());
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerProperties properties, Clock clock,
                                                         MetricsService metricsService) {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(properties.toSettings(), clock);
        registry.addTransitionListener((name, from, to) -> {
            log.info("Circuit '{}' transitioned {} -> {}", name, from, to);
            metricsService.recordCircuitTransition(name, from, to);
        });
        return registry;
    }

    /**
     * Exponential backoff for transient exchange failures. Business errors (non-zero retCode other
     * than the rate-limit code) are returned, not thrown, so they are never retried.
     */
    @Bean
    public Retry exchangeRetry(ExchangeProperties properties) {
        ExchangeProperties.Retry retry = properties.getRetry();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialBackoff(
                Duration.ofMillis(retry.getBaseDelayMs()),
                retry.getMultiplier()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryOnException(ResilienceConfig::isTransient)
                .build();
        Retry exchangeRetry = Retry.of("exchange", config);
        exchangeRetry.getEventPublisher().onRetry(event ->
                log.warn("Exchange call failed, retrying attempt={} wait={} cause={}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));
        return exchangeRetry;
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof ExchangeRateLimitException || throwable instanceof ResourceAccessException) {
            return true;
        }
        return throwable instanceof ExchangeApiException apiException
                && apiException.isRetryable();
    }
}
