package com.bybot.backend.config;

import com.bybot.backend.service.MetricsService;
import com.bybot.backend.service.circuit.CircuitBreakerRegistry;
import com.bybot.backend.service.exchange.BybitRestExchangeApi;
import com.bybot.backend.service.exchange.ResilientExchangeClient;
import com.bybot.backend.service.notification.TelegramNotifier;
import com.bybot.backend.service.ratelimit.RateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class ExchangeHttpConfig {

    @Bean
    public RestTemplate exchangeRestTemplate(ExchangeProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(properties.getHttp().getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    @Bean
    public BybitRestExchangeApi bybitRestExchangeApi(RestTemplate exchangeRestTemplate, ExchangeProperties properties,
                                                     Retry exchangeRetry, ObjectMapper objectMapper, Clock clock) {
        return new BybitRestExchangeApi(exchangeRestTemplate, properties, exchangeRetry, objectMapper, clock);
    }

    @Bean
    public ResilientExchangeClient resilientExchangeClient(BybitRestExchangeApi bybitRestExchangeApi, RateLimiter rateLimiter,
                                                           CircuitBreakerRegistry circuitBreakerRegistry,
                                                           MetricsService metricsService, MeterRegistry meterRegistry,
                                                           RateLimitProperties rateLimitProperties) {
        return new ResilientExchangeClient(bybitRestExchangeApi, rateLimiter, circuitBreakerRegistry,
                metricsService, meterRegistry, rateLimitProperties.getBlockTimeout());
    }

    @Bean
    public TelegramNotifier telegramNotifier(RestTemplate exchangeRestTemplate, TelegramProperties properties) {
        return new TelegramNotifier(exchangeRestTemplate, properties);
    }
}
