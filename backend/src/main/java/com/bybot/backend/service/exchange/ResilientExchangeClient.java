package com.bybot.backend.service.exchange;

import com.bybot.backend.service.MetricsService;
import com.bybot.backend.service.circuit.CircuitBreaker;
import com.bybot.backend.service.circuit.CircuitBreakerRegistry;
import com.bybot.backend.service.ratelimit.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Guards every exchange call: rate limit by call class, then the per-method circuit, then the
 * delegate. Exceptions from the delegate never escape; they become {@code ERROR} responses and
 * count against the circuit, as do {@code ERROR} responses themselves.
 */
@Slf4j
public class ResilientExchangeClient implements ExchangeApi {

    private final ExchangeApi delegate;
    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;
    private final Duration rateLimitTimeout;

    public ResilientExchangeClient(ExchangeApi delegate, RateLimiter rateLimiter, CircuitBreakerRegistry circuitBreakers,
                                   MetricsService metricsService, MeterRegistry meterRegistry, Duration rateLimitTimeout) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.circuitBreakers = circuitBreakers;
        this.metricsService = metricsService;
        this.meterRegistry = meterRegistry;
        this.rateLimitTimeout = rateLimitTimeout;
    }

    @Override
    public ExchangeResponse call(String method, Map<String, Object> params) {
        return guarded(method, params, delegate::call);
    }

    @Override
    public ExchangeResponse callOnce(String method, Map<String, Object> params) {
        return guarded(method, params, delegate::callOnce);
    }

    private ExchangeResponse guarded(String method, Map<String, Object> params,
                                     BiFunction<String, Map<String, Object>, ExchangeResponse> invocation) {
        String limitKey = ExchangeEndpoints.rateLimitKey(method);
        if (!rateLimiter.limit(limitKey, 1, true, rateLimitTimeout)) {
            log.warn("Exchange call rejected by rate limiter method={} key={}", method, limitKey);
            metricsService.recordRateLimitRejection(limitKey);
            return ExchangeResponse.rateLimited(method);
        }
        CircuitBreaker breaker = circuitBreakers.getCircuitBreaker(method);
        if (!breaker.allowRequest()) {
            log.warn("Exchange call short-circuited method={} state={}", method, breaker.getState());
            return ExchangeResponse.circuitOpen(method);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        ExchangeResponse response;
        try {
            response = invocation.apply(method, params);
            if (response == null) {
                response = ExchangeResponse.error(ExchangeResponse.LOCAL_ERROR_CODE, "Empty response from exchange");
            }
        } catch (Exception e) {
            log.error("Exchange call failed method={} message={}", method, e.getMessage(), e);
            response = ExchangeResponse.error(ExchangeResponse.LOCAL_ERROR_CODE, e.getMessage());
        }

        if (response.isOk()) {
            breaker.recordSuccess();
        } else {
            breaker.recordError();
            metricsService.incrementExchangeFailures();
        }
        sample.stop(Timer.builder("exchange_call_latency")
                .tag("method", method)
                .tag("status", response.isOk() ? "success" : "error")
                .register(meterRegistry));
        return response;
    }

    /**
     * Server time in epoch milliseconds, or empty when the exchange could not be reached. Makes a
     * single attempt so a health check is bounded by the HTTP timeouts.
     */
    public Optional<Long> getServerTime() {
        ExchangeResponse response = callOnce(ExchangeEndpoints.GET_SERVER_TIME, Map.of());
        if (!response.isOk()) {
            return Optional.empty();
        }
        String nanos = response.result().path("timeNano").asText("");
        if (!nanos.isEmpty()) {
            try {
                return Optional.of(Long.parseLong(nanos) / 1_000_000L);
            } catch (NumberFormatException e) {
                log.warn("Unparseable server time timeNano={}", nanos);
            }
        }
        long seconds = response.result().path("timeSecond").asLong(0);
        return seconds > 0 ? Optional.of(seconds * 1000L) : Optional.empty();
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }
}
