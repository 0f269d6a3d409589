package com.bybot.backend.service.exchange;

import com.bybot.backend.config.ExchangeProperties;
import com.bybot.backend.exception.ExchangeApiException;
import com.bybot.backend.exception.ExchangeRateLimitException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * RestTemplate client for the v5 REST API. Transport failures are retried by the injected
 * {@link Retry}, except through {@link #callOnce}; whatever survives propagates to the caller.
 */
@Slf4j
public class BybitRestExchangeApi implements ExchangeApi {

    static final int RATE_LIMIT_RET_CODE = 10006;

    private static final String HEADER_API_KEY = "X-BAPI-API-KEY";
    private static final String HEADER_TIMESTAMP = "X-BAPI-TIMESTAMP";
    private static final String HEADER_RECV_WINDOW = "X-BAPI-RECV-WINDOW";
    private static final String HEADER_SIGN = "X-BAPI-SIGN";

    private final RestTemplate restTemplate;
    private final ExchangeProperties properties;
    private final Retry retry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BybitRestExchangeApi(RestTemplate restTemplate, ExchangeProperties properties, Retry retry,
                                ObjectMapper objectMapper, Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.retry = retry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ExchangeResponse call(String method, Map<String, Object> params) {
        return execute(method, params, true);
    }

    @Override
    public ExchangeResponse callOnce(String method, Map<String, Object> params) {
        return execute(method, params, false);
    }

    private ExchangeResponse execute(String method, Map<String, Object> params, boolean retried) {
        ExchangeEndpoints.Route route = ExchangeEndpoints.find(method).orElse(null);
        if (route == null) {
            log.warn("Unknown exchange method={}", method);
            return ExchangeResponse.error(ExchangeResponse.LOCAL_ERROR_CODE, "Unknown exchange method: " + method);
        }
        if (route.signed() && !properties.hasCredentials()) {
            log.error("Missing exchange credentials for signed method={}", method);
            return ExchangeResponse.error(ExchangeResponse.LOCAL_ERROR_CODE, "Exchange credentials are not configured");
        }
        Map<String, Object> safeParams = params == null ? Map.of() : params;
        Supplier<JsonNode> request = () -> doRequest(method, route, safeParams);
        JsonNode body = retried ? Retry.decorateSupplier(retry, request).get() : request.get();

        int retCode = body.path("retCode").asInt(ExchangeResponse.LOCAL_ERROR_CODE);
        if (retCode != 0) {
            String message = body.path("retMsg").asText("Unknown error");
            log.error("Exchange call failed method={} retCode={} retMsg={}", method, retCode, message);
            return ExchangeResponse.error(retCode, message);
        }
        log.debug("Exchange call succeeded method={}", method);
        return ExchangeResponse.ok(body.path("result"));
    }

    private JsonNode doRequest(String method, ExchangeEndpoints.Route route, Map<String, Object> params) {
        String baseUrl = properties.getBaseUrl() + route.path();
        HttpHeaders headers = new HttpHeaders();
        String url;
        String body = null;
        if (route.httpMethod() == HttpMethod.GET) {
            String query = queryString(params);
            url = query.isEmpty() ? baseUrl : baseUrl + "?" + query;
            if (route.signed()) {
                sign(headers, query);
            }
        } else {
            url = baseUrl;
            body = toJson(params);
            headers.setContentType(MediaType.APPLICATION_JSON);
            if (route.signed()) {
                sign(headers, body);
            }
        }
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    UriComponentsBuilder.fromHttpUrl(url).build(true).toUri(),
                    route.httpMethod(), new HttpEntity<>(body, headers), String.class);
            JsonNode parsed = parse(response.getBody());
            if (parsed.path("retCode").asInt() == RATE_LIMIT_RET_CODE) {
                log.warn("Exchange rate limit retCode={} for method={}", RATE_LIMIT_RET_CODE, method);
                throw new ExchangeRateLimitException("Exchange rate limit for " + method);
            }
            return parsed;
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Exchange rate limit 429 for method={}: {}", method, e.getMessage());
            throw new ExchangeRateLimitException("Exchange rate limit for " + method, e);
        } catch (HttpServerErrorException e) {
            throw new ExchangeApiException("Exchange server error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            throw new ExchangeApiException("Exchange API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        }
    }

    private void sign(HttpHeaders headers, String payload) {
        String timestamp = String.valueOf(clock.millis());
        String recvWindow = String.valueOf(properties.getRecvWindowMs());
        String preSign = timestamp + properties.getApiKey() + recvWindow + payload;
        headers.set(HEADER_API_KEY, properties.getApiKey());
        headers.set(HEADER_TIMESTAMP, timestamp);
        headers.set(HEADER_RECV_WINDOW, recvWindow);
        headers.set(HEADER_SIGN, hmacSha256(properties.getApiSecret(), preSign));
    }

    static String hmacSha256(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    // Sorted so the signed payload matches the query actually sent.
    static String queryString(Map<String, Object> params) {
        return new TreeMap<>(params).entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
    }

    private String toJson(Map<String, Object> params) {
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable exchange parameters", e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ExchangeApiException("Empty response from exchange");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeApiException("Malformed response from exchange", e);
        }
    }
}
