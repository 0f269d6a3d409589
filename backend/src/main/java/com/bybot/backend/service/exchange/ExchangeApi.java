package com.bybot.backend.service.exchange;

import java.util.Map;

/**
 * Remote exchange reached by method name, e.g. {@code get_server_time} or {@code place_order}.
 */
public interface ExchangeApi {

    ExchangeResponse call(String method, Map<String, Object> params);

    default ExchangeResponse call(String method) {
        return call(method, Map.of());
    }

    /**
     * One attempt with no retry backoff, for callers that must return within a bounded time.
     */
    default ExchangeResponse callOnce(String method, Map<String, Object> params) {
        return call(method, params);
    }
}
