package com.bybot.backend.service.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public record ExchangeResponse(Status status, int retCode, String message, JsonNode result) {

    public enum Status {
        OK,
        ERROR,
        RATE_LIMITED,
        CIRCUIT_OPEN
    }

    public static final int LOCAL_ERROR_CODE = -1;

    public static ExchangeResponse ok(JsonNode result) {
        return new ExchangeResponse(Status.OK, 0, "OK", result == null ? NullNode.getInstance() : result);
    }

    public static ExchangeResponse error(int retCode, String message) {
        return new ExchangeResponse(Status.ERROR, retCode, message, NullNode.getInstance());
    }

    public static ExchangeResponse rateLimited(String method) {
        return new ExchangeResponse(Status.RATE_LIMITED, LOCAL_ERROR_CODE,
                "Rate limit exceeded for " + method, NullNode.getInstance());
    }

    public static ExchangeResponse circuitOpen(String method) {
        return new ExchangeResponse(Status.CIRCUIT_OPEN, LOCAL_ERROR_CODE,
                "Service unavailable, circuit open for " + method, NullNode.getInstance());
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
