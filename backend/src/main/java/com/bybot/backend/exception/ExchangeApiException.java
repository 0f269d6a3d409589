package com.bybot.backend.exception;

/**
 * Transport or HTTP-level failure talking to the exchange. {@code httpStatus} is
 * {@link #NO_HTTP_STATUS} when no response was received or it could not be parsed.
 */
public class ExchangeApiException extends RuntimeException {

    public static final int NO_HTTP_STATUS = -1;

    private final int httpStatus;

    public ExchangeApiException(String message) {
        this(message, NO_HTTP_STATUS, null);
    }

    public ExchangeApiException(String message, Throwable cause) {
        this(message, NO_HTTP_STATUS, cause);
    }

    public ExchangeApiException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isServerError() {
        return httpStatus >= 500;
    }

    /**
     * Server errors and failures without a usable response are worth another attempt.
     */
    public boolean isRetryable() {
        return isServerError() || httpStatus == NO_HTTP_STATUS;
    }
}
