package com.liquidity.backend.exception;

/**
 * Failure of an external indicator API call. {@code statusCode} is the HTTP-like status or -1 when
 * the call never produced one (connection reset, timeout).
 */
public class IndicatorFetchException extends RuntimeException {
    private final int statusCode;
    private final boolean retryable;

    public IndicatorFetchException(String message) {
        this(message, -1, false, null);
    }

    public IndicatorFetchException(String message, int statusCode) {
        this(message, statusCode, false, null);
    }

    public IndicatorFetchException(String message, boolean retryable, Throwable cause) {
        this(message, -1, retryable, cause);
    }

    public IndicatorFetchException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
