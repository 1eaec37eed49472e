package com.marketdata.jobs.exception;

/**
 * Failure reported by an upstream data provider.
 * The HTTP status is null when the call never produced a response
 * (timeouts, connection errors, unexpected exceptions).
 */
public class ProviderException extends RuntimeException {

    private final Integer statusCode;

    public ProviderException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Whether a failure with this status is worth retrying: no status, 401, 429 or 5xx.
     */
    public static boolean isTransient(Integer statusCode) {
        return statusCode == null || statusCode == 401 || statusCode == 429 || statusCode >= 500;
    }
}
