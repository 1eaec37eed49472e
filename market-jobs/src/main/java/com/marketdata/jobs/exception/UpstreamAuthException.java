package com.marketdata.jobs.exception;

/**
 * Thrown when the upstream access token cannot be obtained.
 */
public class UpstreamAuthException extends RuntimeException {

    public UpstreamAuthException(String message) {
        super(message);
    }

    public UpstreamAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
