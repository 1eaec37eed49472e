package com.marketdata.jobs.exception;

/**
 * Thrown when a job configuration cannot be turned into a trigger.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
