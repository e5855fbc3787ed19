package com.whereq.governor.exception;

/**
 * Exception thrown when the metrics source fails or does not answer in time.
 * The governor recovers by reusing the last known snapshot.
 */
public class MetricsUnavailableException extends GovernorException {
    public MetricsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
