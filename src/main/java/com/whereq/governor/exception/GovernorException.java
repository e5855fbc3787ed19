package com.whereq.governor.exception;

/**
 * Base class for every error the governor reports to its immediate caller
 */
public class GovernorException extends RuntimeException {
    public GovernorException(String message) {
        super(message);
    }

    public GovernorException(String message, Throwable cause) {
        super(message, cause);
    }
}
