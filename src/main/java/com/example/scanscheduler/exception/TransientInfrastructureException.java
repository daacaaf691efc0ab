package com.example.scanscheduler.exception;

/**
 * The schedule store or lease store could not be reached.
 * Callers log it and retry on the next cycle.
 */
public class TransientInfrastructureException extends RuntimeException {

    public TransientInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
