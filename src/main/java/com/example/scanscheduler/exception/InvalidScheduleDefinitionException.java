package com.example.scanscheduler.exception;

import lombok.Getter;

/**
 * Exception for a frequency/time spec combination that cannot produce run times
 */
@Getter
public class InvalidScheduleDefinitionException extends RuntimeException {

    private final String field;

    public InvalidScheduleDefinitionException(String message) {
        super(message);
        this.field = null;
    }

    public InvalidScheduleDefinitionException(String field, String message) {
        super(String.format("Invalid %s: %s", field, message));
        this.field = field;
    }

    public InvalidScheduleDefinitionException(String field, String message, Throwable cause) {
        super(String.format("Invalid %s: %s", field, message), cause);
        this.field = field;
    }
}
