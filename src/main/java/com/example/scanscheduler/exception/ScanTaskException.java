package com.example.scanscheduler.exception;

import lombok.Getter;

/**
 * Exception for scan service communication failures
 */
@Getter
public class ScanTaskException extends RuntimeException {

    private final Integer httpStatusCode;
    private final String responseBody;

    public ScanTaskException(String message) {
        super(message);
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ScanTaskException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ScanTaskException(int httpStatusCode, String responseBody) {
        super(String.format("Scan service HTTP %d: %s", httpStatusCode, responseBody));
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }
}
