package com.example.fundraisingdashboard.exception;

/**
 * Base of every failure the change pipeline reports back to its callers.
 */
public class DataOperationException extends RuntimeException {

    public DataOperationException(String message) {
        super(message);
    }

    public DataOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
