package com.example.fundraisingdashboard.exception;

/**
 * The tabular store rejected a read or a write.
 */
public class StoreAccessException extends DataOperationException {

    public StoreAccessException(String message) {
        super(message);
    }

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
