package com.example.fundraisingdashboard.exception;

/**
 * A table/action combination no handler supports. Raised before any snapshot or write.
 */
public class UnknownTargetException extends DataOperationException {

    public UnknownTargetException(String message) {
        super(message);
    }
}
