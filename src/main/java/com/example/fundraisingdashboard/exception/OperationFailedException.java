package com.example.fundraisingdashboard.exception;

/**
 * None of the records an operation addressed could be applied.
 */
public class OperationFailedException extends DataOperationException {

    public OperationFailedException(String message) {
        super(message);
    }
}
