package com.example.fundraisingdashboard.exception;

/**
 * Confirm or cancel against an id that is unknown, already consumed or expired.
 */
public class ConfirmationMissException extends DataOperationException {

    public ConfirmationMissException(String message) {
        super(message);
    }
}
