package com.example.fundraisingdashboard.exception;

/**
 * Revert of an unknown, evicted or already reverted change.
 */
public class RevertIneligibleException extends DataOperationException {

    public RevertIneligibleException(String message) {
        super(message);
    }
}
