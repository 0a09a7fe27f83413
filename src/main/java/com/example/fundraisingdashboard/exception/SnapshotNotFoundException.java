package com.example.fundraisingdashboard.exception;

/**
 * The requested backup snapshot does not exist (never taken or evicted).
 */
public class SnapshotNotFoundException extends DataOperationException {

    public SnapshotNotFoundException(String message) {
        super(message);
    }
}
