package com.example.fundraisingdashboard.exception;

/**
 * The command could not be mapped onto the operation vocabulary.
 */
public class CommandParseException extends DataOperationException {

    public CommandParseException(String message) {
        super(message);
    }
}
