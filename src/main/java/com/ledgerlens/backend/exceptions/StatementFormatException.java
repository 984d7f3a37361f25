package com.ledgerlens.backend.exceptions;

public class StatementFormatException extends ImportException {

    public StatementFormatException(String message) {
        super(message);
    }

    public StatementFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
