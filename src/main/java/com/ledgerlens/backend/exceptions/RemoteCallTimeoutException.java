package com.ledgerlens.backend.exceptions;

public class RemoteCallTimeoutException extends ImportException {

    public RemoteCallTimeoutException(String operation, long timeoutMillis, Throwable cause) {
        super(operation + " timed out after " + timeoutMillis + " ms", cause);
    }
}
