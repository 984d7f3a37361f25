package com.ledgerlens.backend.exceptions;

/**
 * Base type for failures that abort a whole import. Row-level defects never raise one of these.
 */
public class ImportException extends RuntimeException {

    public ImportException(String message) {
        super(message);
    }

    public ImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
