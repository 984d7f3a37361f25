package com.ledgerlens.backend.exceptions;

/**
 * A chunk failed after earlier chunks may already be committed. Committed rows are not rolled back.
 */
public class ChunkUploadException extends ImportException {

    private final int committedRows;

    public ChunkUploadException(String message, int committedRows, Throwable cause) {
        super(message, cause);
        this.committedRows = committedRows;
    }

    public int getCommittedRows() {
        return committedRows;
    }
}
