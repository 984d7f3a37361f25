package com.ledgerlens.backend.services.imports.upload;

/**
 * Identifies the uploaded file a chunk came from. Both parts may be null for ad-hoc writes.
 */
public record BatchFileId(String filename, String fileHash) {

    public boolean isPresent() {
        return filename != null && !filename.isBlank() && fileHash != null && !fileHash.isBlank();
    }
}
