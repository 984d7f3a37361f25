package com.ledgerlens.backend.services.imports.upload;

/**
 * Receives upload progress as a percentage, once per completed window of chunks.
 */
@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = progress -> { };

    void onProgress(int percent);
}
