package com.ledgerlens.backend.services.imports.upload;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.exceptions.ChunkUploadException;
import com.ledgerlens.backend.exceptions.RemoteCallTimeoutException;
import com.ledgerlens.backend.services.imports.CanonicalTransaction;
import com.ledgerlens.backend.services.imports.upload.TransactionStore.StoreResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes accepted rows in fixed-size chunks, at most {@code concurrency} chunks in flight.
 * Each window is awaited before the next one starts. A failed chunk stops the upload;
 * chunks committed before it stay committed.
 */
@Slf4j
@Component
public class BatchUploader {

    private final TransactionStore store;
    private final Executor executor;
    private final int chunkSize;
    private final int concurrency;
    private final int progressBase;
    private final Duration chunkTimeout;

    public BatchUploader(
            TransactionStore store,
            @Qualifier("importUploadTaskExecutor") Executor executor,
            ImportProperties properties
    ) {
        this.store = store;
        this.executor = executor;
        this.chunkSize = properties.chunkSize();
        this.concurrency = properties.concurrency();
        this.progressBase = properties.progressBase();
        this.chunkTimeout = properties.uploadTimeout();
    }

    public StoreResult upload(UUID userId, List<CanonicalTransaction> rows, BatchFileId file, ImportProgressListener listener) {
        ImportProgressListener progress = listener == null ? ImportProgressListener.NONE : listener;
        if (rows == null || rows.isEmpty()) {
            progress.onProgress(100);
            return StoreResult.EMPTY;
        }

        List<List<CanonicalTransaction>> chunks = partition(rows, chunkSize);
        int total = rows.size();
        int processed = 0;
        StoreResult result = StoreResult.EMPTY;

        log.info("[BatchUploader] userId={} rows={} chunks={} concurrency={}", userId, total, chunks.size(), concurrency);

        for (int start = 0; start < chunks.size(); start += concurrency) {
            List<List<CanonicalTransaction>> window = chunks.subList(start, Math.min(start + concurrency, chunks.size()));

            List<CompletableFuture<StoreResult>> futures = new ArrayList<>(window.size());
            for (List<CanonicalTransaction> chunk : window) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> store.store(userId, chunk, file), executor)
                        .orTimeout(chunkTimeout.toMillis(), TimeUnit.MILLISECONDS));
            }

            Throwable failure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    result = result.plus(futures.get(i).join());
                    processed += window.get(i).size();
                } catch (CompletionException e) {
                    if (failure == null) failure = e.getCause() != null ? e.getCause() : e;
                }
            }

            if (failure != null) {
                int committed = result.inserted();
                log.error("[BatchUploader] chunk failed userId={} committedRows={} cause={}",
                        userId, committed, failure.toString());
                throw new ChunkUploadException(
                        "Upload failed after " + committed + " rows were saved", committed, asImportCause(failure));
            }

            progress.onProgress(progressFor(processed, total, progressBase));
        }

        return result;
    }

    private Throwable asImportCause(Throwable failure) {
        if (failure instanceof TimeoutException) {
            return new RemoteCallTimeoutException("Chunk upload", chunkTimeout.toMillis(), failure);
        }
        return failure;
    }

    static int progressFor(int processed, int total, int base) {
        if (total <= 0) return 100;
        return base + (int) Math.round((double) processed / total * (100 - base));
    }

    static <T> List<List<T>> partition(List<T> rows, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < rows.size(); i += size) {
            chunks.add(List.copyOf(rows.subList(i, Math.min(i + size, rows.size()))));
        }
        return chunks;
    }
}
