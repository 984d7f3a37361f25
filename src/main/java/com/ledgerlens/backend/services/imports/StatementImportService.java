package com.ledgerlens.backend.services.imports;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.ledgerlens.backend.dto.ImportResultDTO;
import com.ledgerlens.backend.enums.ImportFileKind;
import com.ledgerlens.backend.exceptions.ImportException;
import com.ledgerlens.backend.exceptions.StatementFormatException;
import com.ledgerlens.backend.services.imports.classification.ClassificationResolver;
import com.ledgerlens.backend.services.imports.decryption.SpreadsheetDecryptor;
import com.ledgerlens.backend.services.imports.dedup.FingerprintDeduplicator;
import com.ledgerlens.backend.services.imports.dedup.KnownFingerprintCache;
import com.ledgerlens.backend.services.imports.dedup.TransactionFingerprint;
import com.ledgerlens.backend.services.imports.extraction.ImportDebug;
import com.ledgerlens.backend.services.imports.extraction.TableExtractorRegistry;
import com.ledgerlens.backend.services.imports.normalization.RowNormalizer;
import com.ledgerlens.backend.services.imports.upload.BatchFileId;
import com.ledgerlens.backend.services.imports.upload.BatchUploader;
import com.ledgerlens.backend.services.imports.upload.ImportProgressListener;
import com.ledgerlens.backend.services.imports.upload.TransactionStore.StoreResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * End-to-end statement import: detect kind, decrypt, extract rows, normalize, dedup, classify, upload.
 * Steps run sequentially on the caller's thread; only the upload fans out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementImportService {

    private final SpreadsheetDecryptor spreadsheetDecryptor;
    private final TableExtractorRegistry extractorRegistry;
    private final RowNormalizer rowNormalizer;
    private final FingerprintDeduplicator deduplicator;
    private final KnownFingerprintCache fingerprintCache;
    private final ClassificationResolver classificationResolver;
    private final BatchUploader batchUploader;

    public ImportResultDTO importFile(UUID userId, MultipartFile file, String password, String accessToken) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is missing or empty");
        }

        byte[] content;
        try (InputStream is = file.getInputStream()) {
            content = is.readAllBytes();
        } catch (IOException e) {
            throw new ImportException("Failed to read uploaded file", e);
        }

        return importStatement(userId, file.getOriginalFilename(), content, password, accessToken, ImportProgressListener.NONE);
    }

    public ImportResultDTO importStatement(
            UUID userId,
            String filename,
            byte[] content,
            String password,
            String accessToken,
            ImportProgressListener listener
    ) {
        if (userId == null) {
            throw new IllegalArgumentException("User id is required");
        }
        String name = filename == null ? "" : filename;
        ImportFileKind kind = ImportFileKind.fromFilename(name);
        String fileHash = TransactionFingerprint.fileHash(content);
        boolean debug = ImportDebug.isEnabled();

        log.info("[StatementImport] start userId={} file={} kind={} bytes={}",
                userId, name, kind, content == null ? 0 : content.length);

        byte[] readable = content;
        if (kind == ImportFileKind.EXCEL && password != null && !password.isBlank()) {
            readable = spreadsheetDecryptor.decrypt(content, password);
        }

        List<Map<String, Object>> rows = extractorRegistry.extract(kind, readable, password);
        if (rows.isEmpty()) {
            throw new StatementFormatException("No rows found in " + name);
        }
        if (debug) {
            log.info("[StatementImport] extracted rows={} headers={}", rows.size(), rows.get(0).keySet());
        }

        ImportBatch batch = new ImportBatch(fingerprintCache.get(userId));
        for (Map<String, Object> row : rows) {
            batch.countRow();
            Optional<CanonicalTransaction> normalized = rowNormalizer.normalize(row);
            if (normalized.isEmpty()) {
                batch.countNoDate();
                if (debug) log.info("[StatementImport] no date, skipping row={}", row);
                continue;
            }
            deduplicator.offer(batch, normalized.get());
        }

        List<CanonicalTransaction> accepted = batch.getAccepted();
        log.info("[StatementImport] normalized total={} accepted={} noDate={} zeroAmount={} duplicates={}",
                batch.getTotalRows(), accepted.size(), batch.getSkippedNoDate(),
                batch.getSkippedZeroAmount(), batch.getSkippedDuplicates());

        classificationResolver.resolve(accepted, accessToken);

        int[] lastProgress = {0};
        ImportProgressListener progress = p -> {
            lastProgress[0] = p;
            if (listener != null) listener.onProgress(p);
        };

        StoreResult stored;
        try {
            stored = batchUploader.upload(userId, accepted, new BatchFileId(name, fileHash), progress);
        } finally {
            // a partial upload still changes what is stored
            fingerprintCache.invalidate(userId);
        }

        log.info("[StatementImport] done userId={} file={} imported={}", userId, name, stored.inserted());

        return ImportResultDTO.builder()
                .filename(name)
                .fileHash(fileHash)
                .totalRows(batch.getTotalRows())
                .imported(stored.inserted())
                .skippedDuplicates(batch.getSkippedDuplicates() + stored.skippedDuplicates())
                .skippedZeroAmount(batch.getSkippedZeroAmount() + stored.skippedZeroAmount())
                .skippedNoDate(batch.getSkippedNoDate())
                .progress(lastProgress[0])
                .build();
    }
}
