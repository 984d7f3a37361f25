package com.ledgerlens.backend.services.imports.upload;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerlens.backend.entities.ImportedTransaction;
import com.ledgerlens.backend.entities.UploadedFile;
import com.ledgerlens.backend.repositories.ImportedTransactionRepository;
import com.ledgerlens.backend.repositories.UploadedFileRepository;
import com.ledgerlens.backend.services.imports.CanonicalTransaction;
import com.ledgerlens.backend.services.imports.dedup.TransactionFingerprint;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTransactionStore implements TransactionStore {

    private static final int DESCRIPTION_MAX = 500;
    private static final int MERCHANT_MAX = 255;
    private static final int CATEGORY_MAX = 100;
    private static final int SHORT_MAX = 30;

    private final ImportedTransactionRepository transactionRepository;
    private final UploadedFileRepository uploadedFileRepository;

    @Override
    @Transactional
    public StoreResult store(UUID userId, List<CanonicalTransaction> rows, BatchFileId file) {
        if (userId == null) throw new IllegalArgumentException("userId is required");
        if (rows == null || rows.isEmpty()) {
            recordFile(userId, file);
            return StoreResult.EMPTY;
        }

        int zeroAmount = 0;
        int duplicates = 0;

        // the fingerprint is recomputed here so a caller can't smuggle in a different key
        Map<String, CanonicalTransaction> byFingerprint = new LinkedHashMap<>();
        for (CanonicalTransaction row : rows) {
            if (row.isZeroAmount()) {
                zeroAmount++;
                continue;
            }
            String fingerprint = TransactionFingerprint.of(row);
            if (byFingerprint.putIfAbsent(fingerprint, row) != null) {
                duplicates++;
            }
        }

        Set<String> existing = byFingerprint.isEmpty()
                ? Set.of()
                : new HashSet<>(transactionRepository.findExistingFingerprints(userId, byFingerprint.keySet()));

        List<ImportedTransaction> toSave = new ArrayList<>();
        for (Map.Entry<String, CanonicalTransaction> e : byFingerprint.entrySet()) {
            if (existing.contains(e.getKey())) {
                duplicates++;
                continue;
            }
            toSave.add(toEntity(userId, e.getKey(), e.getValue()));
        }

        if (!toSave.isEmpty()) {
            transactionRepository.saveAll(toSave);
        }
        recordFile(userId, file);

        log.info("[TransactionStore] userId={} received={} inserted={} duplicates={} zeroAmount={}",
                userId, rows.size(), toSave.size(), duplicates, zeroAmount);
        return new StoreResult(toSave.size(), duplicates, zeroAmount);
    }

    private void recordFile(UUID userId, BatchFileId file) {
        if (file == null || !file.isPresent()) return;
        if (uploadedFileRepository.existsByUserIdAndFileHash(userId, file.fileHash())) return;

        UploadedFile uploaded = new UploadedFile();
        uploaded.setUserId(userId);
        uploaded.setFilename(truncate(file.filename(), MERCHANT_MAX));
        uploaded.setFileHash(file.fileHash());
        uploadedFileRepository.save(uploaded);
    }

    static ImportedTransaction toEntity(UUID userId, String fingerprint, CanonicalTransaction row) {
        ImportedTransaction entity = new ImportedTransaction();
        entity.setUserId(userId);
        entity.setTransactionDate(row.getDate());
        entity.changeAmount(row.getAmount());
        entity.setCurrency(row.getCurrency());
        entity.setDescription(truncate(row.getDescription(), DESCRIPTION_MAX));
        entity.setMerchantName(truncate(row.getMerchant(), MERCHANT_MAX));
        entity.setCategory(truncate(row.getCategory(), CATEGORY_MAX));
        entity.setPaymentMethod(truncate(row.getPaymentMethod(), SHORT_MAX));
        entity.setStatus(truncate(row.getStatus(), SHORT_MAX));
        entity.setFingerprint(fingerprint);
        if (row.getRawData() != null) {
            entity.setRawData(new LinkedHashMap<>(row.getRawData()));
        }
        return entity;
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }
}
