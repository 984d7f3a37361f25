package com.ledgerlens.backend.services.imports.upload;

import java.util.List;
import java.util.UUID;

import com.ledgerlens.backend.services.imports.CanonicalTransaction;

/**
 * Persists one chunk of normalized rows for a user. Must be idempotent: rows whose
 * fingerprint is already stored are skipped, not duplicated.
 */
public interface TransactionStore {

    StoreResult store(UUID userId, List<CanonicalTransaction> rows, BatchFileId file);

    record StoreResult(int inserted, int skippedDuplicates, int skippedZeroAmount) {

        public static final StoreResult EMPTY = new StoreResult(0, 0, 0);

        public StoreResult plus(StoreResult other) {
            return new StoreResult(
                    inserted + other.inserted,
                    skippedDuplicates + other.skippedDuplicates,
                    skippedZeroAmount + other.skippedZeroAmount);
        }
    }
}
