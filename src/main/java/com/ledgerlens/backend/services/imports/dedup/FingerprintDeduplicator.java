package com.ledgerlens.backend.services.imports.dedup;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.services.imports.CanonicalTransaction;
import com.ledgerlens.backend.services.imports.ImportBatch;

/**
 * Admits a row into the batch unless it has zero amount or its fingerprint is already
 * known to the store or was accepted earlier in the same batch.
 */
@Component
public class FingerprintDeduplicator {

    /**
     * @return true when the row was accepted
     */
    public boolean offer(ImportBatch batch, CanonicalTransaction tx) {
        if (tx.isZeroAmount()) {
            batch.countZeroAmount();
            return false;
        }

        CanonicalTransaction fingerprinted = tx.getFingerprint() == null
                ? tx.withFingerprint(TransactionFingerprint.of(tx))
                : tx;

        if (batch.isKnownOrSeen(fingerprinted.getFingerprint())) {
            batch.countDuplicate();
            return false;
        }
        // must be registered before the next row is looked at
        batch.accept(fingerprinted);
        return true;
    }
}
