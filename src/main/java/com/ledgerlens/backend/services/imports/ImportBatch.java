package com.ledgerlens.backend.services.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;

/**
 * Rows accepted from one file plus the fingerprint sets used to decide keep/skip.
 * Owned by a single import call; not thread-safe.
 */
@Getter
public class ImportBatch {

    private final Set<String> knownFingerprints;
    private final Set<String> seenFingerprints = new HashSet<>();
    private final List<CanonicalTransaction> accepted = new ArrayList<>();

    private int totalRows;
    private int skippedNoDate;
    private int skippedZeroAmount;
    private int skippedDuplicates;

    public ImportBatch(Set<String> knownFingerprints) {
        this.knownFingerprints = knownFingerprints == null ? Set.of() : Collections.unmodifiableSet(knownFingerprints);
    }

    public void countRow() {
        totalRows++;
    }

    public void countNoDate() {
        skippedNoDate++;
    }

    public void countZeroAmount() {
        skippedZeroAmount++;
    }

    public void countDuplicate() {
        skippedDuplicates++;
    }

    public boolean isKnownOrSeen(String fingerprint) {
        return knownFingerprints.contains(fingerprint) || seenFingerprints.contains(fingerprint);
    }

    public void accept(CanonicalTransaction tx) {
        seenFingerprints.add(tx.getFingerprint());
        accepted.add(tx);
    }

    public List<CanonicalTransaction> getAccepted() {
        return Collections.unmodifiableList(accepted);
    }
}
