package com.ledgerlens.backend.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one statement import. {@code imported} is what the store actually inserted,
 * which can be lower than the rows accepted locally.
 */
@Data
@Builder
public class ImportResultDTO {

    private String filename;
    private String fileHash;
    private int totalRows;
    private int imported;
    private int skippedDuplicates;
    private int skippedZeroAmount;
    private int skippedNoDate;
    private int progress;
}
