package com.ledgerlens.backend.dto;

import java.util.List;

/**
 * Updated transactions plus the ones that look like them (same description, or same known merchant).
 */
public record ReclassifyResultDTO(
        List<TransactionResponseDTO> updated,
        List<TransactionResponseDTO> similar
) {
}
