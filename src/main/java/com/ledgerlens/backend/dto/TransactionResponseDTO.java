package com.ledgerlens.backend.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import com.ledgerlens.backend.entities.ImportedTransaction;
import com.ledgerlens.backend.enums.TransactionType;

public record TransactionResponseDTO(
        UUID id,
        Instant date,
        BigDecimal amount,
        String currency,
        String description,
        String merchantName,
        String category,
        String originalCategory,
        String paymentMethod,
        String status,
        TransactionType type
) {
    public static TransactionResponseDTO from(ImportedTransaction tx) {
        return new TransactionResponseDTO(
                tx.getId(),
                tx.getTransactionDate(),
                tx.getAmount(),
                tx.getCurrency(),
                tx.getDescription(),
                tx.getMerchantName(),
                tx.getCategory(),
                tx.getOriginalCategory(),
                tx.getPaymentMethod(),
                tx.getStatus(),
                tx.getType()
        );
    }
}
