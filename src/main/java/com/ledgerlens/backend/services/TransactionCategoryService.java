package com.ledgerlens.backend.services;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerlens.backend.dto.ReclassifyResultDTO;
import com.ledgerlens.backend.dto.TransactionResponseDTO;
import com.ledgerlens.backend.entities.ImportedTransaction;
import com.ledgerlens.backend.exceptions.ResourceNotFoundException;
import com.ledgerlens.backend.repositories.ImportedTransactionRepository;
import com.ledgerlens.backend.services.imports.classification.ClassificationFeedbackClient;
import com.ledgerlens.backend.services.imports.dedup.KnownFingerprintCache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Manual category corrections. Moving a transaction into "Income" makes its amount positive,
 * moving it out of "Income" makes it negative again. The fingerprint is never touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionCategoryService {

    static final String INCOME = "Income";

    private final ImportedTransactionRepository transactionRepository;
    private final ClassificationFeedbackClient feedbackClient;
    private final KnownFingerprintCache fingerprintCache;

    @Transactional
    public ReclassifyResultDTO updateCategory(UUID userId, UUID transactionId, String category, String accessToken) {
        ImportedTransaction tx = transactionRepository.findByIdAndUserId(transactionId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction not found"));

        applyCategory(tx, category);
        ImportedTransaction saved = transactionRepository.save(tx);
        fingerprintCache.invalidate(userId);

        feedbackClient.sendCorrections(Map.of(saved.getDescription(), saved.getCategory()), accessToken);

        List<TransactionResponseDTO> similar = transactionRepository
                .findSimilar(userId, saved.getId(), saved.getDescription(), saved.getMerchantName())
                .stream()
                .filter(t -> !saved.getCategory().equals(t.getCategory()))
                .map(TransactionResponseDTO::from)
                .toList();

        log.info("[TransactionCategory] userId={} txId={} category={} similar={}",
                userId, transactionId, saved.getCategory(), similar.size());

        return new ReclassifyResultDTO(List.of(TransactionResponseDTO.from(saved)), similar);
    }

    @Transactional
    public ReclassifyResultDTO reclassify(UUID userId, List<UUID> transactionIds, String category, String accessToken) {
        List<ImportedTransaction> found = transactionRepository.findByUserIdAndIdIn(userId, transactionIds);
        if (found.isEmpty()) {
            throw new ResourceNotFoundException("No transactions found for the given ids");
        }

        Map<String, String> corrections = new LinkedHashMap<>();
        for (ImportedTransaction tx : found) {
            applyCategory(tx, category);
            corrections.put(tx.getDescription(), tx.getCategory());
        }
        List<ImportedTransaction> saved = transactionRepository.saveAll(found);
        fingerprintCache.invalidate(userId);
        feedbackClient.sendCorrections(corrections, accessToken);

        log.info("[TransactionCategory] userId={} reclassified={} category={}", userId, saved.size(), category);
        return new ReclassifyResultDTO(saved.stream().map(TransactionResponseDTO::from).toList(), List.of());
    }

    public Page<TransactionResponseDTO> list(UUID userId, Pageable pageable) {
        return transactionRepository.findByUserIdOrderByTransactionDateDesc(userId, pageable)
                .map(TransactionResponseDTO::from);
    }

    static void applyCategory(ImportedTransaction tx, String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        String next = category.trim();
        String previous = tx.getCategory();

        if (tx.getOriginalCategory() == null) {
            tx.setOriginalCategory(previous);
        }

        BigDecimal amount = tx.getAmount();
        if (amount != null) {
            if (isIncome(next)) {
                tx.changeAmount(amount.abs());
            } else if (isIncome(previous)) {
                tx.changeAmount(amount.abs().negate());
            }
        }
        tx.setCategory(next);
    }

    private static boolean isIncome(String category) {
        return category != null && INCOME.toLowerCase(Locale.ROOT).equals(category.trim().toLowerCase(Locale.ROOT));
    }
}
