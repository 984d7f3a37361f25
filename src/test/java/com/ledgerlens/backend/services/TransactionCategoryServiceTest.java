package com.ledgerlens.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.dto.ReclassifyResultDTO;
import com.ledgerlens.backend.entities.ImportedTransaction;
import com.ledgerlens.backend.enums.TransactionType;
import com.ledgerlens.backend.exceptions.ResourceNotFoundException;
import com.ledgerlens.backend.repositories.ImportedTransactionRepository;
import com.ledgerlens.backend.services.imports.classification.ClassificationFeedbackClient;
import com.ledgerlens.backend.services.imports.dedup.KnownFingerprintCache;

class TransactionCategoryServiceTest {

    private final ImportedTransactionRepository repository = mock(ImportedTransactionRepository.class);
    private final ClassificationFeedbackClient feedbackClient = mock(ClassificationFeedbackClient.class);
    private final KnownFingerprintCache fingerprintCache = mock(KnownFingerprintCache.class);
    private final TransactionCategoryService service =
            new TransactionCategoryService(repository, feedbackClient, fingerprintCache);

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(repository.save(any(ImportedTransaction.class))).thenAnswer(inv -> inv.getArgument(0));
        when(repository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(repository.findSimilar(any(), any(), anyString(), anyString())).thenReturn(List.of());
    }

    private ImportedTransaction tx(String amount, String category, String description) {
        ImportedTransaction tx = new ImportedTransaction();
        tx.setId(UUID.randomUUID());
        tx.setUserId(userId);
        tx.setTransactionDate(Instant.parse("2024-02-15T00:00:00Z"));
        tx.changeAmount(new BigDecimal(amount));
        tx.setCurrency("INR");
        tx.setDescription(description);
        tx.setMerchantName("Unknown");
        tx.setCategory(category);
        tx.setStatus("completed");
        tx.setFingerprint("f".repeat(64));
        return tx;
    }

    @Test
    void movingIntoIncomeMakesTheAmountPositive() {
        ImportedTransaction debit = tx("-500.00", "Uncategorized", "NEFT from employer");
        when(repository.findByIdAndUserId(debit.getId(), userId)).thenReturn(Optional.of(debit));

        ReclassifyResultDTO result = service.updateCategory(userId, debit.getId(), "Income", "token-1");

        assertEquals(0, debit.getAmount().compareTo(new BigDecimal("500.00")));
        assertEquals(TransactionType.CREDIT, debit.getType());
        assertEquals("Income", debit.getCategory());
        assertEquals("Uncategorized", debit.getOriginalCategory());
        assertEquals("f".repeat(64), debit.getFingerprint());
        assertEquals(1, result.updated().size());
        assertEquals(0, result.updated().get(0).amount().compareTo(new BigDecimal("500.00")));

        verify(fingerprintCache).invalidate(userId);
        verify(feedbackClient).sendCorrections(Map.of("NEFT from employer", "Income"), "token-1");
    }

    @Test
    void leavingIncomeMakesTheAmountNegative() {
        ImportedTransaction credit = tx("1200.00", "income", "Refund from shop");
        when(repository.findByIdAndUserId(credit.getId(), userId)).thenReturn(Optional.of(credit));

        service.updateCategory(userId, credit.getId(), "Shopping", null);

        assertEquals(0, credit.getAmount().compareTo(new BigDecimal("-1200.00")));
        assertEquals(TransactionType.DEBIT, credit.getType());
        assertEquals("income", credit.getOriginalCategory());
    }

    @Test
    void nonIncomeMovesKeepTheSign() {
        ImportedTransaction debit = tx("-80.00", "Food", "Cafe");
        debit.setOriginalCategory("Uncategorized");

        TransactionCategoryService.applyCategory(debit, "  Entertainment ");

        assertEquals(0, debit.getAmount().compareTo(new BigDecimal("-80.00")));
        assertEquals("Entertainment", debit.getCategory());
        assertEquals("Uncategorized", debit.getOriginalCategory());
    }

    @Test
    void blankCategoryIsRejected() {
        ImportedTransaction debit = tx("-80.00", "Food", "Cafe");

        assertThrows(IllegalArgumentException.class, () -> TransactionCategoryService.applyCategory(debit, " "));
    }

    @Test
    void similarTransactionsWithAnotherCategoryAreSuggested() {
        ImportedTransaction target = tx("-300.00", "Uncategorized", "ZOMATO");
        ImportedTransaction alreadyFood = tx("-120.00", "Food", "ZOMATO");
        ImportedTransaction stillOpen = tx("-90.00", "Uncategorized", "ZOMATO");
        when(repository.findByIdAndUserId(target.getId(), userId)).thenReturn(Optional.of(target));
        when(repository.findSimilar(eq(userId), eq(target.getId()), eq("ZOMATO"), anyString()))
                .thenReturn(List.of(alreadyFood, stillOpen));

        ReclassifyResultDTO result = service.updateCategory(userId, target.getId(), "Food", null);

        assertEquals(1, result.similar().size());
        assertEquals(stillOpen.getId(), result.similar().get(0).id());
    }

    @Test
    void unknownTransactionIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(repository.findByIdAndUserId(missing, userId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.updateCategory(userId, missing, "Food", null));
        verify(feedbackClient, never()).sendCorrections(anyMap(), any());
    }

    @Test
    void bulkReclassifySendsOneFeedbackBatch() {
        ImportedTransaction a = tx("-10.00", "Uncategorized", "Uber trip");
        ImportedTransaction b = tx("-20.00", "Uncategorized", "Ola ride");
        List<UUID> ids = List.of(a.getId(), b.getId());
        when(repository.findByUserIdAndIdIn(userId, ids)).thenReturn(List.of(a, b));

        ReclassifyResultDTO result = service.reclassify(userId, ids, "Transport", "t");

        assertEquals(2, result.updated().size());
        result.updated().forEach(dto -> assertEquals("Transport", dto.category()));
        verify(feedbackClient).sendCorrections(Map.of("Uber trip", "Transport", "Ola ride", "Transport"), "t");
        verify(fingerprintCache).invalidate(userId);
    }

    @Test
    void bulkReclassifyWithNoMatchesIsNotFound() {
        when(repository.findByUserIdAndIdIn(any(), any())).thenReturn(List.of());

        assertThrows(ResourceNotFoundException.class,
                () -> service.reclassify(userId, List.of(UUID.randomUUID()), "Food", null));
    }
}
