package com.ledgerlens.backend.services.imports.dedup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.services.imports.CanonicalTransaction;

class TransactionFingerprintTest {

    private static final Instant DATE = Instant.parse("2024-02-15T10:20:30Z");

    @Test
    void deterministicAndHex() {
        String a = TransactionFingerprint.compute(DATE, new BigDecimal("-450"), "Swiggy", "Swiggy order", "upi", "");
        String b = TransactionFingerprint.compute(DATE, new BigDecimal("-450.00"), "Swiggy", "Swiggy order", "upi", "");

        assertEquals(b, a);
        assertEquals(64, a.length());
        assertTrue(a.matches("[0-9a-f]{64}"));
    }

    @Test
    void caseAndSurroundingWhitespaceDoNotMatter() {
        String a = TransactionFingerprint.compute(DATE, new BigDecimal("10"), "swiggy", "swiggy order", "UPI", "R1");
        String b = TransactionFingerprint.compute(DATE, new BigDecimal("10"), "  SWIGGY ", "SWIGGY ORDER  ", "upi", " r1");

        assertEquals(b, a);
    }

    @Test
    void subSecondPrecisionIsIgnored() {
        String a = TransactionFingerprint.compute(DATE, BigDecimal.ONE, "m", "d", "p", "");
        String b = TransactionFingerprint.compute(DATE.plusMillis(999), BigDecimal.ONE, "m", "d", "p", "");

        assertEquals(b, a);
    }

    @Test
    void anyFieldChangeChangesFingerprint() {
        String base = TransactionFingerprint.compute(DATE, BigDecimal.ONE, "m", "d", "p", "");

        assertNotEquals(base, TransactionFingerprint.compute(DATE.plusSeconds(1), BigDecimal.ONE, "m", "d", "p", ""));
        assertNotEquals(base, TransactionFingerprint.compute(DATE, BigDecimal.TEN, "m", "d", "p", ""));
        assertNotEquals(base, TransactionFingerprint.compute(DATE, BigDecimal.ONE, "m", "d", "p", "ref"));
    }

    @Test
    void rawDataKeyOrderDoesNotMatterAndOnlyStringReferencesCount() {
        Map<String, Object> raw1 = new LinkedHashMap<>();
        raw1.put("reference", "ABC");
        raw1.put("note", "x");
        Map<String, Object> raw2 = new LinkedHashMap<>();
        raw2.put("note", "x");
        raw2.put("reference", "ABC");

        assertEquals(TransactionFingerprint.of(tx(raw2)), TransactionFingerprint.of(tx(raw1)));

        assertEquals("R9", TransactionFingerprint.referenceOf(Map.of("ref", "R9")));
        assertTrue(TransactionFingerprint.referenceOf(Map.of("reference", 123)).isEmpty());
        assertTrue(TransactionFingerprint.referenceOf(null).isEmpty());
    }

    @Test
    void currencyIsNotPartOfTheKey() {
        CanonicalTransaction inr = tx(Map.of());
        CanonicalTransaction usd = inr.toBuilder().currency("USD").build();

        assertEquals(TransactionFingerprint.of(usd), TransactionFingerprint.of(inr));
    }

    @Test
    void fileHashIsSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", TransactionFingerprint.fileHash(new byte[0]));
    }

    private static CanonicalTransaction tx(Map<String, Object> raw) {
        return CanonicalTransaction.builder()
                .date(DATE)
                .amount(new BigDecimal("-99.99"))
                .currency("INR")
                .description("Zomato")
                .merchant("Zomato")
                .paymentMethod("upi")
                .status("completed")
                .rawData(raw)
                .build();
    }
}
