package com.ledgerlens.backend.services.imports.dedup;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;

import com.ledgerlens.backend.services.imports.CanonicalTransaction;

/**
 * SHA-256 over {@code date|amount|MERCHANT|DESCRIPTION|PAYMENT_METHOD|REFERENCE}.
 * Text fields are trimmed and upper-cased, the date is the UTC ISO rendering cut to
 * seconds and the amount is fixed to two decimals. Currency is not part of the key.
 */
public final class TransactionFingerprint {

    private TransactionFingerprint() {
    }

    public static String of(CanonicalTransaction tx) {
        return compute(tx.getDate(), tx.getAmount(), tx.getMerchant(), tx.getDescription(),
                tx.getPaymentMethod(), referenceOf(tx.getRawData()));
    }

    public static String compute(
            Instant date,
            BigDecimal amount,
            String merchant,
            String description,
            String paymentMethod,
            String reference
    ) {
        String composite = String.join("|",
                dateKey(date),
                amountKey(amount),
                textKey(merchant),
                textKey(description),
                textKey(paymentMethod),
                textKey(reference));
        return sha256Hex(composite);
    }

    /**
     * {@code reference} or {@code ref} from the retained raw row, only when it is a string.
     */
    public static String referenceOf(Map<String, Object> rawData) {
        if (rawData == null) return "";
        Object ref = rawData.get("reference");
        if (!(ref instanceof String)) ref = rawData.get("ref");
        return ref instanceof String s ? s : "";
    }

    static String dateKey(Instant date) {
        if (date == null) return "";
        String iso = DateTimeFormatter.ISO_INSTANT.format(date.truncatedTo(ChronoUnit.SECONDS));
        return iso.length() > 19 ? iso.substring(0, 19) : iso;
    }

    static String amountKey(BigDecimal amount) {
        if (amount == null) return "0.00";
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String textKey(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return toHexLower(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String toHexLower(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        final char[] alphabet = "0123456789abcdef".toCharArray();
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = alphabet[v >>> 4];
            hex[i * 2 + 1] = alphabet[v & 0x0F];
        }
        return new String(hex);
    }

    /**
     * Hash of the uploaded file bytes, recorded with each import.
     */
    public static String fileHash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHexLower(digest.digest(content == null ? new byte[0] : content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
