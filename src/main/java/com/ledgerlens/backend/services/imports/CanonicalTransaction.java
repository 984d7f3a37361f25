package com.ledgerlens.backend.services.imports;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import com.ledgerlens.backend.enums.TransactionType;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * One normalized statement row, ready for dedup, classification and storage.
 * {@link #getType()} is always derived from the sign of the amount.
 */
@Getter
@ToString(exclude = "rawData")
@Builder(toBuilder = true)
public class CanonicalTransaction {

    public static final String UNCATEGORIZED = "Uncategorized";
    public static final String UNKNOWN_MERCHANT = "Unknown";

    private final Instant date;
    private final BigDecimal amount;
    private final String currency;
    private final String description;
    private final String merchant;
    private final String paymentMethod;
    private final String status;
    private final String fingerprint;
    private final Map<String, Object> rawData;

    @Setter
    @Builder.Default
    private String category = UNCATEGORIZED;

    public TransactionType getType() {
        return TransactionType.fromAmount(amount);
    }

    public CanonicalTransaction withFingerprint(String value) {
        return toBuilder().fingerprint(value).build();
    }

    public boolean isZeroAmount() {
        return amount == null || amount.signum() == 0;
    }
}
