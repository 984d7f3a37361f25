package com.ledgerlens.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Channel a bank narration was recognized as. Serialized as the lowercase name.
 */
public enum NarrationType {
    UPI,
    POS,
    ATM,
    INB,
    CASH_DEPOSIT,
    UNKNOWN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
