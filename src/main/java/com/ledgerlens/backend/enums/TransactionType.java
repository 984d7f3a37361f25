package com.ledgerlens.backend.enums;

import java.math.BigDecimal;

public enum TransactionType {
    CREDIT,
    DEBIT;

    public static TransactionType fromAmount(BigDecimal amount) {
        return amount != null && amount.signum() > 0 ? CREDIT : DEBIT;
    }
}
