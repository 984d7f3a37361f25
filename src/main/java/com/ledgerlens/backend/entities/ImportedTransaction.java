package com.ledgerlens.backend.entities;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import com.ledgerlens.backend.enums.TransactionType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "imported_transactions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_imported_transactions_user_fingerprint", columnNames = {"user_id", "fingerprint"})
        },
        indexes = {
                @Index(name = "idx_imported_transactions_user_id", columnList = "user_id"),
                @Index(name = "idx_imported_transactions_transaction_date", columnList = "transaction_date")
        })
@Getter
@Setter
@NoArgsConstructor
public class ImportedTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "transaction_date", nullable = false)
    private Instant transactionDate;

    // amount and type only change together, through changeAmount
    @Setter(AccessLevel.NONE)
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TransactionType type;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(name = "merchant_name", nullable = false)
    private String merchantName;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(name = "original_category", length = 100)
    private String originalCategory;

    @Column(name = "payment_method", length = 30)
    private String paymentMethod;

    @Column(nullable = false, length = 30)
    private String status;

    @Column(nullable = false, length = 64, updatable = false)
    private String fingerprint;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_data", columnDefinition = "jsonb")
    private Map<String, Object> rawData = new LinkedHashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void changeAmount(BigDecimal newAmount) {
        this.amount = newAmount;
        this.type = TransactionType.fromAmount(newAmount);
    }
}
