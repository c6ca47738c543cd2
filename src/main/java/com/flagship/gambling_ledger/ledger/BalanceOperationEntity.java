package com.flagship.gambling_ledger.ledger;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the append-only operation history.
 *
 * No setters and no update path: a database trigger rejects UPDATE and
 * DELETE on this table as well.
 */
@Entity
@Table(
    name = "balance_operations",
    indexes = {
        @Index(name = "idx_balance_operations_user_asset", columnList = "user_id, asset, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BalanceOperationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "operation_id", nullable = false, unique = true, updatable = false)
    private String operationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private Asset asset;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private BalanceOperationType operation;

    @Column(nullable = false, updatable = false, precision = 30, scale = 8)
    private BigDecimal amount;

    @Column(name = "signed_amount", nullable = false, updatable = false, precision = 30, scale = 8)
    private BigDecimal signedAmount;

    @Column(name = "previous_balance", nullable = false, updatable = false, precision = 30, scale = 8)
    private BigDecimal previousBalance;

    @Column(name = "resulting_balance", nullable = false, updatable = false, precision = 30, scale = 8)
    private BigDecimal resultingBalance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private OperationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform_type", nullable = false, updatable = false, length = 20)
    private PlatformType platformType;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BalanceOperationEntity fromDomain(BalanceOperation operation) {
        return new BalanceOperationEntity(
            operation.getId(),
            operation.getOperationId(),
            operation.getUserId(),
            operation.getAsset(),
            operation.getOperation(),
            operation.getAmount(),
            operation.getSignedAmount(),
            operation.getPreviousBalance(),
            operation.getResultingBalance(),
            operation.getStatus(),
            operation.getPlatformType(),
            operation.getDescription(),
            operation.getCreatedAt()
        );
    }

    public BalanceOperation toDomain() {
        return new BalanceOperation(
            id,
            operationId,
            userId,
            asset,
            operation,
            amount,
            signedAmount,
            previousBalance,
            resultingBalance,
            status,
            platformType,
            description,
            createdAt
        );
    }
}
