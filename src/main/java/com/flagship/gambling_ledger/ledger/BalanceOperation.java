package com.flagship.gambling_ledger.ledger;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An applied balance movement. Immutable once written.
 */
@Value
public class BalanceOperation {
    UUID id;
    String operationId;
    UUID userId;
    Asset asset;
    BalanceOperationType operation;
    BigDecimal amount;
    BigDecimal signedAmount;
    BigDecimal previousBalance;
    BigDecimal resultingBalance;
    OperationStatus status;
    PlatformType platformType;
    String description;
    Instant createdAt;

    public static BalanceOperation confirmed(BalanceUpdate update, BigDecimal previousBalance,
                                             BigDecimal resultingBalance) {
        return new BalanceOperation(
            UUID.randomUUID(),
            update.getOperationId(),
            update.getUserId(),
            update.getAsset(),
            update.getOperation(),
            update.getAmount(),
            update.getOperation().signed(update.getAmount()),
            previousBalance,
            resultingBalance,
            OperationStatus.CONFIRMED,
            update.getPlatformType(),
            update.getDescription(),
            Instant.now()
        );
    }

    /**
     * Whether a resubmitted update describes this same operation.
     * Used to tell a retry apart from a key collision.
     */
    public boolean isSameIntent(BalanceUpdate update) {
        return userId.equals(update.getUserId())
            && asset == update.getAsset()
            && operation == update.getOperation()
            && amount.compareTo(update.getAmount()) == 0;
    }
}
