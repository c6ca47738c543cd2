package com.flagship.gambling_ledger.ledger.event;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.ledger.Asset;
import com.flagship.gambling_ledger.ledger.BalanceOperation;
import com.flagship.gambling_ledger.ledger.BalanceOperationType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published after every applied balance operation, for the wallet
 * WebSocket feed.
 */
@Value
public class BalanceUpdatedEvent {

    public static final String EVENT_TYPE = "BalanceUpdated";

    UUID eventId;
    String operationId;
    UUID userId;
    Asset asset;
    BalanceOperationType operation;
    BigDecimal amount;
    BigDecimal signedAmount;
    BigDecimal balance;
    PlatformType platformType;
    Instant occurredAt;

    public static BalanceUpdatedEvent from(BalanceOperation operation) {
        return new BalanceUpdatedEvent(
            UUID.randomUUID(),
            operation.getOperationId(),
            operation.getUserId(),
            operation.getAsset(),
            operation.getOperation(),
            operation.getAmount(),
            operation.getSignedAmount(),
            operation.getResultingBalance(),
            operation.getPlatformType(),
            operation.getCreatedAt()
        );
    }
}
