package com.flagship.gambling_ledger.ledger;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.lock.LockKeys;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A request to move money on one (user, asset) balance.
 *
 * operationId is the idempotency key. Callers must derive it from the
 * logical operation (bet id, transaction hash, ...) so that a retry carries
 * the same key.
 */
@Value
@Builder
public class BalanceUpdate {
    BalanceOperationType operation;
    String operationId;
    UUID userId;
    BigDecimal amount;
    Asset asset;
    String description;

    /** Segment used for exclusion checks, limit scoping and daily stats. */
    @Builder.Default
    PlatformType platformType = PlatformType.PLATFORM;

    public String lockResource() {
        return LockKeys.balance(userId, asset.name());
    }
}
