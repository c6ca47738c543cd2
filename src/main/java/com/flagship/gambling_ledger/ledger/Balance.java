package com.flagship.gambling_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Current balance of one user in one asset.
 */
@Value
public class Balance {
    UUID userId;
    Asset asset;
    BigDecimal amount;
    Instant updatedAt;
}
