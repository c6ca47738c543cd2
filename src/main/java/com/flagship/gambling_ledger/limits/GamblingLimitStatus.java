package com.flagship.gambling_ledger.limits;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A configured limit together with its usage in the current window.
 */
@Value
@Builder
public class GamblingLimitStatus {
    UUID id;
    SelfExclusionType type;
    PlatformType platformType;
    LimitPeriod period;
    BigDecimal limitAmount;
    BigDecimal usedAmount;
    BigDecimal remainingAmount;
    Instant periodStart;
    Instant periodEnd;
    boolean removalPending;
    Instant removalExpiresAt;
}
