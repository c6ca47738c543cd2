package com.flagship.gambling_ledger.exclusion;

import com.flagship.gambling_ledger.limits.LimitPeriod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What a user asked for when creating an exclusion or limit. Which fields
 * matter depends on the type: limits need period and limitAmount, a
 * temporary exclusion needs endDate or durationDays.
 */
@Value
@Builder
public class NewSelfExclusion {
    SelfExclusionType type;
    PlatformType platformType;
    LimitPeriod period;
    BigDecimal limitAmount;
    Instant endDate;
    Integer durationDays;
}
