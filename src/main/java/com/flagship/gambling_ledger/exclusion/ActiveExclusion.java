package com.flagship.gambling_ledger.exclusion;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * The single access restriction that applies to a user right now.
 */
@Value
public class ActiveExclusion {
    UUID id;
    SelfExclusionType type;
    PlatformType platformType;
    Instant endDate;
    Instant postCooldownWindowEnd;
    boolean inPostCooldownWindow;

    /** Null for permanent exclusions. */
    Duration remainingTime;

    static ActiveExclusion of(SelfExclusion exclusion, Instant now) {
        boolean inWindow = exclusion.isInPostCooldownWindow(now);
        Instant until = exclusion.restrictedUntil(now);
        return new ActiveExclusion(
            exclusion.getId(),
            exclusion.getType(),
            exclusion.getPlatformType(),
            exclusion.getEndDate(),
            exclusion.getEffectiveWindowEnd(),
            inWindow,
            until == null ? null : Duration.between(now, until)
        );
    }

    /**
     * Effective restrictiveness, used to pick one exclusion out of several.
     * A running cooldown ranks above one that is only in its window.
     */
    int rank() {
        int base = type.getRestrictiveness() * 2;
        return inPostCooldownWindow ? base - 1 : base;
    }
}
