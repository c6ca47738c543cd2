package com.flagship.gambling_ledger.exclusion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusion;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import com.flagship.gambling_ledger.limits.LimitPeriod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SelfExclusionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    SelfExclusionType type;

    @JsonProperty("platform_type")
    PlatformType platformType;

    @JsonProperty("period")
    LimitPeriod period;

    @JsonProperty("limit_amount")
    BigDecimal limitAmount;

    @JsonProperty("start_date")
    Instant startDate;

    @JsonProperty("end_date")
    Instant endDate;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("is_removal_pending")
    boolean removalPending;

    @JsonProperty("removal_requested_at")
    Instant removalRequestedAt;

    @JsonProperty("removal_expires_at")
    Instant removalExpiresAt;

    @JsonProperty("post_cooldown_window_end")
    Instant postCooldownWindowEnd;

    @JsonProperty("is_in_post_cooldown_window")
    boolean inPostCooldownWindow;

    /** Seconds until the current restriction lifts; null when it never does. */
    @JsonProperty("remaining_seconds")
    Long remainingSeconds;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static SelfExclusionResponse from(SelfExclusion exclusion, Instant now) {
        Instant until = exclusion.restrictedUntil(now);
        return SelfExclusionResponse.builder()
            .id(exclusion.getId())
            .type(exclusion.getType())
            .platformType(exclusion.getPlatformType())
            .period(exclusion.getPeriod())
            .limitAmount(exclusion.getLimitAmount())
            .startDate(exclusion.getStartDate())
            .endDate(exclusion.getEndDate())
            .active(exclusion.isActive())
            .removalPending(exclusion.isRemovalPending())
            .removalRequestedAt(exclusion.getRemovalRequestedAt())
            .removalExpiresAt(exclusion.getRemovalExpiresAt())
            .postCooldownWindowEnd(exclusion.getEffectiveWindowEnd())
            .inPostCooldownWindow(exclusion.isInPostCooldownWindow(now))
            .remainingSeconds(until == null ? null : Math.max(0, Duration.between(now, until).getSeconds()))
            .createdAt(exclusion.getCreatedAt())
            .updatedAt(exclusion.getUpdatedAt())
            .build();
    }
}
