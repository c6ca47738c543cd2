package com.flagship.gambling_ledger.limits.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import com.flagship.gambling_ledger.limits.GamblingLimitStatus;
import com.flagship.gambling_ledger.limits.LimitPeriod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Every active limit of a user with its headroom in the current window.
 */
@Value
@Builder
public class GamblingLimitsResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("limits")
    List<Limit> limits;

    @Value
    @Builder
    public static class Limit {

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

        @JsonProperty("used_amount")
        BigDecimal usedAmount;

        @JsonProperty("remaining_amount")
        BigDecimal remainingAmount;

        @JsonProperty("period_start")
        Instant periodStart;

        @JsonProperty("period_end")
        Instant periodEnd;

        @JsonProperty("is_removal_pending")
        boolean removalPending;

        @JsonProperty("removal_expires_at")
        Instant removalExpiresAt;

        static Limit from(GamblingLimitStatus status) {
            return Limit.builder()
                .id(status.getId())
                .type(status.getType())
                .platformType(status.getPlatformType())
                .period(status.getPeriod())
                .limitAmount(status.getLimitAmount())
                .usedAmount(status.getUsedAmount())
                .remainingAmount(status.getRemainingAmount())
                .periodStart(status.getPeriodStart())
                .periodEnd(status.getPeriodEnd())
                .removalPending(status.isRemovalPending())
                .removalExpiresAt(status.getRemovalExpiresAt())
                .build();
        }
    }

    public static GamblingLimitsResponse from(UUID userId, List<GamblingLimitStatus> statuses) {
        return GamblingLimitsResponse.builder()
            .userId(userId)
            .limits(statuses.stream().map(Limit::from).toList())
            .build();
    }
}
