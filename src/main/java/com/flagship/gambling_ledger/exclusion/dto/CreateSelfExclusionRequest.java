package com.flagship.gambling_ledger.exclusion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.exclusion.NewSelfExclusion;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import com.flagship.gambling_ledger.limits.LimitPeriod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Body of POST /users/self-exclusion. platform_type defaults to PLATFORM;
 * period and limit_amount are required for limits; a temporary exclusion
 * takes either end_date or duration_days.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateSelfExclusionRequest {

    @NotNull(message = "Type is required")
    @JsonProperty("type")
    private SelfExclusionType type;

    @JsonProperty("platform_type")
    private PlatformType platformType;

    @JsonProperty("period")
    private LimitPeriod period;

    @DecimalMin(value = "0.01", message = "Limit amount must be greater than 0")
    @Digits(integer = 28, fraction = 2, message = "Limit amount supports at most 2 decimal places")
    @JsonProperty("limit_amount")
    private BigDecimal limitAmount;

    @JsonProperty("end_date")
    private Instant endDate;

    @Positive(message = "Duration must be a positive number of days")
    @JsonProperty("duration_days")
    private Integer durationDays;

    public NewSelfExclusion toCommand() {
        return NewSelfExclusion.builder()
            .type(type)
            .platformType(platformType)
            .period(period)
            .limitAmount(limitAmount)
            .endDate(endDate)
            .durationDays(durationDays)
            .build();
    }
}
