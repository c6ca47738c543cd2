package com.flagship.gambling_ledger.exclusion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /users/self-exclusion/extend/{id}. Omitting duration_days
 * turns the cooldown into a permanent exclusion.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtendSelfExclusionRequest {

    @JsonProperty("platform_type")
    private PlatformType platformType;

    @JsonProperty("duration_days")
    private Integer durationDays;
}
