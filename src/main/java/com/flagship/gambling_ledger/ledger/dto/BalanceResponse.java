package com.flagship.gambling_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.ledger.Asset;
import com.flagship.gambling_ledger.ledger.Balance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("asset")
    Asset asset;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BalanceResponse from(Balance balance) {
        return BalanceResponse.builder()
            .userId(balance.getUserId())
            .asset(balance.getAsset())
            .balance(balance.getAmount())
            .updatedAt(balance.getUpdatedAt())
            .build();
    }
}
