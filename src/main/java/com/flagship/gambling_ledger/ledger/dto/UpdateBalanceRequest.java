package com.flagship.gambling_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.ledger.Asset;
import com.flagship.gambling_ledger.ledger.BalanceOperationType;
import com.flagship.gambling_ledger.ledger.BalanceUpdate;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpdateBalanceRequest {

    @NotNull(message = "Operation is required")
    @JsonProperty("operation")
    private BalanceOperationType operation;

    @NotBlank(message = "Operation ID is required")
    @Size(max = 255, message = "Operation ID cannot exceed 255 characters")
    @JsonProperty("operation_id")
    private String operationId;

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    private UUID userId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", message = "Amount cannot be negative")
    @JsonProperty("amount")
    private BigDecimal amount;

    @NotBlank(message = "Asset is required")
    @JsonProperty("asset")
    private String asset;

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    @JsonProperty("description")
    private String description;

    @JsonProperty("platform_type")
    private PlatformType platformType;

    public BalanceUpdate toUpdate() {
        BalanceUpdate.BalanceUpdateBuilder builder = BalanceUpdate.builder()
            .operation(operation)
            .operationId(operationId)
            .userId(userId)
            .amount(amount)
            .asset(Asset.parse(asset))
            .description(description);
        if (platformType != null) {
            builder.platformType(platformType);
        }
        return builder.build();
    }
}
