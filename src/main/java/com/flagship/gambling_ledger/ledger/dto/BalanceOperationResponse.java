package com.flagship.gambling_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.ledger.Asset;
import com.flagship.gambling_ledger.ledger.BalanceOperation;
import com.flagship.gambling_ledger.ledger.BalanceOperationType;
import com.flagship.gambling_ledger.ledger.BalanceUpdateResult;
import com.flagship.gambling_ledger.ledger.OperationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of a balance update, or a stored operation looked up by id.
 * Fields that only one of the two carries are null in the other.
 */
@Value
@Builder
public class BalanceOperationResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("operation_id")
    String operationId;

    @JsonProperty("operation")
    BalanceOperationType operation;

    @JsonProperty("status")
    OperationStatus status;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("replayed")
    Boolean replayed;

    @JsonProperty("asset")
    Asset asset;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("previous_balance")
    BigDecimal previousBalance;

    @JsonProperty("platform_type")
    PlatformType platformType;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BalanceOperationResponse from(BalanceUpdateResult result) {
        return BalanceOperationResponse.builder()
            .success(result.isSuccess())
            .operationId(result.getOperationId())
            .operation(result.getOperation())
            .status(result.getStatus())
            .balance(result.getBalance())
            .replayed(result.isReplayed())
            .build();
    }

    public static BalanceOperationResponse from(BalanceOperation operation) {
        return BalanceOperationResponse.builder()
            .success(true)
            .operationId(operation.getOperationId())
            .operation(operation.getOperation())
            .status(operation.getStatus())
            .balance(operation.getResultingBalance())
            .asset(operation.getAsset())
            .amount(operation.getAmount())
            .previousBalance(operation.getPreviousBalance())
            .platformType(operation.getPlatformType())
            .description(operation.getDescription())
            .createdAt(operation.getCreatedAt())
            .build();
    }
}
