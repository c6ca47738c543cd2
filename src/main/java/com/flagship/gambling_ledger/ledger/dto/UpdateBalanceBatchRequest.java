package com.flagship.gambling_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gambling_ledger.ledger.BalanceUpdate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Several operations on one (user, asset) balance, applied all or none.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpdateBalanceBatchRequest {

    @NotEmpty(message = "Batch must contain at least one operation")
    @Size(max = 50, message = "Batch cannot contain more than 50 operations")
    @JsonProperty("operations")
    private List<@Valid UpdateBalanceRequest> operations;

    public List<BalanceUpdate> toUpdates() {
        return operations.stream()
            .map(UpdateBalanceRequest::toUpdate)
            .toList();
    }
}
