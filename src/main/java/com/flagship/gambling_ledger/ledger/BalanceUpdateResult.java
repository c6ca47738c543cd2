package com.flagship.gambling_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of {@link BalanceLedgerService#updateBalance}.
 *
 * A replayed result is the stored outcome of an earlier call with the same
 * operationId; the balance it reports is the balance right after that
 * original operation.
 */
@Value
public class BalanceUpdateResult {
    boolean success;
    OperationStatus status;
    BigDecimal balance;
    String operationId;
    BalanceOperationType operation;
    boolean replayed;

    static BalanceUpdateResult applied(BalanceOperation operation) {
        return of(operation, false);
    }

    static BalanceUpdateResult replayed(BalanceOperation operation) {
        return of(operation, true);
    }

    private static BalanceUpdateResult of(BalanceOperation operation, boolean replayed) {
        return new BalanceUpdateResult(
            true,
            operation.getStatus(),
            operation.getResultingBalance(),
            operation.getOperationId(),
            operation.getOperation(),
            replayed
        );
    }
}
