package com.flagship.gambling_ledger.ledger;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final UUID userId;
    private final Asset asset;
    private final BigDecimal requested;

    public InsufficientBalanceException(UUID userId, Asset asset, BigDecimal requested) {
        super(String.format("Insufficient %s balance for this operation (requested %s)",
            asset, requested.toPlainString()));
        this.userId = userId;
        this.asset = asset;
        this.requested = requested;
    }
}
