package com.flagship.gambling_ledger.limits;

/**
 * Aggregated column of daily_gambling_stats.
 */
public enum StatMetric {
    WAGER("wager_amount_cents"),
    WIN("win_amount_cents"),
    LOSS("loss_amount_cents"),
    DEPOSIT("deposit_amount_cents");

    private final String column;

    StatMetric(String column) {
        this.column = column;
    }

    String column() {
        return column;
    }
}
