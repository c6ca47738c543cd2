package com.flagship.gambling_ledger.limits;

public enum LimitKind {
    DEPOSIT,
    LOSS,
    WAGER,
    DAILY_WITHDRAW
}
