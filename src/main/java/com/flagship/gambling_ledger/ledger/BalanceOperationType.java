package com.flagship.gambling_ledger.ledger;

import java.math.BigDecimal;

/**
 * Every kind of balance movement, with its sign and overdraft rule.
 *
 * Amounts are always submitted unsigned; the sign comes from this table only.
 * Correction kinds may drive a balance below zero because they undo money
 * the user may already have spent.
 */
public enum BalanceOperationType {

    DEPOSIT(1, false),
    WIN(1, false),
    BONUS(1, false),
    REFUND(1, false),
    BET_CANCEL(1, false),
    MANUAL_CREDIT(1, false),
    PAYOUT(1, false),
    PROMOCODE(1, false),
    AFFILIATE_CLAIM(1, false),
    TIP_RECEIVE(1, false),
    VAULT_WITHDRAW(1, false),
    ROLLBACK_WITHDRAW(1, false),

    BET(-1, false),
    WITHDRAW(-1, false),
    BUYIN(-1, false),
    VAULT_DEPOSIT(-1, false),
    TIP_SEND(-1, false),
    RACE_CREATION(-1, false),

    WIN_CANCEL(-1, true),
    CORRECTION_DEBIT(-1, true),
    CORRECTION_BUYIN(-1, true);

    private final int sign;
    private final boolean mayGoNegative;

    BalanceOperationType(int sign, boolean mayGoNegative) {
        this.sign = sign;
        this.mayGoNegative = mayGoNegative;
    }

    public boolean isDebit() {
        return sign < 0;
    }

    public boolean isCredit() {
        return sign > 0;
    }

    public boolean mayGoNegative() {
        return mayGoNegative;
    }

    /**
     * Zero is only meaningful for demo-mode bets.
     */
    public boolean allowsZeroAmount() {
        return this == BET;
    }

    public BigDecimal signed(BigDecimal amount) {
        return sign < 0 ? amount.negate() : amount;
    }
}
