package com.flagship.gambling_ledger.limits;

import lombok.Getter;

/**
 * A spending or withdrawal limit would be exceeded by the requested amount.
 * The message is user-facing and names the limit and its period.
 */
@Getter
public class LimitExceededException extends RuntimeException {

    private final LimitKind kind;
    private final LimitPeriod period;

    public LimitExceededException(LimitKind kind, LimitPeriod period, String message) {
        super(message);
        this.kind = kind;
        this.period = period;
    }
}
