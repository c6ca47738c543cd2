package com.flagship.gambling_ledger.exclusion;

import lombok.Getter;

/**
 * Access denied by an active self-exclusion. The message always contains
 * one of "cooldown", "post-cooldown window", "temporarily excluded" or
 * "permanently excluded" so clients can branch on the kind.
 */
@Getter
public class SelfExclusionActiveException extends RuntimeException {

    private final ActiveExclusion exclusion;
    private final GuardedAction action;

    public SelfExclusionActiveException(ActiveExclusion exclusion, GuardedAction action, String message) {
        super(message);
        this.exclusion = exclusion;
        this.action = action;
    }
}
