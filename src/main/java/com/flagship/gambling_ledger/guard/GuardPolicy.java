package com.flagship.gambling_ledger.guard;

import com.flagship.gambling_ledger.exclusion.GuardedAction;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * What to check before a user-facing operation runs: a rate limit, and
 * optionally which action an access exclusion could block.
 */
@Value
@Builder
public class GuardPolicy {

    /** Rate-limit counter name; one counter per policy and user. */
    String name;

    /** Null when the operation is not subject to access exclusions. */
    GuardedAction action;

    int permits;

    Duration window;

    public boolean checksExclusions() {
        return action != null;
    }
}
