package com.flagship.gambling_ledger.exclusion;

import java.util.EnumSet;
import java.util.Set;

public enum SelfExclusionType {
    COOLDOWN(2),
    TEMPORARY(3),
    PERMANENT(4),
    DEPOSIT_LIMIT(0),
    LOSS_LIMIT(0),
    WAGER_LIMIT(0);

    public static final Set<SelfExclusionType> ACCESS_TYPES = EnumSet.of(COOLDOWN, TEMPORARY, PERMANENT);
    public static final Set<SelfExclusionType> LIMIT_TYPES = EnumSet.of(DEPOSIT_LIMIT, LOSS_LIMIT, WAGER_LIMIT);

    /** Higher is more restrictive. Limits do not take part in the ordering. */
    private final int restrictiveness;

    SelfExclusionType(int restrictiveness) {
        this.restrictiveness = restrictiveness;
    }

    public int getRestrictiveness() {
        return restrictiveness;
    }

    public boolean isAccessRestriction() {
        return ACCESS_TYPES.contains(this);
    }

    public boolean isLimit() {
        return LIMIT_TYPES.contains(this);
    }
}
