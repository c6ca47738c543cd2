package com.flagship.gambling_ledger.exclusion;

/**
 * Platform segment an exclusion, limit or bet belongs to.
 * PLATFORM means the whole site and always applies on top of a segment.
 */
public enum PlatformType {
    SPORTS,
    CASINO,
    PLATFORM;

    /**
     * Whether a restriction scoped to this segment covers activity on the
     * given segment.
     */
    public boolean covers(PlatformType activitySegment) {
        return this == PLATFORM || activitySegment == null || this == activitySegment;
    }
}
