package com.flagship.gambling_ledger.exclusion.event;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusion;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published whenever a user's exclusion or limit changes, so notification
 * and session services can react without polling.
 */
@Value
public class SelfExclusionEvent {

    public static final String CREATED = "SelfExclusionCreated";
    public static final String UPDATED = "SelfExclusionUpdated";
    public static final String EXTENDED = "SelfExclusionExtended";
    public static final String CANCELLED = "SelfExclusionCancelled";
    public static final String REMOVAL_REQUESTED = "SelfExclusionRemovalRequested";

    UUID eventId;
    String eventType;
    UUID exclusionId;
    UUID userId;
    SelfExclusionType type;
    PlatformType platformType;
    Instant endDate;
    Instant occurredAt;

    public static SelfExclusionEvent of(String eventType, SelfExclusion exclusion) {
        return new SelfExclusionEvent(
            UUID.randomUUID(),
            eventType,
            exclusion.getId(),
            exclusion.getUserId(),
            exclusion.getType(),
            exclusion.getPlatformType(),
            exclusion.getEndDate(),
            Instant.now()
        );
    }
}
