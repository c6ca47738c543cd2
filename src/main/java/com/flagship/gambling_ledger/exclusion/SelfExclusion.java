package com.flagship.gambling_ledger.exclusion;

import com.flagship.gambling_ledger.limits.LimitPeriod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A self-exclusion or spending limit.
 *
 * Access restrictions move through
 * cooldown -> post-cooldown window -> temporary | permanent.
 * Limits are either active or removal-pending; a pending limit is still
 * enforced until its grace period runs out.
 *
 * Immutable: every transition returns a new instance.
 */
@Value
public class SelfExclusion {

    public static final Duration COOLDOWN_DURATION = Duration.ofHours(24);
    public static final Duration POST_COOLDOWN_WINDOW = Duration.ofHours(24);
    public static final Duration REMOVAL_GRACE_PERIOD = Duration.ofHours(24);

    UUID id;
    UUID userId;
    SelfExclusionType type;
    PlatformType platformType;
    LimitPeriod period;
    BigDecimal limitAmount;
    Instant startDate;
    Instant endDate;
    boolean active;
    Instant removalRequestedAt;
    Instant postCooldownWindowEnd;
    Instant createdAt;
    Instant updatedAt;

    public static SelfExclusion cooldown(UUID userId, PlatformType platformType, Instant now) {
        return create(userId, SelfExclusionType.COOLDOWN, platformType, null, null, now, now.plus(COOLDOWN_DURATION));
    }

    public static SelfExclusion temporary(UUID userId, PlatformType platformType, Instant now, Instant endDate) {
        if (endDate == null || !endDate.isAfter(now)) {
            throw new IllegalArgumentException("Temporary exclusion end date must be in the future");
        }
        return create(userId, SelfExclusionType.TEMPORARY, platformType, null, null, now, endDate);
    }

    public static SelfExclusion permanent(UUID userId, PlatformType platformType, Instant now) {
        return create(userId, SelfExclusionType.PERMANENT, platformType, null, null, now, null);
    }

    public static SelfExclusion limit(UUID userId, SelfExclusionType type, PlatformType platformType,
                                      LimitPeriod period, BigDecimal limitAmount, Instant now) {
        if (!type.isLimit()) {
            throw new IllegalArgumentException(type + " is not a limit type");
        }
        if (period == null) {
            throw new IllegalArgumentException("Period is required for " + type);
        }
        if (limitAmount == null || limitAmount.signum() <= 0) {
            throw new IllegalArgumentException("Limit amount must be greater than 0");
        }
        return create(userId, type, platformType, period, limitAmount, now, null);
    }

    private static SelfExclusion create(UUID userId, SelfExclusionType type, PlatformType platformType,
                                        LimitPeriod period, BigDecimal limitAmount,
                                        Instant startDate, Instant endDate) {
        return new SelfExclusion(
            UUID.randomUUID(),
            userId,
            type,
            platformType == null ? PlatformType.PLATFORM : platformType,
            period,
            limitAmount,
            startDate,
            endDate,
            true,
            null,
            null,
            startDate,
            startDate
        );
    }

    /**
     * Starts the removal countdown of a limit. Idempotent: a second request
     * keeps the original timestamp.
     */
    public SelfExclusion requestRemoval(Instant now) {
        if (!type.isLimit()) {
            throw new IllegalStateException(type + " exclusions do not support removal requests");
        }
        if (removalRequestedAt != null) {
            return this;
        }
        return new SelfExclusion(id, userId, type, platformType, period, limitAmount, startDate, endDate,
            active, now, postCooldownWindowEnd, createdAt, now);
    }

    /**
     * Replaces the amount of a limit and withdraws any pending removal.
     */
    public SelfExclusion withLimitAmount(BigDecimal newAmount, Instant now) {
        if (!type.isLimit()) {
            throw new IllegalStateException(type + " exclusions have no limit amount");
        }
        if (newAmount == null || newAmount.signum() <= 0) {
            throw new IllegalArgumentException("Limit amount must be greater than 0");
        }
        return new SelfExclusion(id, userId, type, platformType, period, newAmount, startDate, endDate,
            active, null, postCooldownWindowEnd, createdAt, now);
    }

    public boolean isRemovalPending() {
        return removalRequestedAt != null;
    }

    public Instant getRemovalExpiresAt() {
        return removalRequestedAt == null ? null : removalRequestedAt.plus(REMOVAL_GRACE_PERIOD);
    }

    public boolean isCooldownRunning(Instant now) {
        return type == SelfExclusionType.COOLDOWN && active && endDate != null && endDate.isAfter(now);
    }

    public boolean isInPostCooldownWindow(Instant now) {
        Instant windowEnd = getEffectiveWindowEnd();
        return type == SelfExclusionType.COOLDOWN && active
            && windowEnd != null && !isCooldownRunning(now) && windowEnd.isAfter(now);
    }

    /**
     * End of the post-cooldown window. Falls back to the cooldown end plus the
     * window length when the expiry job has not stamped it yet.
     */
    public Instant getEffectiveWindowEnd() {
        if (type != SelfExclusionType.COOLDOWN) {
            return null;
        }
        if (postCooldownWindowEnd != null) {
            return postCooldownWindowEnd;
        }
        return endDate == null ? null : endDate.plus(POST_COOLDOWN_WINDOW);
    }

    public SelfExclusion deactivate(Instant now) {
        return new SelfExclusion(id, userId, type, platformType, period, limitAmount, startDate, endDate,
            false, removalRequestedAt, postCooldownWindowEnd, createdAt, now);
    }

    /**
     * Whether this record currently restricts access, or, for limits,
     * whether it is currently enforced.
     */
    public boolean isInForce(Instant now) {
        if (!active) {
            return false;
        }
        return switch (type) {
            case PERMANENT -> true;
            case TEMPORARY -> endDate == null || endDate.isAfter(now);
            case COOLDOWN -> isCooldownRunning(now) || isInPostCooldownWindow(now);
            case DEPOSIT_LIMIT, LOSS_LIMIT, WAGER_LIMIT -> true;
        };
    }

    public boolean appliesTo(PlatformType segment) {
        return platformType.covers(segment);
    }

    /**
     * When the current restriction stops applying, if it ever does.
     */
    public Instant restrictedUntil(Instant now) {
        return switch (type) {
            case COOLDOWN -> isCooldownRunning(now) ? endDate : getEffectiveWindowEnd();
            case TEMPORARY -> endDate;
            default -> null;
        };
    }
}
