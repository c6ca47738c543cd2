package com.flagship.gambling_ledger.exclusion;

import com.flagship.gambling_ledger.limits.LimitPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State transitions of a single exclusion record, without persistence.
 */
class SelfExclusionTest {

    private static final UUID USER = UUID.randomUUID();
    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("Cooldown runs 24h, then opens a 24h post-cooldown window, then lapses")
    void cooldownLifecycle() {
        SelfExclusion cooldown = SelfExclusion.cooldown(USER, PlatformType.CASINO, T0);

        Instant during = T0.plus(Duration.ofHours(3));
        assertTrue(cooldown.isCooldownRunning(during));
        assertFalse(cooldown.isInPostCooldownWindow(during));
        assertTrue(cooldown.isInForce(during));
        assertEquals(T0.plus(Duration.ofHours(24)), cooldown.restrictedUntil(during));

        Instant inWindow = T0.plus(Duration.ofHours(30));
        assertFalse(cooldown.isCooldownRunning(inWindow));
        assertTrue(cooldown.isInPostCooldownWindow(inWindow));
        assertTrue(cooldown.isInForce(inWindow));
        assertEquals(T0.plus(Duration.ofHours(48)), cooldown.getEffectiveWindowEnd());

        Instant after = T0.plus(Duration.ofHours(49));
        assertFalse(cooldown.isInPostCooldownWindow(after));
        assertFalse(cooldown.isInForce(after));
    }

    @Test
    @DisplayName("A temporary exclusion needs an end date in the future")
    void temporaryRequiresFutureEnd() {
        assertThrows(IllegalArgumentException.class,
                () -> SelfExclusion.temporary(USER, PlatformType.SPORTS, T0, T0));
        assertThrows(IllegalArgumentException.class,
                () -> SelfExclusion.temporary(USER, PlatformType.SPORTS, T0, null));

        SelfExclusion temporary = SelfExclusion.temporary(USER, PlatformType.SPORTS, T0, T0.plus(Duration.ofDays(7)));
        assertTrue(temporary.isInForce(T0.plus(Duration.ofDays(6))));
        assertFalse(temporary.isInForce(T0.plus(Duration.ofDays(8))));
        assertFalse(temporary.deactivate(T0).isInForce(T0));
    }

    @Test
    @DisplayName("Limit removal is idempotent and withdrawn by a new amount")
    void limitRemoval() {
        SelfExclusion limit = SelfExclusion.limit(USER, SelfExclusionType.LOSS_LIMIT, PlatformType.PLATFORM,
                LimitPeriod.DAILY, new BigDecimal("80"), T0);
        assertFalse(limit.isRemovalPending());

        SelfExclusion pending = limit.requestRemoval(T0.plus(Duration.ofHours(1)));
        assertTrue(pending.isRemovalPending());
        assertTrue(pending.isInForce(T0.plus(Duration.ofHours(2))));
        assertEquals(T0.plus(Duration.ofHours(25)), pending.getRemovalExpiresAt());

        SelfExclusion again = pending.requestRemoval(T0.plus(Duration.ofHours(5)));
        assertEquals(pending.getRemovalRequestedAt(), again.getRemovalRequestedAt());

        SelfExclusion reinstated = pending.withLimitAmount(new BigDecimal("50"), T0.plus(Duration.ofHours(6)));
        assertFalse(reinstated.isRemovalPending());
        assertEquals(new BigDecimal("50"), reinstated.getLimitAmount());
    }

    @Test
    @DisplayName("Limits require a period and a positive amount")
    void limitValidation() {
        assertThrows(IllegalArgumentException.class, () -> SelfExclusion.limit(USER, SelfExclusionType.WAGER_LIMIT,
                PlatformType.PLATFORM, null, BigDecimal.TEN, T0));
        assertThrows(IllegalArgumentException.class, () -> SelfExclusion.limit(USER, SelfExclusionType.WAGER_LIMIT,
                PlatformType.PLATFORM, LimitPeriod.DAILY, BigDecimal.ZERO, T0));
        assertThrows(IllegalArgumentException.class, () -> SelfExclusion.limit(USER, SelfExclusionType.COOLDOWN,
                PlatformType.PLATFORM, LimitPeriod.DAILY, BigDecimal.TEN, T0));
        assertThrows(IllegalStateException.class,
                () -> SelfExclusion.permanent(USER, PlatformType.PLATFORM, T0).requestRemoval(T0));
    }

    @Test
    @DisplayName("PLATFORM covers every segment; a segment covers only itself")
    void platformScoping() {
        SelfExclusion platform = SelfExclusion.permanent(USER, PlatformType.PLATFORM, T0);
        SelfExclusion casino = SelfExclusion.permanent(USER, PlatformType.CASINO, T0);

        assertTrue(platform.appliesTo(PlatformType.SPORTS));
        assertTrue(platform.appliesTo(PlatformType.CASINO));
        assertTrue(casino.appliesTo(PlatformType.CASINO));
        assertFalse(casino.appliesTo(PlatformType.SPORTS));
        assertFalse(casino.appliesTo(PlatformType.PLATFORM));
    }

    @Test
    @DisplayName("Guard messages name the restriction kind and the segment")
    void guardMessages() {
        Instant now = Instant.now();

        ActiveExclusion permanent = ActiveExclusion.of(SelfExclusion.permanent(USER, PlatformType.SPORTS, now), now);
        assertEquals("You are permanently excluded from sports betting. You may only withdraw your funds.",
                SelfExclusionGuard.messageFor(permanent, GuardedAction.BET));

        ActiveExclusion temporary = ActiveExclusion.of(SelfExclusion.temporary(USER, PlatformType.CASINO, now,
                Instant.parse("2099-01-02T03:04:00Z")), now);
        assertEquals("You are temporarily excluded from the casino until 2099-01-02 03:04 UTC. "
                        + "You may only withdraw your funds.",
                SelfExclusionGuard.messageFor(temporary, GuardedAction.DEPOSIT));

        ActiveExclusion cooldown = ActiveExclusion.of(SelfExclusion.cooldown(USER, PlatformType.PLATFORM, now), now);
        String cooldownMessage = SelfExclusionGuard.messageFor(cooldown, GuardedAction.BET);
        assertTrue(cooldownMessage.startsWith("You are in a cooldown period on the platform until "));
        assertTrue(cooldownMessage.endsWith("Betting is not allowed."));

        SelfExclusion lapsed = SelfExclusion.cooldown(USER, PlatformType.PLATFORM, now.minus(Duration.ofHours(30)));
        ActiveExclusion window = ActiveExclusion.of(lapsed, now);
        assertTrue(window.isInPostCooldownWindow());
        assertTrue(SelfExclusionGuard.messageFor(window, GuardedAction.BONUS)
                .contains("post-cooldown window on the platform"));
        assertTrue(window.rank() < cooldown.rank());
        assertTrue(cooldown.rank() < temporary.rank());
        assertTrue(temporary.rank() < permanent.rank());
    }
}
