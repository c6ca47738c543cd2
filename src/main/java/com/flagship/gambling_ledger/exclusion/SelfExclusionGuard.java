package com.flagship.gambling_ledger.exclusion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Answers "may this user do this on this segment right now" and turns a
 * refusal into a user-facing {@link SelfExclusionActiveException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SelfExclusionGuard {

    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final SelfExclusionService selfExclusionService;

    /**
     * @param segment the segment the action belongs to; null when the action
     *                is not tied to one
     * @throws SelfExclusionActiveException if an access exclusion applies
     */
    public void assertAllowed(UUID userId, GuardedAction action, PlatformType segment) {
        if (action.isSessionAction()) {
            assertSessionAllowed(userId, action);
            return;
        }

        selfExclusionService.hasActiveSelfExclusion(userId, segment).ifPresent(active -> {
            log.info("{} blocked for user {}: type={}, platformType={}, inPostCooldownWindow={}",
                action, userId, active.getType(), active.getPlatformType(), active.isInPostCooldownWindow());
            throw new SelfExclusionActiveException(active, action, messageFor(active, action));
        });
    }

    /**
     * Login and token refresh are refused under any permanent exclusion,
     * whatever its segment. Temporary exclusions and cooldowns leave the
     * session open so the user can still withdraw.
     */
    private void assertSessionAllowed(UUID userId, GuardedAction action) {
        selfExclusionService.hasActiveSelfExclusion(userId, null)
            .filter(active -> active.getType() == SelfExclusionType.PERMANENT)
            .ifPresent(active -> {
                log.info("{} blocked for user {}: permanent exclusion {} on {}",
                    action, userId, active.getId(), active.getPlatformType());
                throw new SelfExclusionActiveException(active, action,
                    "You are permanently excluded from this platform. Please contact support if you need assistance.");
            });
    }

    static String messageFor(ActiveExclusion active, GuardedAction action) {
        String segment = describe(active.getPlatformType());
        return switch (active.getType()) {
            case PERMANENT -> String.format(
                "You are permanently excluded from %s. You may only withdraw your funds.", segment);
            case TEMPORARY -> String.format(
                "You are temporarily excluded from %s until %s. You may only withdraw your funds.",
                segment, format(active.getEndDate()));
            case COOLDOWN -> active.isInPostCooldownWindow()
                ? String.format("You are in a post-cooldown window on %s until %s. %s is not allowed.",
                    segment, format(active.getPostCooldownWindowEnd()), action.getDisplayName())
                : String.format("You are in a cooldown period on %s until %s. %s is not allowed.",
                    segment, format(active.getEndDate()), action.getDisplayName());
            default -> throw new IllegalStateException(active.getType() + " is not an access restriction");
        };
    }

    private static String describe(PlatformType segment) {
        return switch (segment) {
            case SPORTS -> "sports betting";
            case CASINO -> "the casino";
            case PLATFORM -> "the platform";
        };
    }

    private static String format(Instant instant) {
        return instant == null ? "further notice" : DATE_FORMAT.format(instant);
    }
}
