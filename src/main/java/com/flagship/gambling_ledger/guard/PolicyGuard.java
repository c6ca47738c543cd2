package com.flagship.gambling_ledger.guard;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusionActiveException;
import com.flagship.gambling_ledger.exclusion.SelfExclusionGuard;
import com.flagship.gambling_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Applies a {@link GuardPolicy}: rate limit first, then the access
 * exclusion check for the policy's action.
 */
@Component
@RequiredArgsConstructor
public class PolicyGuard {

    private final RateLimiter rateLimiter;
    private final SelfExclusionGuard selfExclusionGuard;
    private final LedgerMetrics metrics;

    public void enforce(UUID userId, GuardPolicy policy, PlatformType segment) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        try {
            rateLimiter.acquire(userId, policy);
        } catch (RateLimitExceededException e) {
            metrics.recordGuardDenied(policy.getName(), "rate_limit");
            throw e;
        }

        if (!policy.checksExclusions()) {
            return;
        }
        try {
            selfExclusionGuard.assertAllowed(userId, policy.getAction(), segment);
        } catch (SelfExclusionActiveException e) {
            metrics.recordGuardDenied(policy.getName(), e.getExclusion().getType().name());
            throw e;
        }
    }
}
