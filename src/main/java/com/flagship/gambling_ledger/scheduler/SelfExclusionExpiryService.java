package com.flagship.gambling_ledger.scheduler;

import com.flagship.gambling_ledger.exclusion.SelfExclusion;
import com.flagship.gambling_ledger.exclusion.SelfExclusionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Moves exclusions along their lifecycle once time has passed:
 * cooldown to post-cooldown window, window to removal, temporary exclusion
 * to inactive, and pending limit removal to deletion.
 *
 * Each step is one conditional statement, so running this twice, or on two
 * workers at once, changes nothing the second time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SelfExclusionExpiryService {

    private final SelfExclusionRepository repository;

    @Transactional
    public ExpiryReport expireOutdated() {
        return expireOutdated(Instant.now());
    }

    @Transactional
    public ExpiryReport expireOutdated(Instant now) {
        int windowsOpened = repository.openPostCooldownWindows(now,
            SelfExclusion.POST_COOLDOWN_WINDOW.getSeconds());
        int cooldownsRemoved = repository.deleteLapsedCooldowns(now);
        int temporaryExpired = repository.deactivateExpiredTemporaryExclusions(now);
        int limitsRemoved = repository.deleteLimitsPastRemovalGrace(now.minus(SelfExclusion.REMOVAL_GRACE_PERIOD));

        ExpiryReport report = new ExpiryReport(windowsOpened, cooldownsRemoved, temporaryExpired, limitsRemoved);
        if (report.total() > 0) {
            log.info("Self-exclusion expiry: windowsOpened={}, cooldownsRemoved={}, temporaryExpired={}, limitsRemoved={}",
                windowsOpened, cooldownsRemoved, temporaryExpired, limitsRemoved);
        }
        return report;
    }
}
