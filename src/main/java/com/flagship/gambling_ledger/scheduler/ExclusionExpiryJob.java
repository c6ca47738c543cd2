package com.flagship.gambling_ledger.scheduler;

import com.flagship.gambling_ledger.lock.Lock;
import com.flagship.gambling_ledger.lock.LockCoordinator;
import com.flagship.gambling_ledger.lock.LockKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs the expiry pass on a fixed rate.
 *
 * The leader lock only saves duplicate work; correctness does not depend on
 * it, so if Redis is down every worker simply runs the pass.
 */
@Component
@ConditionalOnProperty(name = "expiry.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ExclusionExpiryJob {

    private final SelfExclusionExpiryService expiryService;
    private final LockCoordinator lockCoordinator;
    private final boolean leaderLockEnabled;
    private final Duration leaderLockTtl;

    public ExclusionExpiryJob(SelfExclusionExpiryService expiryService,
                              LockCoordinator lockCoordinator,
                              @Value("${expiry.scheduler.leader-lock-enabled:true}") boolean leaderLockEnabled,
                              @Value("${expiry.scheduler.leader-lock-ttl-ms:30000}") long leaderLockTtlMs) {
        this.expiryService = expiryService;
        this.lockCoordinator = lockCoordinator;
        this.leaderLockEnabled = leaderLockEnabled;
        this.leaderLockTtl = Duration.ofMillis(leaderLockTtlMs);
    }

    @Scheduled(fixedRateString = "${expiry.scheduler.interval-ms:60000}")
    public void run() {
        if (!leaderLockEnabled) {
            runPass();
            return;
        }

        Optional<Lock> leader;
        try {
            leader = lockCoordinator.tryLock(LockKeys.EXPIRY_SCHEDULER, leaderLockTtl);
        } catch (DataAccessException e) {
            log.warn("Leader lock unavailable, running expiry pass anyway: {}", e.getMessage());
            runPass();
            return;
        }

        if (leader.isEmpty()) {
            log.debug("Another worker holds the expiry leader lock, skipping this tick");
            return;
        }
        try {
            runPass();
        } finally {
            lockCoordinator.release(leader.get());
        }
    }

    private void runPass() {
        try {
            expiryService.expireOutdated();
        } catch (Exception e) {
            log.error("Self-exclusion expiry pass failed", e);
        }
    }
}
