package com.flagship.gambling_ledger.exclusion;

import com.flagship.gambling_ledger.exception.ConflictException;
import com.flagship.gambling_ledger.exception.NotFoundException;
import com.flagship.gambling_ledger.exclusion.event.SelfExclusionEvent;
import com.flagship.gambling_ledger.lock.LockCoordinator;
import com.flagship.gambling_ledger.lock.LockKeys;
import com.flagship.gambling_ledger.observability.CorrelationContext;
import com.flagship.gambling_ledger.observability.LedgerMetrics;
import com.flagship.gambling_ledger.outbox.OutboxEvent;
import com.flagship.gambling_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates, cancels and extends self-exclusions and spending limits, and
 * answers "what restricts this user right now".
 *
 * All mutations of one user's records run under the
 * {@code self-exclusion:{userId}} lock and in one transaction. The partial
 * unique indexes on self_exclusions remain the final arbiter: a violation
 * that slips past the lock surfaces as a {@link ConflictException}.
 */
@Service
@Slf4j
public class SelfExclusionService {

    static final Set<Integer> EXTENSION_DAYS = Set.of(1, 7, 30, 180);

    private static final String AGGREGATE_TYPE = OutboxEvent.SELF_EXCLUSION;

    private final SelfExclusionRepository repository;
    private final LockCoordinator lockCoordinator;
    private final TransactionTemplate transactionTemplate;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    public SelfExclusionService(SelfExclusionRepository repository,
                                LockCoordinator lockCoordinator,
                                PlatformTransactionManager transactionManager,
                                OutboxService outboxService,
                                LedgerMetrics metrics) {
        this.repository = repository;
        this.lockCoordinator = lockCoordinator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    // ==================== Mutations ====================

    public SelfExclusion create(UUID userId, NewSelfExclusion request) {
        if (request.getType() == null) {
            throw new IllegalArgumentException("Self-exclusion type is required");
        }
        PlatformType platformType = request.getPlatformType() == null
            ? PlatformType.PLATFORM : request.getPlatformType();

        return mutate(userId, () -> {
            Instant now = Instant.now();
            SelfExclusion result = switch (request.getType()) {
                case COOLDOWN -> createCooldown(userId, platformType, now);
                case TEMPORARY, PERMANENT -> createAccessExclusion(userId, request, platformType, now);
                case DEPOSIT_LIMIT, LOSS_LIMIT, WAGER_LIMIT -> createOrUpdateLimit(userId, request, platformType, now);
            };
            log.info("Self-exclusion saved: id={}, type={}, platformType={}, endDate={}",
                result.getId(), result.getType(), result.getPlatformType(), result.getEndDate());
            return result;
        });
    }

    /**
     * Cancels an exclusion or starts the removal countdown of a limit.
     *
     * @return the limit now pending removal, or empty if the record was
     *         deleted outright (cooldowns)
     */
    public Optional<SelfExclusion> cancel(UUID userId, UUID exclusionId) {
        return mutate(userId, () -> {
            SelfExclusionEntity entity = findOwned(userId, exclusionId);
            SelfExclusion exclusion = entity.toDomain();

            switch (exclusion.getType()) {
                case TEMPORARY, PERMANENT -> throw new ConflictException(
                    exclusion.getType() + " exclusions cannot be canceled before their end date");
                case COOLDOWN -> {
                    repository.delete(entity);
                    publish(SelfExclusionEvent.CANCELLED, exclusion);
                    log.info("Cooldown cancelled and removed: id={}, platformType={}",
                        exclusion.getId(), exclusion.getPlatformType());
                    return Optional.empty();
                }
                default -> {
                    if (exclusion.isRemovalPending()) {
                        return Optional.of(exclusion);
                    }
                    SelfExclusion pending = exclusion.requestRemoval(Instant.now());
                    entity.updateFromDomain(pending);
                    SelfExclusion saved = repository.saveAndFlush(entity).toDomain();
                    publish(SelfExclusionEvent.REMOVAL_REQUESTED, saved);
                    log.info("Limit removal requested: id={}, type={}, removalExpiresAt={}",
                        saved.getId(), saved.getType(), saved.getRemovalExpiresAt());
                    return Optional.of(saved);
                }
            }
        });
    }

    /**
     * Turns a cooldown that is in its post-cooldown window into a temporary
     * exclusion, or a permanent one when durationDays is null.
     */
    public SelfExclusion extend(UUID userId, UUID cooldownId, PlatformType platformType, Integer durationDays) {
        if (durationDays != null && !EXTENSION_DAYS.contains(durationDays)) {
            throw new IllegalArgumentException("Duration must be one of 1, 7, 30 or 180 days, or omitted for permanent");
        }

        return mutate(userId, () -> {
            Instant now = Instant.now();
            SelfExclusionEntity entity = findOwned(userId, cooldownId);
            SelfExclusion cooldown = entity.toDomain();

            if (cooldown.getType() != SelfExclusionType.COOLDOWN) {
                throw new IllegalArgumentException("Only cooldown exclusions can be extended");
            }
            if (platformType != null && platformType != cooldown.getPlatformType()) {
                throw new IllegalArgumentException(String.format(
                    "Platform type %s does not match the cooldown's platform type %s",
                    platformType, cooldown.getPlatformType()));
            }
            if (cooldown.isCooldownRunning(now)) {
                throw new ConflictException(
                    "This cooldown is not in the post-cooldown window yet. You can extend it once the cooldown has ended.");
            }
            if (!cooldown.isInPostCooldownWindow(now)) {
                throw new ConflictException(
                    "The post-cooldown window has expired. You can no longer extend this cooldown.");
            }

            PlatformType segment = cooldown.getPlatformType();
            SelfExclusion replacement = durationDays == null
                ? SelfExclusion.permanent(userId, segment, now)
                : SelfExclusion.temporary(userId, segment, now, now.plus(Duration.ofDays(durationDays)));

            rejectPermanent(userId, segment, now);
            supersedeTemporary(userId, replacement, now);

            repository.delete(entity);
            repository.flush();
            retireStale(userId, replacement.getType(), segment, now);

            SelfExclusion saved = repository.saveAndFlush(SelfExclusionEntity.fromDomain(replacement)).toDomain();
            publish(SelfExclusionEvent.EXTENDED, saved);
            log.info("Cooldown {} extended to {} exclusion {}: endDate={}",
                cooldownId, saved.getType(), saved.getId(), saved.getEndDate());
            return saved;
        });
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public List<SelfExclusion> getSelfExclusions(UUID userId) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId).stream()
            .map(SelfExclusionEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<SelfExclusion> getActiveSelfExclusions(UUID userId) {
        return getActiveSelfExclusions(userId, null);
    }

    /**
     * Records currently in force: running cooldowns, cooldowns in their
     * window, unexpired temporary and permanent exclusions, and limits
     * (including those pending removal).
     *
     * @param segment restricts to records covering this segment; null for all
     */
    @Transactional(readOnly = true)
    public List<SelfExclusion> getActiveSelfExclusions(UUID userId, PlatformType segment) {
        Instant now = Instant.now();
        return repository.findByUserIdAndActiveTrue(userId).stream()
            .map(SelfExclusionEntity::toDomain)
            .filter(exclusion -> exclusion.isInForce(now))
            .filter(exclusion -> segment == null || exclusion.appliesTo(segment))
            .sorted(Comparator.comparing(SelfExclusion::getCreatedAt).reversed())
            .toList();
    }

    /**
     * The most restrictive access exclusion covering the segment, counting
     * platform-wide exclusions for every segment. Order: permanent,
     * temporary, running cooldown, post-cooldown window.
     *
     * @param segment null to consider every segment
     */
    @Transactional(readOnly = true)
    public Optional<ActiveExclusion> hasActiveSelfExclusion(UUID userId, PlatformType segment) {
        Instant now = Instant.now();
        return repository.findActiveByTypes(userId, SelfExclusionType.ACCESS_TYPES).stream()
            .map(SelfExclusionEntity::toDomain)
            .filter(exclusion -> exclusion.isInForce(now))
            .filter(exclusion -> segment == null || exclusion.appliesTo(segment))
            .map(exclusion -> ActiveExclusion.of(exclusion, now))
            .max(Comparator.comparingInt(ActiveExclusion::rank)
                .thenComparing(active -> active.getPlatformType() == PlatformType.PLATFORM));
    }

    // ==================== Creation paths ====================

    private SelfExclusion createCooldown(UUID userId, PlatformType platformType, Instant now) {
        rejectPermanent(userId, platformType, now);

        repository.findByUserIdAndTypeAndPlatformTypeAndActiveTrue(userId, SelfExclusionType.COOLDOWN, platformType)
            .ifPresent(existing -> {
                log.info("Replacing existing cooldown {} on {}", existing.getId(), platformType);
                repository.delete(existing);
                repository.flush();
            });

        SelfExclusion saved = repository.saveAndFlush(
            SelfExclusionEntity.fromDomain(SelfExclusion.cooldown(userId, platformType, now))).toDomain();
        publish(SelfExclusionEvent.CREATED, saved);
        return saved;
    }

    private SelfExclusion createAccessExclusion(UUID userId, NewSelfExclusion request,
                                                PlatformType platformType, Instant now) {
        SelfExclusion exclusion;
        if (request.getType() == SelfExclusionType.PERMANENT) {
            exclusion = SelfExclusion.permanent(userId, platformType, now);
        } else {
            exclusion = SelfExclusion.temporary(userId, platformType, now, temporaryEndDate(request, now));
        }

        rejectPermanent(userId, platformType, now);

        SelfExclusionEntity cooldown = repository
            .findByUserIdAndTypeAndPlatformTypeAndActiveTrue(userId, SelfExclusionType.COOLDOWN, platformType)
            .filter(entity -> entity.toDomain().isInForce(now))
            .orElseThrow(() -> new IllegalArgumentException(
                "You must first take a 24-hour cooldown before setting up self-exclusion"));

        supersedeTemporary(userId, exclusion, now);
        repository.delete(cooldown);
        repository.flush();
        retireStale(userId, exclusion.getType(), platformType, now);

        SelfExclusion saved = repository.saveAndFlush(SelfExclusionEntity.fromDomain(exclusion)).toDomain();
        publish(SelfExclusionEvent.CREATED, saved);
        return saved;
    }

    private SelfExclusion createOrUpdateLimit(UUID userId, NewSelfExclusion request,
                                              PlatformType platformType, Instant now) {
        SelfExclusion limit = SelfExclusion.limit(userId, request.getType(), platformType,
            request.getPeriod(), request.getLimitAmount(), now);

        Optional<SelfExclusionEntity> sameSlot = repository
            .findByUserIdAndTypeAndPlatformTypeAndPeriodAndActiveTrue(
                userId, limit.getType(), platformType, limit.getPeriod());

        if (sameSlot.isPresent()) {
            SelfExclusionEntity entity = sameSlot.get();
            entity.updateFromDomain(entity.toDomain().withLimitAmount(limit.getLimitAmount(), now));
            SelfExclusion saved = repository.saveAndFlush(entity).toDomain();
            publish(SelfExclusionEvent.UPDATED, saved);
            return saved;
        }

        if (limit.getType() == SelfExclusionType.WAGER_LIMIT
                && !repository.findActiveByTypes(userId, Set.of(SelfExclusionType.WAGER_LIMIT)).isEmpty()) {
            throw new ConflictException("You can only have one active wager limit at a time");
        }

        SelfExclusion saved = repository.saveAndFlush(SelfExclusionEntity.fromDomain(limit)).toDomain();
        publish(SelfExclusionEvent.CREATED, saved);
        return saved;
    }

    private Instant temporaryEndDate(NewSelfExclusion request, Instant now) {
        if (request.getEndDate() != null) {
            return request.getEndDate();
        }
        if (request.getDurationDays() != null) {
            if (request.getDurationDays() <= 0) {
                throw new IllegalArgumentException("Duration must be a positive number of days");
            }
            return now.plus(Duration.ofDays(request.getDurationDays()));
        }
        throw new IllegalArgumentException("End date is required for temporary self-exclusion");
    }

    /**
     * A permanent exclusion is never replaced or downgraded, so nothing else
     * may be taken on its segment.
     */
    private void rejectPermanent(UUID userId, PlatformType platformType, Instant now) {
        repository.findByUserIdAndTypeAndPlatformTypeAndActiveTrue(userId, SelfExclusionType.PERMANENT, platformType)
            .map(SelfExclusionEntity::toDomain)
            .filter(existing -> existing.isInForce(now))
            .ifPresent(existing -> {
                throw new ConflictException(String.format("You are already permanently excluded from %s", platformType));
            });
    }

    /**
     * Ends the temporary exclusion running on the replacement's segment. A
     * permanent exclusion always supersedes it; another temporary one only
     * when it ends later.
     */
    private void supersedeTemporary(UUID userId, SelfExclusion replacement, Instant now) {
        repository.findByUserIdAndTypeAndPlatformTypeAndActiveTrue(
                userId, SelfExclusionType.TEMPORARY, replacement.getPlatformType())
            .filter(running -> running.toDomain().isInForce(now))
            .ifPresent(running -> {
                SelfExclusion current = running.toDomain();
                if (replacement.getType() == SelfExclusionType.TEMPORARY
                        && current.getEndDate() != null
                        && !replacement.getEndDate().isAfter(current.getEndDate())) {
                    throw new ConflictException(String.format(
                        "You are already temporarily excluded from %s until %s",
                        replacement.getPlatformType(), current.getEndDate()));
                }
                running.updateFromDomain(current.deactivate(now));
                SelfExclusion superseded = repository.saveAndFlush(running).toDomain();
                publish(SelfExclusionEvent.UPDATED, superseded);
                log.info("Temporary exclusion {} on {} superseded by a new {} exclusion",
                    superseded.getId(), superseded.getPlatformType(), replacement.getType());
            });
    }

    /**
     * Retires an active row of the same slot that has stopped applying but
     * has not been swept by the expiry job yet, so the new row does not
     * collide with it on the unique index.
     */
    private void retireStale(UUID userId, SelfExclusionType type, PlatformType platformType, Instant now) {
        repository.findByUserIdAndTypeAndPlatformTypeAndActiveTrue(userId, type, platformType)
            .filter(existing -> !existing.toDomain().isInForce(now))
            .ifPresent(stale -> {
                if (type == SelfExclusionType.TEMPORARY) {
                    stale.updateFromDomain(stale.toDomain().deactivate(now));
                    repository.saveAndFlush(stale);
                } else {
                    repository.delete(stale);
                    repository.flush();
                }
            });
    }

    // ==================== Plumbing ====================

    private SelfExclusionEntity findOwned(UUID userId, UUID exclusionId) {
        return repository.findByIdAndUserId(exclusionId, userId)
            .orElseThrow(() -> new NotFoundException("Self-exclusion not found: " + exclusionId));
    }

    private void publish(String eventType, SelfExclusion exclusion) {
        outboxService.saveEvent(AGGREGATE_TYPE, exclusion.getUserId(), eventType,
            SelfExclusionEvent.of(eventType, exclusion));
        metrics.recordExclusionChange(exclusion.getType().name(), eventType);
    }

    private <T> T mutate(UUID userId, Supplier<T> change) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        String previousUserId = MDC.get(CorrelationContext.USER_ID_MDC_KEY);
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId.toString());
        try {
            return lockCoordinator.withLock(LockKeys.selfExclusion(userId), () -> {
                try {
                    return transactionTemplate.execute(status -> change.get());
                } catch (DataIntegrityViolationException e) {
                    log.warn("Self-exclusion change lost a uniqueness race: {}", e.getMostSpecificCause().getMessage());
                    throw new ConflictException("A conflicting self-exclusion already exists", e);
                }
            });
        } finally {
            if (previousUserId == null) {
                MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.USER_ID_MDC_KEY, previousUserId);
            }
        }
    }
}
