package com.flagship.gambling_ledger.ledger;

import com.flagship.gambling_ledger.exception.ConflictException;
import com.flagship.gambling_ledger.exception.NotFoundException;
import com.flagship.gambling_ledger.exclusion.GuardedAction;
import com.flagship.gambling_ledger.exclusion.SelfExclusionActiveException;
import com.flagship.gambling_ledger.exclusion.SelfExclusionGuard;
import com.flagship.gambling_ledger.ledger.event.BalanceUpdatedEvent;
import com.flagship.gambling_ledger.limits.DailyGamblingStatsService;
import com.flagship.gambling_ledger.limits.LimitExceededException;
import com.flagship.gambling_ledger.limits.MinorUnits;
import com.flagship.gambling_ledger.limits.PeriodicLimitEvaluator;
import com.flagship.gambling_ledger.lock.LockCoordinator;
import com.flagship.gambling_ledger.lock.LockTimeoutException;
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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Applies signed operations to per-user, per-asset balances exactly once.
 *
 * Flow for one update:
 * 1. Validate, then answer a known operationId from storage (replay).
 * 2. For bets, refuse early if an access exclusion covers the segment.
 * 3. Lock balance:{userId}:{asset}.
 * 4. In one transaction: re-check the operationId, check limits, move the
 *    balance, append the operation, record daily stats, write the outbox
 *    event.
 * 5. Commit, then release the lock.
 *
 * A batch runs the same steps for up to 50 updates on one balance under a
 * single lock and a single transaction: every entry is applied or none is.
 *
 * The unique index on operation_id is the last line of defence: two
 * updates with the same key on different assets hold different locks, and
 * the loser's insert fails and is reported as a conflict.
 */
@Service
@Slf4j
public class BalanceLedgerService {

    private static final String AGGREGATE_TYPE = OutboxEvent.BALANCE;

    static final int MAX_BATCH_SIZE = 50;
    static final int MAX_HISTORY_PAGE = 100;

    private final BalanceStore balanceStore;
    private final BalanceOperationRepository operationRepository;
    private final AssetLimitPolicy assetLimitPolicy;
    private final SelfExclusionGuard exclusionGuard;
    private final PeriodicLimitEvaluator limitEvaluator;
    private final DailyGamblingStatsService statsService;
    private final LockCoordinator lockCoordinator;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public BalanceLedgerService(BalanceStore balanceStore,
                                BalanceOperationRepository operationRepository,
                                AssetLimitPolicy assetLimitPolicy,
                                SelfExclusionGuard exclusionGuard,
                                PeriodicLimitEvaluator limitEvaluator,
                                DailyGamblingStatsService statsService,
                                LockCoordinator lockCoordinator,
                                OutboxService outboxService,
                                LedgerMetrics metrics,
                                PlatformTransactionManager transactionManager) {
        this.balanceStore = balanceStore;
        this.operationRepository = operationRepository;
        this.assetLimitPolicy = assetLimitPolicy;
        this.exclusionGuard = exclusionGuard;
        this.limitEvaluator = limitEvaluator;
        this.statsService = statsService;
        this.lockCoordinator = lockCoordinator;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Applies the update, or returns the stored result if its operationId
     * was applied before.
     *
     * @throws IllegalArgumentException      malformed update
     * @throws ConflictException             operationId already used for a different operation
     * @throws SelfExclusionActiveException  bet on an excluded segment
     * @throws LimitExceededException        loss, wager or daily withdrawal limit
     * @throws InsufficientBalanceException  debit larger than the balance
     * @throws LockTimeoutException          balance busy
     */
    public BalanceUpdateResult updateBalance(BalanceUpdate update) {
        assetLimitPolicy.validate(update);

        MDC.put(CorrelationContext.OPERATION_ID_MDC_KEY, update.getOperationId());
        try {
            return metrics.timeUpdate(() -> apply(update));
        } catch (RuntimeException e) {
            metrics.recordRejected(update.getOperation().name(), e.getClass().getSimpleName());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.OPERATION_ID_MDC_KEY);
        }
    }

    /**
     * Applies a batch of updates on one (user, asset) balance atomically.
     * Entries run in order, each with its own replay, limit and balance
     * checks; the first refusal rolls back the entries before it.
     *
     * @throws IllegalArgumentException empty or oversized batch, mixed
     *                                  users or assets, repeated operationId,
     *                                  or a malformed entry
     * @see #updateBalance(BalanceUpdate) for the refusals of a single entry
     */
    public List<BalanceUpdateResult> updateBalances(List<BalanceUpdate> updates) {
        validateBatch(updates);
        BalanceUpdate first = updates.get(0);

        MDC.put(CorrelationContext.OPERATION_ID_MDC_KEY, first.getOperationId() + "+" + (updates.size() - 1));
        try {
            return metrics.timeUpdate(() -> applyBatch(updates));
        } catch (RuntimeException e) {
            metrics.recordRejected("BATCH", e.getClass().getSimpleName());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.OPERATION_ID_MDC_KEY);
        }
    }

    private void validateBatch(List<BalanceUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one operation");
        }
        if (updates.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Batch cannot contain more than " + MAX_BATCH_SIZE + " operations");
        }
        updates.forEach(assetLimitPolicy::validate);

        BalanceUpdate first = updates.get(0);
        Set<String> operationIds = new HashSet<>();
        for (BalanceUpdate update : updates) {
            if (!update.getUserId().equals(first.getUserId()) || update.getAsset() != first.getAsset()) {
                throw new IllegalArgumentException("All operations in a batch must be for the same user and asset");
            }
            if (!operationIds.add(update.getOperationId())) {
                throw new IllegalArgumentException("Duplicate operation ID in batch: " + update.getOperationId());
            }
        }
    }

    private List<BalanceUpdateResult> applyBatch(List<BalanceUpdate> updates) {
        updates.stream()
                .filter(update -> update.getOperation() == BalanceOperationType.BET)
                .map(BalanceUpdate::getPlatformType)
                .distinct()
                .forEach(segment -> exclusionGuard.assertAllowed(updates.get(0).getUserId(), GuardedAction.BET, segment));

        BalanceUpdate first = updates.get(0);
        List<BalanceUpdateResult> results = lockCoordinator.withLock(first.lockResource(), () -> {
            try {
                return transactionTemplate.execute(status -> updates.stream()
                        .map(this::applyLocked)
                        .toList());
            } catch (DataIntegrityViolationException e) {
                log.warn("Batch starting at {} lost a uniqueness race: {}",
                        first.getOperationId(), e.getMostSpecificCause().getMessage());
                throw new ConflictException("An operation in this batch is already being processed", e);
            }
        });
        log.info("Batch applied: size={}, asset={}, replayed={}", updates.size(), first.getAsset(),
                results.stream().filter(BalanceUpdateResult::isReplayed).count());
        return results;
    }

    private BalanceUpdateResult apply(BalanceUpdate update) {
        Optional<BalanceUpdateResult> replay = findReplay(update);
        if (replay.isPresent()) {
            return replay.get();
        }

        if (update.getOperation() == BalanceOperationType.BET) {
            exclusionGuard.assertAllowed(update.getUserId(), GuardedAction.BET, update.getPlatformType());
        }

        return lockCoordinator.withLock(update.lockResource(), () -> {
            try {
                return transactionTemplate.execute(status -> applyLocked(update));
            } catch (DataIntegrityViolationException e) {
                log.warn("Operation {} lost the uniqueness race: {}",
                        update.getOperationId(), e.getMostSpecificCause().getMessage());
                throw new ConflictException("Operation " + update.getOperationId() + " is already being processed", e);
            }
        });
    }

    private BalanceUpdateResult applyLocked(BalanceUpdate update) {
        Optional<BalanceUpdateResult> replay = findReplay(update);
        if (replay.isPresent()) {
            return replay.get();
        }

        BigDecimal referenceRate = assetLimitPolicy.referenceRate(update.getAsset());
        switch (update.getOperation()) {
            case BET -> limitEvaluator.checkBet(update.getUserId(),
                    MinorUnits.toCents(update.getAmount(), referenceRate), update.getPlatformType());
            case WITHDRAW -> assetLimitPolicy.checkDailyWithdrawal(update);
            default -> {
            }
        }

        BigDecimal previous = balanceStore.findBalance(update.getUserId(), update.getAsset()).orElse(BigDecimal.ZERO);
        BigDecimal resulting = move(update, previous);

        BalanceOperation operation = BalanceOperation.confirmed(update, previous, resulting);
        operationRepository.saveAndFlush(BalanceOperationEntity.fromDomain(operation));

        recordStats(update, referenceRate);
        outboxService.saveEvent(AGGREGATE_TYPE, update.getUserId(), BalanceUpdatedEvent.EVENT_TYPE,
                BalanceUpdatedEvent.from(operation));

        metrics.recordApplied(update.getOperation().name(), update.getAsset().name());
        log.info("Balance updated: operation={}, asset={}, amount={}, previous={}, resulting={}",
                update.getOperation(), update.getAsset(), update.getAmount().toPlainString(),
                previous.toPlainString(), resulting.toPlainString());
        return BalanceUpdateResult.applied(operation);
    }

    private BigDecimal move(BalanceUpdate update, BigDecimal current) {
        BalanceOperationType type = update.getOperation();
        BigDecimal amount = update.getAmount();

        if (amount.signum() == 0) {
            return current;
        }
        if (type.isCredit()) {
            if (current.add(amount).compareTo(assetLimitPolicy.maxBalance()) > 0) {
                throw new IllegalArgumentException("Balance cannot exceed " + assetLimitPolicy.maxBalance().toPlainString());
            }
            return balanceStore.upsert(update.getUserId(), update.getAsset(), amount);
        }
        if (type.mayGoNegative()) {
            return balanceStore.upsert(update.getUserId(), update.getAsset(), amount.negate());
        }
        return balanceStore.debitIfSufficient(update.getUserId(), update.getAsset(), amount)
                .orElseThrow(() -> {
                    log.warn("Insufficient balance: operation={}, asset={}, requested={}, available={}",
                            type, update.getAsset(), amount.toPlainString(), current.toPlainString());
                    return new InsufficientBalanceException(update.getUserId(), update.getAsset(), amount);
                });
    }

    private void recordStats(BalanceUpdate update, BigDecimal referenceRate) {
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        long cents = MinorUnits.toCents(update.getAmount(), referenceRate);
        switch (update.getOperation()) {
            case BET -> statsService.recordWager(update.getUserId(), update.getPlatformType(), today, cents);
            case WIN -> statsService.recordWin(update.getUserId(), update.getPlatformType(), today, cents);
            case DEPOSIT -> statsService.recordDeposit(update.getUserId(), update.getPlatformType(), today, cents);
            default -> {
            }
        }
    }

    private Optional<BalanceUpdateResult> findReplay(BalanceUpdate update) {
        return operationRepository.findByOperationId(update.getOperationId())
                .map(BalanceOperationEntity::toDomain)
                .map(existing -> {
                    if (!existing.isSameIntent(update)) {
                        log.warn("Operation id {} reused for a different operation: stored={} {} {}, submitted={} {} {}",
                                update.getOperationId(),
                                existing.getOperation(), existing.getAmount().toPlainString(), existing.getAsset(),
                                update.getOperation(), update.getAmount().toPlainString(), update.getAsset());
                        throw new ConflictException(
                                "Operation " + update.getOperationId() + " was already applied with different parameters");
                    }
                    metrics.recordReplay();
                    log.info("Replaying operation {}", update.getOperationId());
                    return BalanceUpdateResult.replayed(existing);
                });
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public BigDecimal getBalance(UUID userId, Asset asset) {
        return balanceStore.findBalance(userId, asset).orElse(BigDecimal.ZERO);
    }

    @Transactional(readOnly = true)
    public List<Balance> getBalances(UUID userId) {
        return balanceStore.findBalances(userId);
    }

    @Transactional(readOnly = true)
    public BalanceOperation findOperation(String operationId) {
        return operationRepository.findByOperationId(operationId)
                .map(BalanceOperationEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Operation not found: " + operationId));
    }

    /**
     * Balance history, newest first, optionally narrowed to one asset and
     * one operation kind.
     */
    @Transactional(readOnly = true)
    public List<BalanceOperation> getHistory(UUID userId, Asset asset, BalanceOperationType operation,
                                             int limit, int offset) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (limit < 1 || limit > MAX_HISTORY_PAGE) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_HISTORY_PAGE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        return operationRepository.findHistory(userId, asset, operation, limit, offset).stream()
                .map(BalanceOperationEntity::toDomain)
                .toList();
    }
}
