package com.flagship.gambling_ledger.limits;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusion;
import com.flagship.gambling_ledger.exclusion.SelfExclusionEntity;
import com.flagship.gambling_ledger.exclusion.SelfExclusionRepository;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Compares a user's period totals against their deposit, loss and wager
 * limits.
 *
 * A limit scoped to PLATFORM is measured against activity on every segment
 * and applies to all of them; a segment limit only sees and only applies to
 * its own segment. Limits pending removal are still enforced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodicLimitEvaluator {

    private final SelfExclusionRepository exclusionRepository;
    private final DailyGamblingStatsService statsService;

    /**
     * Headroom left under the user's active limit of the given kind.
     *
     * @return empty when no such limit is configured
     */
    @Transactional(readOnly = true)
    public Optional<BigDecimal> remaining(UUID userId, SelfExclusionType limitType,
                                          LimitPeriod period, PlatformType segment) {
        if (!limitType.isLimit()) {
            throw new IllegalArgumentException(limitType + " is not a limit type");
        }
        Instant now = Instant.now();
        return exclusionRepository.findActiveByTypes(userId, EnumSet.of(limitType)).stream()
            .map(SelfExclusionEntity::toDomain)
            .filter(limit -> limit.getPeriod() == period && limit.getPlatformType() == segment)
            .findFirst()
            .map(limit -> remaining(limit, now));
    }

    public BigDecimal remaining(SelfExclusion limit, Instant now) {
        return limit.getLimitAmount().subtract(used(limit, now)).max(BigDecimal.ZERO);
    }

    public BigDecimal used(SelfExclusion limit, Instant now) {
        long cents = statsService.sum(limit.getUserId(), metricFor(limit.getType()),
            limit.getPeriod().firstDay(now), limit.getPlatformType());
        return MinorUnits.fromCents(cents);
    }

    /**
     * Rejects a stake that would push loss or wager totals past a limit
     * covering the bet's segment.
     */
    @Transactional(readOnly = true)
    public void checkBet(UUID userId, long stakeCents, PlatformType segment) {
        if (stakeCents <= 0) {
            return;
        }
        Instant now = Instant.now();
        BigDecimal stake = MinorUnits.fromCents(stakeCents);

        for (SelfExclusion limit : applicableLimits(userId, segment,
                EnumSet.of(SelfExclusionType.LOSS_LIMIT, SelfExclusionType.WAGER_LIMIT))) {
            BigDecimal used = used(limit, now);
            if (used.add(stake).compareTo(limit.getLimitAmount()) <= 0) {
                continue;
            }
            BigDecimal remaining = limit.getLimitAmount().subtract(used).max(BigDecimal.ZERO);
            if (limit.getType() == SelfExclusionType.LOSS_LIMIT) {
                log.info("Bet rejected by loss limit: limitId={}, period={}, segment={}, used={}, stake={}",
                    limit.getId(), limit.getPeriod(), limit.getPlatformType(), used, stake);
                throw new LimitExceededException(LimitKind.LOSS, limit.getPeriod(), String.format(
                    "Loss limit reached for %s period on %s. Your limit is %s and you have %s remaining.",
                    limit.getPeriod(), limit.getPlatformType(),
                    limit.getLimitAmount().toPlainString(), remaining.toPlainString()));
            }
            log.info("Bet rejected by wager limit: limitId={}, period={}, segment={}, used={}, stake={}",
                limit.getId(), limit.getPeriod(), limit.getPlatformType(), used, stake);
            throw new LimitExceededException(LimitKind.WAGER, limit.getPeriod(), String.format(
                "Wager limit exceeded for %s period on %s. Your limit is %s. You have %s remaining.",
                limit.getPeriod(), limit.getPlatformType(),
                limit.getLimitAmount().toPlainString(), remaining.toPlainString()));
        }
    }

    @Transactional(readOnly = true)
    public void checkDeposit(UUID userId, long depositCents, PlatformType segment) {
        if (depositCents <= 0) {
            return;
        }
        Instant now = Instant.now();
        BigDecimal deposit = MinorUnits.fromCents(depositCents);

        for (SelfExclusion limit : applicableLimits(userId, segment, EnumSet.of(SelfExclusionType.DEPOSIT_LIMIT))) {
            BigDecimal used = used(limit, now);
            if (used.add(deposit).compareTo(limit.getLimitAmount()) > 0) {
                BigDecimal remaining = limit.getLimitAmount().subtract(used).max(BigDecimal.ZERO);
                throw new LimitExceededException(LimitKind.DEPOSIT, limit.getPeriod(), String.format(
                    "Deposit limit exceeded for %s period on %s. Your limit is %s. You have %s remaining.",
                    limit.getPeriod(), limit.getPlatformType(),
                    limit.getLimitAmount().toPlainString(), remaining.toPlainString()));
            }
        }
    }

    /**
     * Every active limit of the user with its usage in the current window.
     */
    @Transactional(readOnly = true)
    public List<GamblingLimitStatus> getGamblingLimits(UUID userId) {
        Instant now = Instant.now();
        return exclusionRepository.findActiveByTypes(userId, SelfExclusionType.LIMIT_TYPES).stream()
            .map(SelfExclusionEntity::toDomain)
            .sorted(Comparator.comparing(SelfExclusion::getType).thenComparing(SelfExclusion::getPeriod))
            .map(limit -> {
                BigDecimal used = used(limit, now);
                return GamblingLimitStatus.builder()
                    .id(limit.getId())
                    .type(limit.getType())
                    .platformType(limit.getPlatformType())
                    .period(limit.getPeriod())
                    .limitAmount(limit.getLimitAmount())
                    .usedAmount(used)
                    .remainingAmount(limit.getLimitAmount().subtract(used).max(BigDecimal.ZERO))
                    .periodStart(limit.getPeriod().windowStart(now))
                    .periodEnd(limit.getPeriod().windowEnd(now))
                    .removalPending(limit.isRemovalPending())
                    .removalExpiresAt(limit.getRemovalExpiresAt())
                    .build();
            })
            .toList();
    }

    private List<SelfExclusion> applicableLimits(UUID userId, PlatformType segment,
                                                 EnumSet<SelfExclusionType> types) {
        PlatformType activitySegment = segment == null ? PlatformType.PLATFORM : segment;
        return exclusionRepository.findActiveByTypes(userId, types).stream()
            .map(SelfExclusionEntity::toDomain)
            .filter(limit -> limit.getPlatformType().covers(activitySegment))
            .toList();
    }

    static StatMetric metricFor(SelfExclusionType limitType) {
        return switch (limitType) {
            case LOSS_LIMIT -> StatMetric.LOSS;
            case WAGER_LIMIT -> StatMetric.WAGER;
            case DEPOSIT_LIMIT -> StatMetric.DEPOSIT;
            default -> throw new IllegalArgumentException(limitType + " is not a limit type");
        };
    }
}
