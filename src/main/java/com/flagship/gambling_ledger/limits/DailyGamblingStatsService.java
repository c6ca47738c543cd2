package com.flagship.gambling_ledger.limits;

import com.flagship.gambling_ledger.exclusion.PlatformType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Per-day wager/win/loss/deposit totals, one row per (user, day, segment).
 *
 * Writes are single upserts so concurrent bets on different assets of the
 * same user both land. Loss is recomputed from the running wager and win
 * totals on every write; a win therefore gives back loss headroom.
 */
@Service
@Slf4j
public class DailyGamblingStatsService {

    private final JdbcTemplate jdbcTemplate;

    public DailyGamblingStatsService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordWager(UUID userId, PlatformType platformType, LocalDate date, long cents) {
        record(userId, platformType, date, cents, 0, 0);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordWin(UUID userId, PlatformType platformType, LocalDate date, long cents) {
        record(userId, platformType, date, 0, cents, 0);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordDeposit(UUID userId, PlatformType platformType, LocalDate date, long cents) {
        record(userId, platformType, date, 0, 0, cents);
    }

    private void record(UUID userId, PlatformType platformType, LocalDate date,
                        long wagerCents, long winCents, long depositCents) {
        if (wagerCents == 0 && winCents == 0 && depositCents == 0) {
            return;
        }
        jdbcTemplate.update(
            "INSERT INTO daily_gambling_stats " +
            "(user_id, stat_date, platform_type, wager_amount_cents, win_amount_cents, loss_amount_cents, " +
            " deposit_amount_cents, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, GREATEST(0, ? - ?), ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (user_id, stat_date, platform_type) DO UPDATE SET " +
            "  wager_amount_cents = daily_gambling_stats.wager_amount_cents + EXCLUDED.wager_amount_cents, " +
            "  win_amount_cents = daily_gambling_stats.win_amount_cents + EXCLUDED.win_amount_cents, " +
            "  loss_amount_cents = GREATEST(0, " +
            "      (daily_gambling_stats.wager_amount_cents + EXCLUDED.wager_amount_cents) " +
            "    - (daily_gambling_stats.win_amount_cents + EXCLUDED.win_amount_cents)), " +
            "  deposit_amount_cents = daily_gambling_stats.deposit_amount_cents + EXCLUDED.deposit_amount_cents, " +
            "  updated_at = CURRENT_TIMESTAMP",
            userId,
            date,
            platformType.name(),
            wagerCents,
            winCents,
            wagerCents,
            winCents,
            depositCents
        );
        log.debug("Recorded gambling stats: date={}, segment={}, wager={}, win={}, deposit={}",
            date, platformType, wagerCents, winCents, depositCents);
    }

    /**
     * Sums a metric over every day from {@code fromDate} on.
     *
     * @param segment segment to restrict to; PLATFORM or null sums all segments
     */
    public long sum(UUID userId, StatMetric metric, LocalDate fromDate, PlatformType segment) {
        String sql = "SELECT COALESCE(SUM(" + metric.column() + "), 0) FROM daily_gambling_stats " +
            "WHERE user_id = ? AND stat_date >= ?";
        Long total;
        if (segment == null || segment == PlatformType.PLATFORM) {
            total = jdbcTemplate.queryForObject(sql, Long.class, userId, fromDate);
        } else {
            total = jdbcTemplate.queryForObject(sql + " AND platform_type = ?", Long.class,
                userId, fromDate, segment.name());
        }
        return total != null ? total : 0L;
    }
}
