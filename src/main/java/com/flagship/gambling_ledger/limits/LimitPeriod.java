package com.flagship.gambling_ledger.limits;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Accounting windows for spending limits. Calendar windows are evaluated in
 * UTC; weeks start on Sunday. SESSION is a rolling 24 hours.
 */
public enum LimitPeriod {
    DAILY,
    WEEKLY,
    MONTHLY,
    HALF_YEAR,
    SESSION;

    static final Duration SESSION_LENGTH = Duration.ofHours(24);

    /**
     * First calendar day whose stats count towards the window containing now.
     */
    public LocalDate firstDay(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        return switch (this) {
            case DAILY -> today;
            case WEEKLY -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
            case MONTHLY -> today.withDayOfMonth(1);
            case HALF_YEAR -> today.getMonthValue() <= 6
                ? LocalDate.of(today.getYear(), 1, 1)
                : LocalDate.of(today.getYear(), 7, 1);
            case SESSION -> LocalDate.ofInstant(now.minus(SESSION_LENGTH), ZoneOffset.UTC);
        };
    }

    public Instant windowStart(Instant now) {
        if (this == SESSION) {
            return now.minus(SESSION_LENGTH);
        }
        return firstDay(now).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Instant windowEnd(Instant now) {
        LocalDate first = firstDay(now);
        LocalDate next = switch (this) {
            case DAILY -> first.plusDays(1);
            case WEEKLY -> first.plusWeeks(1);
            case MONTHLY -> first.plusMonths(1);
            case HALF_YEAR -> first.plusMonths(6);
            case SESSION -> null;
        };
        return next == null ? now : next.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
