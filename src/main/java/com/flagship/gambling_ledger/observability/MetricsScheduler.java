package com.flagship.gambling_ledger.observability;

import com.flagship.gambling_ledger.exclusion.SelfExclusionRepository;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes the database-backed gauges off the scrape path: the outbox
 * backlog, and how many exclusions and limits are active per type.
 */
@Component
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SelfExclusionRepository selfExclusionRepository;
    private final Map<SelfExclusionType, AtomicLong> activeByType = new EnumMap<>(SelfExclusionType.class);

    public MetricsScheduler(OutboxMetrics outboxMetrics,
                            SelfExclusionRepository selfExclusionRepository,
                            MeterRegistry registry) {
        this.outboxMetrics = outboxMetrics;
        this.selfExclusionRepository = selfExclusionRepository;

        for (SelfExclusionType type : SelfExclusionType.values()) {
            AtomicLong count = new AtomicLong();
            activeByType.put(type, count);
            Gauge.builder("exclusions.active", count, AtomicLong::get)
                    .description("Active exclusions and spending limits")
                    .tag("type", type.name())
                    .register(registry);
        }
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        refreshExclusionGauges();
    }

    void refreshExclusionGauges() {
        try {
            Map<SelfExclusionType, Long> counts = new EnumMap<>(SelfExclusionType.class);
            for (Object[] row : selfExclusionRepository.countActiveByType()) {
                counts.put((SelfExclusionType) row[0], ((Number) row[1]).longValue());
            }
            activeByType.forEach((type, gauge) -> gauge.set(counts.getOrDefault(type, 0L)));
        } catch (DataAccessException e) {
            log.warn("Self-exclusion gauge refresh failed: {}", e.getMessage());
        }
    }
}
