package com.flagship.gambling_ledger.observability;

import com.flagship.gambling_ledger.outbox.OutboxEvent;
import com.flagship.gambling_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges, one backlog series per aggregate so a stuck
 * balance topic is told apart from a stuck self-exclusion topic.
 *
 * Values are cached and refreshed by {@link MetricsScheduler}; a scrape
 * never touches the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    static final List<String> AGGREGATES = List.of(OutboxEvent.BALANCE, OutboxEvent.SELF_EXCLUSION);

    private final OutboxEventRepository outboxRepository;
    private final int maxRetries;

    private final Map<String, AtomicLong> backlogByAggregate = new LinkedHashMap<>();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong exhaustedEvents = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry registry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.maxRetries = maxRetries;

        for (String aggregate : AGGREGATES) {
            AtomicLong backlog = new AtomicLong();
            backlogByAggregate.put(aggregate, backlog);
            Gauge.builder("outbox.backlog.size", backlog, AtomicLong::get)
                    .description("Unpublished outbox events")
                    .tag("aggregate", aggregate)
                    .register(registry);
        }

        Gauge.builder("outbox.backlog.age.seconds", oldestPendingAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event")
                .register(registry);

        Gauge.builder("outbox.events.exhausted", exhaustedEvents, AtomicLong::get)
                .description("Events that used up their publish retries and need an operator")
                .register(registry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Map<String, Long> pending = new HashMap<>();
            for (Object[] row : outboxRepository.countUnpublishedByAggregateType()) {
                pending.put((String) row[0], ((Number) row[1]).longValue());
            }
            backlogByAggregate.forEach((aggregate, gauge) -> gauge.set(pending.getOrDefault(aggregate, 0L)));

            oldestPendingAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L));

            exhaustedEvents.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, exhausted={}",
                    pending, oldestPendingAgeSeconds.get(), exhaustedEvents.get());
        } catch (DataAccessException e) {
            log.warn("Outbox metrics refresh failed, keeping previous values: {}", e.getMessage());
        }
    }
}
