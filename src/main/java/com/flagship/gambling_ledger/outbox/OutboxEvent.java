package com.flagship.gambling_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * A balance or self-exclusion change waiting to be published to Kafka.
 *
 * Written in the same transaction as the change it describes, so an event
 * exists if and only if the change committed.
 */
@Value
public class OutboxEvent {

    public static final String BALANCE = "Balance";
    public static final String SELF_EXCLUSION = "SelfExclusion";

    /** Aggregates that have a topic. */
    public static final Set<String> AGGREGATE_TYPES = Set.of(BALANCE, SELF_EXCLUSION);

    UUID id;
    String aggregateType;
    UUID aggregateId;          // user id, used as Kafka key
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
