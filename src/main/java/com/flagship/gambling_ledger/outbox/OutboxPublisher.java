package com.flagship.gambling_ledger.outbox;

import com.flagship.gambling_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes events to Kafka.
 *
 * Events are keyed by user id, so all changes for one user land on one
 * partition in commit order. A failed send bumps the retry count; events
 * past max-retries are left in the table for manual replay.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final LedgerMetrics metrics;

    @Value("${kafka.topic.balance-events:balance-events}")
    private String balanceTopic;

    @Value("${kafka.topic.self-exclusion-events:self-exclusion-events}")
    private String selfExclusionTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId().toString(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            metrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
            outboxService.markFailed(event.getId(), "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            metrics.recordEventPublishFailure(event.getEventType());
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case OutboxEvent.BALANCE -> balanceTopic;
            case OutboxEvent.SELF_EXCLUSION -> selfExclusionTopic;
            default -> throw new IllegalStateException("No topic for aggregate type " + event.getAggregateType());
        };
    }
}
