package com.flagship.gambling_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publishes to. Both are keyed by user id.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.balance-events:balance-events}")
    private String balanceTopic;

    @Value("${kafka.topic.self-exclusion-events:self-exclusion-events}")
    private String selfExclusionTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic balanceEventsTopic() {
        return TopicBuilder.name(balanceTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic selfExclusionEventsTopic() {
        return TopicBuilder.name(selfExclusionTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
