package com.flagship.practice_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger events topic. Records are keyed by aggregate id, so partitions
 * only bound consumer parallelism, not ordering.
 */
@Configuration
public class KafkaConfig {

    @Value("${ledger.events.topic:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${ledger.events.partitions:3}")
    private int partitions;

    @Bean
    @ConditionalOnProperty(name = "ledger.events.create-topic", havingValue = "true", matchIfMissing = true)
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
