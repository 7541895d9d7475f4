package com.flagship.practice_ledger.observability;

import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Metric;
import org.apache.kafka.common.MetricName;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Producer-side view of the broker connection, read from the client's own metrics so the
 * check never blocks on the network.
 */
@Component("kafka")
public class KafkaHealthIndicator implements HealthIndicator {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String topic;

    public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                @Value("${ledger.events.topic:ledger-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
    }

    @Override
    public Health health() {
        try {
            Map<MetricName, ? extends Metric> metrics = kafkaTemplate.metrics();
            double connections = metrics.entrySet().stream()
                .filter(metric -> metric.getKey().group().equals("producer-metrics")
                    && metric.getKey().name().equals("connection-count"))
                .map(metric -> metric.getValue().metricValue())
                .filter(Number.class::isInstance)
                .mapToDouble(value -> ((Number) value).doubleValue())
                .sum();

            return (connections > 0 ? Health.up() : Health.unknown())
                .withDetail("topic", topic)
                .withDetail("connections", (long) connections)
                .build();
        } catch (KafkaException e) {
            return Health.down(e).withDetail("topic", topic).build();
        }
    }
}
