package com.flagship.wager_escrow.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the wager event topic consumed by the notification side.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.wager-events:wager-events}")
    private String wagerEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Keyed by wager id, so one wager's events stay ordered within a partition.
     */
    @Bean
    public NewTopic wagerEventsTopic() {
        return TopicBuilder.name(wagerEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
