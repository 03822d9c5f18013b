package com.aigreentick.services.marketing.kafka.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaTopicConfig {

    @Value("${kafka.topics.delivery-status.name}")
    private String deliveryStatusTopicName;

    @Value("${kafka.topics.delivery-status.partitions:6}")
    private int deliveryStatusPartitions;

    @Value("${kafka.topics.delivery-status.replicas:1}")
    private int deliveryStatusReplicas;

    @Value("${kafka.topics.campaign-failures.name}")
    private String campaignFailuresTopicName;

    @Value("${kafka.topics.campaign-failures.partitions:3}")
    private int campaignFailuresPartitions;

    @Value("${kafka.topics.campaign-failures.replicas:1}")
    private int campaignFailuresReplicas;

    /**
     * Provider delivery/read/failed callbacks. Keyed by provider message id so events for one
     * message stay in order on a partition.
     */
    @Bean
    public NewTopic deliveryStatusTopic() {
        NewTopic topic = TopicBuilder.name(deliveryStatusTopicName)
                .partitions(deliveryStatusPartitions)
                .replicas(deliveryStatusReplicas)
                .config("retention.ms", "604800000") // 7 days
                .build();

        log.info("=== Delivery Status Topic Configuration ===");
        log.info("  - Name: {}", deliveryStatusTopicName);
        log.info("  - Partitions: {}", deliveryStatusPartitions);
        log.info("  - Replicas: {}", deliveryStatusReplicas);

        return topic;
    }

    /**
     * Dead letter topic for permanently failed recipients and dropped status events.
     */
    @Bean
    public NewTopic campaignFailuresTopic() {
        NewTopic topic = TopicBuilder.name(campaignFailuresTopicName)
                .partitions(campaignFailuresPartitions)
                .replicas(campaignFailuresReplicas)
                .config("retention.ms", "2592000000") // 30 days
                .build();

        log.info("=== Campaign Failures Topic Configuration ===");
        log.info("  - Name: {}", campaignFailuresTopicName);
        log.info("  - Partitions: {}", campaignFailuresPartitions);
        log.info("  - Retention: 30 days (for manual review)");

        return topic;
    }
}
