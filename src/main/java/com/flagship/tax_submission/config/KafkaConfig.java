package com.flagship.tax_submission.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.time.Duration;

/**
 * Declares the document lifecycle topic.
 *
 * Records are keyed by document id, so every event of one document lands on
 * the same partition and consumers see PENDING before SUBMITTED before the
 * final state.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.documents:tax-documents}")
    private String documentsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Value("${kafka.topic.replicas:1}")
    private int replicas;

    @Value("${kafka.topic.retention-days:30}")
    private int retentionDays;

    @Bean
    public NewTopic documentsTopic() {
        return TopicBuilder.name(documentsTopic)
                .partitions(partitions)
                .replicas(replicas)
                .config(TopicConfig.RETENTION_MS_CONFIG,
                        String.valueOf(Duration.ofDays(retentionDays).toMillis()))
                .build();
    }
}
