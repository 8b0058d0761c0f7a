package com.flagship.ad_escrow.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the campaign lifecycle topic.
 * Events are keyed by campaign id, so one campaign always lands on one partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.campaigns:campaigns}")
    private String campaignsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic campaignsTopic() {
        return TopicBuilder.name(campaignsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
