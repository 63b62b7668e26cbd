package com.flagship.split_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that carries change-version events to the push layer.
 *
 * Keys are {@code userId:groupId}, so all bumps for one subscriber land on
 * the same partition in order.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic changeNotificationsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getTopic().getChangeNotifications())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
