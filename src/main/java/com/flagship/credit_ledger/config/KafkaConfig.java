package com.flagship.credit_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics used by the service: billing events come in, credit events go out.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.billing-events:billing-events}")
    private String billingEventsTopic;

    @Value("${kafka.topic.credit-events:credit-events}")
    private String creditEventsTopic;

    @Bean
    public NewTopic billingEventsTopic() {
        return TopicBuilder.name(billingEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * Keyed by holder id, so events of one holder stay ordered within a partition.
     */
    @Bean
    public NewTopic creditEventsTopic() {
        return TopicBuilder.name(creditEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
