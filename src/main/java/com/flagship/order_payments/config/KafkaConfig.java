package com.flagship.order_payments.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic the outbox relay publishes order payment events to.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.order-payments:order-payments}")
    private String orderPaymentsTopic;

    /**
     * Events are keyed by order id, so one partition sees every event of an order in order.
     */
    @Bean
    public NewTopic orderPaymentsTopic() {
        return TopicBuilder.name(orderPaymentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
