package com.flagship.order_payments.outbox;

import com.flagship.order_payments.catalog.ProductEntity;
import com.flagship.order_payments.catalog.ProductRepository;
import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.order.OrderService;
import com.flagship.order_payments.payment.event.OrderPlacedEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox relay against real PostgreSQL and Kafka.
 *
 * These tests verify that:
 * - Events written with an order change reach the topic
 * - Records are keyed by order id, so one order's events share a partition
 * - Relayed events are marked published
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("order_payments_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.kafka.admin.auto-create", () -> "true");
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "200");
    }

    @Autowired
    private OrderService orderService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Value("${kafka.topic.order-payments}")
    private String topic;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM outbox_events");
        jdbcTemplate.update("DELETE FROM payments");
        jdbcTemplate.update("DELETE FROM order_items");
        jdbcTemplate.update("DELETE FROM orders");
        jdbcTemplate.update("DELETE FROM products");
    }

    private KafkaConsumer<String, String> createConsumer() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "outbox-test-" + UUID.randomUUID());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return new KafkaConsumer<>(props);
    }

    @Test
    @DisplayName("OrderPlaced event is relayed to Kafka keyed by order id and marked published")
    void relaysOrderPlacedEvent() throws Exception {
        printTestHeader("Outbox relay");
        ProductEntity product = productRepository.save(ProductEntity.create("Cooking stove", new BigDecimal("80.00"), 4));
        Order order = orderService.placeOrder(UUID.randomUUID(), "Plot 2, Moshi",
            List.of(new OrderService.LineRequest(product.getId(), 1)));
        String orderKey = String.valueOf(order.getId());

        List<ConsumerRecord<String, String>> received = new ArrayList<>();
        try (KafkaConsumer<String, String> consumer = createConsumer()) {
            consumer.subscribe(List.of(topic));
            long deadline = System.currentTimeMillis() + 30_000;
            while (received.isEmpty() && System.currentTimeMillis() < deadline) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));
                records.forEach(record -> {
                    if (orderKey.equals(record.key())) {
                        received.add(record);
                    }
                });
            }
        }

        assertFalse(received.isEmpty(), "No record for order " + orderKey + " arrived");
        assertTrue(received.get(0).value().contains("\"orderId\":" + order.getId()));

        long deadline = System.currentTimeMillis() + 10_000;
        while (outboxService.countUnpublished() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(200);
        }
        List<OutboxEvent> events = outboxService.getEventsForOrder(order.getId());
        assertEquals(1, events.size());
        assertEquals(OrderPlacedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertTrue(events.get(0).isPublished());
        printSuccess("Event relayed and marked published");
    }
}
