package com.flagship.split_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_ledger.config.LedgerProperties;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import com.flagship.split_ledger.notification.ChangeVersionEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publisher against a real broker:
 * - change-version events reach the change-notifications topic
 * - records are keyed by user:group
 * - sent events are marked published
 */
@SpringBootTest
@Testcontainers
@ActiveProfiles("test")
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("split_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.kafka.admin.auto-create", () -> "true");
        // Publisher bean is needed, but polling is triggered by the test
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private ChangeNotificationTracker tracker;

    @Autowired
    private LedgerProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    private KafkaConsumer<String, String> consumer;
    private String groupId;

    @BeforeEach
    void setUp() {
        tracker.drainAll();
        outboxEventRepository.deleteAll();
        groupId = "group-" + UUID.randomUUID();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(properties.getTopic().getChangeNotifications()));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<ConsumerRecord<String, String>> pollForGroup(int expected, Duration timeout) {
        List<ConsumerRecord<String, String>> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (received.size() < expected && System.currentTimeMillis() < deadline) {
            consumer.poll(Duration.ofMillis(500)).forEach(record -> {
                if (record.key().endsWith(":" + groupId)) {
                    received.add(record);
                }
            });
        }
        return received;
    }

    @Test
    @DisplayName("Change-version events are sent keyed by user and group, then marked published")
    void publishesChangeVersionEvents() throws Exception {
        printTestHeader("Publisher sends change-version events");

        tracker.notify(List.of("alice", "bob"), groupId, ChangeCategory.TRANSACTION);
        tracker.drainAll();
        assertEquals(2, outboxService.countUnpublished());

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = pollForGroup(2, Duration.ofSeconds(20));
        assertEquals(2, records.size());
        for (ConsumerRecord<String, String> record : records) {
            JsonNode payload = objectMapper.readTree(record.value());
            System.out.println("Received: key=" + record.key() + ", value=" + payload);
            assertEquals(payload.get("user_id").asText() + ":" + groupId, record.key());
            assertEquals(1L, payload.get("change_version").asLong());
        }
        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Events delivered and marked published");
    }

    @Test
    @DisplayName("Successive bumps of one key arrive in version order")
    void versionsInOrder() throws Exception {
        for (int i = 0; i < 3; i++) {
            tracker.notify(List.of("alice"), groupId, ChangeCategory.BALANCE);
            tracker.drainAll();
        }
        assertEquals(3, outboxService.getEventsForAggregate(ChangeVersionEvent.AGGREGATE_TYPE, "alice:" + groupId).size());

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = pollForGroup(3, Duration.ofSeconds(20));
        List<Long> versions = new ArrayList<>();
        for (ConsumerRecord<String, String> record : records) {
            versions.add(objectMapper.readTree(record.value()).get("change_version").asLong());
        }
        assertEquals(List.of(1L, 2L, 3L), versions);
    }
}
