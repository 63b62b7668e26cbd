package com.flagship.split_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import com.flagship.split_ledger.notification.ChangeVersionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox storage:
 * - events are only written inside the caller's transaction
 * - each change-version bump writes exactly one event with the new version
 * - published and failed events are tracked for the publisher
 */
@SpringBootTest
@Testcontainers
@ActiveProfiles("test")
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("split_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private ChangeNotificationTracker tracker;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ObjectMapper objectMapper;

    private String groupId;

    @BeforeEach
    void setUp() {
        tracker.drainAll();
        outboxEventRepository.deleteAll();
        groupId = "group-" + UUID.randomUUID();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private OutboxEvent saveInTransaction(String aggregateKey) {
        return new TransactionTemplate(transactionManager).execute(status ->
                outboxService.saveEvent("ChangeTracking", aggregateKey, "TestEvent", Map.of("value", 123)));
    }

    @Test
    @DisplayName("Saving an event without a surrounding transaction is refused")
    void saveRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
                () -> outboxService.saveEvent("ChangeTracking", "alice:" + groupId, "TestEvent", Map.of()));
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Saved event is unpublished with a JSON payload")
    void saveEvent() throws Exception {
        printTestHeader("Save event");

        OutboxEvent event = saveInTransaction("alice:" + groupId);

        assertNotNull(event.getId());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertEquals(123, objectMapper.readTree(event.getPayload()).get("value").asInt());
        assertEquals(1, outboxService.countUnpublished());
        printSuccess("Event stored unpublished");
    }

    @Test
    @DisplayName("A change-version bump writes one event per affected user")
    void changeBumpWritesEvent() throws Exception {
        printTestHeader("Change bump writes outbox event");

        tracker.notify(List.of("alice", "bob"), groupId, ChangeCategory.TRANSACTION);
        tracker.notify(List.of("alice", "bob"), groupId, ChangeCategory.BALANCE);
        tracker.drainAll();

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
                ChangeVersionEvent.AGGREGATE_TYPE, "alice:" + groupId);
        assertEquals(1, events.size());
        assertEquals(ChangeVersionEvent.EVENT_TYPE, events.get(0).getEventType());

        JsonNode payload = objectMapper.readTree(events.get(0).getPayload());
        System.out.println("Payload: " + payload);
        assertEquals("alice", payload.get("user_id").asText());
        assertEquals(groupId, payload.get("group_id").asText());
        assertEquals(1L, payload.get("change_version").asLong());
        assertEquals(1, outboxService.getEventsForAggregate(ChangeVersionEvent.AGGREGATE_TYPE, "bob:" + groupId).size());
        printSuccess("One event per user carrying the new version");
    }

    @Test
    @DisplayName("Published events are no longer handed out")
    void markPublished() {
        OutboxEvent event = saveInTransaction("alice:" + groupId);

        outboxService.markPublished(event.getId());

        assertTrue(outboxService.findPublishable(10, 5).isEmpty());
        assertNotNull(outboxEventRepository.findById(event.getId()).orElseThrow().getPublishedAt());
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Failures count up and stop the event being polled at the retry limit")
    void markFailed() {
        OutboxEvent event = saveInTransaction("alice:" + groupId);

        outboxService.markFailed(event.getId(), "Connection timeout");
        outboxService.markFailed(event.getId(), "Broker not available");

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(2, entity.getRetryCount());
        assertEquals("Broker not available", entity.getLastError());
        assertEquals(1, outboxService.findPublishable(10, 3).size());
        assertTrue(outboxService.findPublishable(10, 2).isEmpty());
        assertEquals(1, outboxEventRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(2));
    }

    @Test
    @DisplayName("Publishable events come back in commit order")
    void publishableInOrder() {
        OutboxEvent first = saveInTransaction("alice:" + groupId);
        OutboxEvent second = saveInTransaction("bob:" + groupId);
        OutboxEvent third = saveInTransaction("alice:" + groupId);

        List<UUID> ids = outboxService.findPublishable(10, 5).stream().map(OutboxEvent::getId).toList();

        assertEquals(List.of(first.getId(), second.getId(), third.getId()), ids);
    }

    @Test
    @DisplayName("Purge removes only published events older than the cutoff")
    void purgePublished() {
        OutboxEvent published = saveInTransaction("alice:" + groupId);
        OutboxEvent pending = saveInTransaction("bob:" + groupId);
        outboxService.markPublished(published.getId());

        int purged = outboxService.purgePublishedBefore(Instant.now().plusSeconds(60));

        assertEquals(1, purged);
        assertTrue(outboxEventRepository.findById(published.getId()).isEmpty());
        assertTrue(outboxEventRepository.findById(pending.getId()).isPresent());
    }
}
