package com.flagship.split_ledger.outbox;

import com.flagship.split_ledger.config.LedgerProperties;
import com.flagship.split_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Failure handling of the publisher with the broker and outbox mocked.
 */
class OutboxPublisherRetryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics,
                new LedgerProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(String aggregateType, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, "alice:trip", "ChangeVersionBumped",
                "{\"change_version\":1}", NOW, null, retryCount, null, 1L);
    }

    @Test
    @DisplayName("Broker error marks the event failed and leaves it for the next poll")
    void sendFailureMarksFailed() {
        OutboxEvent event = event("ChangeTracking", 0);
        when(outboxService.findPublishable(anyInt(), anyInt())).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), contains("broker down"));
        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("ChangeVersionBumped");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("Last allowed failure dead-letters the event")
    void lastFailureDeadLetters() {
        OutboxEvent event = event("ChangeTracking", 4);
        when(outboxService.findPublishable(anyInt(), anyInt())).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxMetrics).recordEventDeadLettered("ChangeVersionBumped");
    }

    @Test
    @DisplayName("Event of an unknown aggregate type is marked failed without sending")
    void unknownAggregateType() {
        OutboxEvent event = event("Invoice", 0);
        when(outboxService.findPublishable(anyInt(), anyInt())).thenReturn(List.of(event));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), contains("Invoice"));
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Successful send marks the event published on the configured topic")
    @SuppressWarnings("unchecked")
    void successMarksPublished() {
        OutboxEvent event = event("ChangeTracking", 0);
        when(outboxService.findPublishable(anyInt(), anyInt())).thenReturn(List.of(event));
        SendResult<String, String> result = mock(SendResult.class);
        when(result.getRecordMetadata()).thenReturn(new RecordMetadata(
                new TopicPartition("ledger.change-notifications", 0), 0L, 0, 0L, 0, 0));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(result));

        publisher.publishPendingEvents();

        verify(kafkaTemplate).send(new LedgerProperties().getTopic().getChangeNotifications(),
                "alice:trip", "{\"change_version\":1}");
        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished(eq("ChangeVersionBumped"), any(Duration.class));
    }

    @Test
    @DisplayName("Outbox read failure is logged and does not escape the scheduler")
    void pollingErrorContained() {
        when(outboxService.findPublishable(anyInt(), anyInt())).thenThrow(new IllegalStateException("db down"));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
