package com.flagship.split_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event written in the same transaction as the state it describes and
 * published to Kafka later by {@link OutboxPublisher}.
 *
 * {@code aggregateKey} doubles as the Kafka record key, so all events of one
 * aggregate land on one partition in commit order.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    String aggregateKey;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateKey,
                                     String eventType, String payload, Instant now) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateKey, eventType, payload,
                now, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
