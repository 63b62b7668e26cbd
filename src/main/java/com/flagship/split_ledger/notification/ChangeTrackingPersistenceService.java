package com.flagship.split_ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_ledger.config.LedgerProperties;
import com.flagship.split_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * JPA-backed {@link ChangeTrackingWriter}.
 *
 * One batch = one transaction:
 * 1. Load (or start) the tracking row of the key
 * 2. Apply the batch: version + 1, counters, recent-changes ring
 * 3. Write a ChangeVersionBumped outbox event in the same transaction
 * 4. After commit, hand the record to live SSE subscribers
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeTrackingPersistenceService implements ChangeTrackingWriter {

    private static final TypeReference<List<RecentChange>> RECENT_CHANGES_TYPE = new TypeReference<>() {};

    private final ChangeTrackingRepository repository;
    private final OutboxService outboxService;
    private final ChangeVersionBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final LedgerProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public ChangeTrackingRecord write(ChangeBatch batch) {
        ChangeKey key = batch.getKey();
        Optional<ChangeTrackingEntity> existing = repository.findByUserIdAndGroupId(key.getUserId(), key.getGroupId());

        ChangeTrackingRecord current = existing
                .map(entity -> entity.toDomain(parseRecentChanges(entity.getRecentChanges())))
                .orElseGet(() -> ChangeTrackingRecord.empty(key));
        ChangeTrackingRecord next = current.apply(batch,
                properties.getNotification().getRecentChangesLimit(), clock.instant());

        String ring = serializeRecentChanges(next.getRecentChanges());
        ChangeTrackingEntity entity = existing.orElse(null);
        if (entity == null) {
            entity = ChangeTrackingEntity.fromDomain(next, ring);
        } else {
            entity.updateFromDomain(next, ring);
        }
        repository.save(entity);

        outboxService.saveEvent(ChangeVersionEvent.AGGREGATE_TYPE, key.toString(),
                ChangeVersionEvent.EVENT_TYPE, ChangeVersionEvent.from(next));

        publishAfterCommit(next);
        log.debug("Change version of {} is now {}", key, next.getChangeVersion());
        return next;
    }

    @Transactional(readOnly = true)
    public Optional<ChangeTrackingRecord> find(ChangeKey key) {
        return repository.findByUserIdAndGroupId(key.getUserId(), key.getGroupId())
                .map(entity -> entity.toDomain(parseRecentChanges(entity.getRecentChanges())));
    }

    /**
     * Stored record, or the version-0 record if nothing has been written for the key yet.
     */
    @Transactional(readOnly = true)
    public ChangeTrackingRecord findOrEmpty(ChangeKey key) {
        return find(key).orElseGet(() -> ChangeTrackingRecord.empty(key));
    }

    private void publishAfterCommit(ChangeTrackingRecord record) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            broadcaster.publish(record);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                broadcaster.publish(record);
            }
        });
    }

    private List<RecentChange> parseRecentChanges(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, RECENT_CHANGES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable recent_changes column", e);
        }
    }

    private String serializeRecentChanges(List<RecentChange> changes) {
        try {
            return objectMapper.writeValueAsString(changes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize recent changes", e);
        }
    }
}
