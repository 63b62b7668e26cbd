package com.flagship.split_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.mutations: attempts by record type and terminal state
 * - ledger.mutation.retries: conflict retries by record type
 * - ledger.mutation.conflicts.exhausted: conflicts surfaced to callers
 * - ledger.balance.query.duration: balance/debt query latency
 * - ledger.notifications.*: tracker flushes and coalescing
 * - idempotency.cache: Idempotency-Key hits and misses
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer balanceQueryTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.balanceQueryTimer = Timer.builder("ledger.balance.query.duration")
                .description("Time taken to load a group snapshot and derive balances")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Mutations ====================

    public void recordMutation(String recordType, String state) {
        registry.counter("ledger.mutations",
                "record_type", sanitizeTag(recordType),
                "state", sanitizeTag(state)
        ).increment();
    }

    public void recordMutationLatency(String operation, Duration duration) {
        registry.timer("ledger.mutation.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    public void recordConflictRetry(String recordType) {
        registry.counter("ledger.mutation.retries", "record_type", sanitizeTag(recordType)).increment();
    }

    public void recordConflictExhausted(String recordType) {
        registry.counter("ledger.mutation.conflicts.exhausted", "record_type", sanitizeTag(recordType)).increment();
    }

    public void recordRecordCreated(String recordType, String currency) {
        registry.counter("ledger.records.created",
                "record_type", sanitizeTag(recordType),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    // ==================== Queries ====================

    public <T> T timeBalanceQuery(Supplier<T> query) {
        return balanceQueryTimer.record(query);
    }

    public void recordIntegrityViolation() {
        registry.counter("ledger.integrity.violations").increment();
    }

    // ==================== Notifications ====================

    public void recordNotificationRequested(String category) {
        registry.counter("ledger.notifications.requested", "category", sanitizeTag(category)).increment();
    }

    public void recordNotificationFlushed(int coalescedIncrements) {
        registry.counter("ledger.notifications.flushed").increment();
        registry.summary("ledger.notifications.coalesced").record(coalescedIncrements);
    }

    public void recordNotificationFlushFailed() {
        registry.counter("ledger.notifications.flush_failed").increment();
    }

    // ==================== Idempotency ====================

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
