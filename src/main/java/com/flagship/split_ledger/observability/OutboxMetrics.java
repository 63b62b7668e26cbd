package com.flagship.split_ledger.observability;

import com.flagship.split_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivery metrics of change-version events.
 *
 * Gauges (pending, oldest pending age, dead-lettered) serve values cached by
 * {@link #refresh()}, which runs on a fixed schedule; scrapes never hit the
 * database. The health indicator reads the same cache.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository repository;
    private final MeterRegistry registry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private volatile Instant refreshedAt;

    @PostConstruct
    void registerGauges() {
        Gauge.builder("ledger.outbox.pending", pending, AtomicLong::get)
                .description("Change-version events not yet delivered to Kafka")
                .register(registry);
        Gauge.builder("ledger.outbox.oldest.pending.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("Age of the oldest undelivered change-version event")
                .baseUnit("seconds")
                .register(registry);
        Gauge.builder("ledger.outbox.dead.lettered", deadLettered, AtomicLong::get)
                .description("Undelivered events that used up their publish attempts")
                .register(registry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refresh() {
        try {
            Instant now = clock.instant();
            pending.set(repository.countUnpublished());
            oldestPendingSeconds.set(repository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0L, Duration.between(oldest, now).getSeconds()))
                    .orElse(0L));
            deadLettered.set(repository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
            refreshedAt = now;
            log.debug("Outbox gauges: pending={}, oldestPending={}s, deadLettered={}",
                    pending.get(), oldestPendingSeconds.get(), deadLettered.get());
        } catch (DataAccessException e) {
            log.warn("Could not refresh outbox gauges, keeping previous values: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType, Duration sendLatency) {
        registry.counter("ledger.outbox.delivery", "event_type", eventType, "outcome", "published").increment();
        Timer.builder("ledger.outbox.send.latency")
                .tag("event_type", eventType)
                .register(registry)
                .record(sendLatency);
    }

    public void recordEventPublishFailed(String eventType) {
        registry.counter("ledger.outbox.delivery", "event_type", eventType, "outcome", "failed").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        registry.counter("ledger.outbox.delivery", "event_type", eventType, "outcome", "dead_lettered").increment();
    }

    long pendingCount() {
        return pending.get();
    }

    long deadLetteredCount() {
        return deadLettered.get();
    }

    Instant refreshedAt() {
        return refreshedAt;
    }
}
