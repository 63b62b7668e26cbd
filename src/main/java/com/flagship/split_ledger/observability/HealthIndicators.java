package com.flagship.split_ledger.observability;

import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the ledger's background machinery.
 */
public class HealthIndicators {

    /**
     * Reports the cached outbox gauges: WARNING for a growing backlog or any
     * dead-lettered event, DOWN once the backlog is critical.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxMetrics metrics;

        public OutboxHealthIndicator(OutboxMetrics metrics) {
            this.metrics = metrics;
        }

        @Override
        public Health health() {
            if (metrics.refreshedAt() == null) {
                return Health.unknown().withDetail("reason", "Outbox gauges not refreshed yet").build();
            }
            long pending = metrics.pendingCount();
            long deadLettered = metrics.deadLetteredCount();

            Health.Builder builder;
            if (pending >= BACKLOG_CRITICAL_THRESHOLD) {
                builder = Health.down();
            } else if (pending >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("pending", pending)
                    .withDetail("deadLettered", deadLettered)
                    .withDetail("refreshedAt", metrics.refreshedAt().toString())
                    .build();
        }
    }

    /**
     * Down when the debounce scheduler is stopped, since writes would then be
     * rejected with "tracker not running".
     */
    @Component("changeTrackerHealth")
    public static class ChangeTrackerHealthIndicator implements HealthIndicator {

        private final ChangeNotificationTracker tracker;

        public ChangeTrackerHealthIndicator(ChangeNotificationTracker tracker) {
            this.tracker = tracker;
        }

        @Override
        public Health health() {
            Health.Builder builder = tracker.isRunning() ? Health.up() : Health.down();
            return builder.withDetail("pendingKeys", tracker.pendingCount()).build();
        }
    }

    /**
     * Redis only backs the idempotency fast path; losing it degrades, never fails, the service.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency lookups fall back to the database";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
