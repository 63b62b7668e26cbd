package com.flagship.split_ledger.common.idempotency;

import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Idempotency-Key bookkeeping for record creation.
 *
 * Lookup order:
 * 1. Redis (fast, may be unavailable)
 * 2. The record table's own idempotency_key column (authoritative)
 *
 * A database hit is written back to Redis. Redis failures are logged and
 * never fail the request; a database failure does.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final int MAX_KEY_LENGTH = 255;

    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerMetrics metrics;

    public IdempotencyService(Optional<StringRedisTemplate> redisTemplate, LedgerMetrics metrics) {
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @param recordType   namespace of the key ("expense", "settlement")
     * @param databaseLookup finds the record id stored with the key
     * @return id of the record already created with this key
     */
    public Optional<UUID> findExisting(String recordType, String idempotencyKey,
                                       Function<String, Optional<UUID>> databaseLookup) {
        validateKey(idempotencyKey);
        String redisKey = redisKey(recordType, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    metrics.recordIdempotencyHit();
                    log.debug("Idempotency key found in Redis: {}", redisKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for {}, falling back to database: {}", redisKey, e.getMessage());
            }
        }

        Optional<UUID> stored = databaseLookup.apply(idempotencyKey);
        if (stored.isPresent()) {
            metrics.recordIdempotencyHit();
            log.debug("Idempotency key found in database: {}", redisKey);
            cache(redisKey, stored.get());
        } else {
            metrics.recordIdempotencyMiss();
        }
        return stored;
    }

    /**
     * Caches the key after the record committed. The database row already
     * holds the key, so a failure here only costs the fast path.
     */
    public void remember(String recordType, String idempotencyKey, UUID recordId) {
        validateKey(idempotencyKey);
        if (recordId == null) {
            throw new IllegalArgumentException("Record ID cannot be null");
        }
        cache(redisKey(recordType, idempotencyKey), recordId);
    }

    private void cache(String redisKey, UUID recordId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, recordId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.debug("Failed to cache idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }

    private static void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Idempotency key must be at most " + MAX_KEY_LENGTH + " characters");
        }
    }

    private static String redisKey(String recordType, String idempotencyKey) {
        return REDIS_KEY_PREFIX + recordType + ":" + idempotencyKey;
    }
}
