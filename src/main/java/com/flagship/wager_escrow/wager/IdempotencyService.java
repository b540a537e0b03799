package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.observability.WagerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps Idempotency-Key values of create requests to wager ids.
 *
 * Redis is the fast path; wagers.idempotency_key is the source of truth.
 * Any Redis failure falls through to the database.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "wager-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final WagerStore wagerStore;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final WagerMetrics metrics;

    public IdempotencyService(WagerStore wagerStore,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              WagerMetrics metrics) {
        this.wagerStore = wagerStore;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @return id of the wager created under this key, if any
     */
    public Optional<UUID> findWagerId(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            metrics.recordIdempotencyHit();
            return cached;
        }

        Optional<UUID> stored = wagerStore.findByIdempotencyKey(idempotencyKey).map(Wager::getId);
        if (stored.isPresent()) {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            metrics.recordIdempotencyHit();
            writeCache(idempotencyKey, stored.get());
        } else {
            metrics.recordIdempotencyMiss();
        }
        return stored;
    }

    /**
     * Caches the mapping once the creating transaction commits; a rolled back
     * create leaves nothing behind in Redis.
     */
    public void remember(String idempotencyKey, UUID wagerId) {
        requireKey(idempotencyKey);
        if (wagerId == null) {
            throw new IllegalArgumentException("Wager ID cannot be null");
        }

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    writeCache(idempotencyKey, wagerId);
                }
            });
        } else {
            writeCache(idempotencyKey, wagerId);
        }
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String wagerId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            if (wagerId != null) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return Optional.of(UUID.fromString(wagerId));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
        }
        return Optional.empty();
    }

    private void writeCache(String idempotencyKey, UUID wagerId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, wagerId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
