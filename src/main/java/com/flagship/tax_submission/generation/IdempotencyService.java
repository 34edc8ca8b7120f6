package com.flagship.tax_submission.generation;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps a tenant's Idempotency-Key to the document it produced.
 *
 * Redis is the fast path; the documents table (unique on tenant id and
 * idempotency key) is the source of truth and is consulted whenever Redis
 * misses or is down.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TenantIsolatedStore store;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(TenantIsolatedStore store,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.store = store;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Returns the document already generated under this key, if any.
     */
    public Optional<Document> findExisting(String tenantId, String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(tenantId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String documentNumber = redisTemplate.get().opsForValue().get(redisKey);
                if (documentNumber != null) {
                    Optional<Document> cached = store.findDocument(tenantId, documentNumber);
                    if (cached.isPresent()) {
                        log.debug("Idempotency key {} found in Redis -> {}", idempotencyKey, documentNumber);
                        return cached;
                    }
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}. Falling back to database. Error: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<Document> existing = store.findByIdempotencyKey(tenantId, idempotencyKey);
        existing.ifPresent(document -> {
            log.debug("Idempotency key {} found in database -> {}", idempotencyKey, document.getDocumentNumber());
            cache(redisKey, document.getDocumentNumber());
        });
        return existing;
    }

    /**
     * Caches the mapping in Redis. The database already holds it on the document row.
     */
    public void remember(String tenantId, String idempotencyKey, String documentNumber) {
        requireKey(idempotencyKey);
        if (documentNumber == null) {
            throw new IllegalArgumentException("Document number cannot be null");
        }
        cache(redisKey(tenantId, idempotencyKey), documentNumber);
    }

    private void cache(String redisKey, String documentNumber) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, documentNumber, REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static String redisKey(String tenantId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + tenantId + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
