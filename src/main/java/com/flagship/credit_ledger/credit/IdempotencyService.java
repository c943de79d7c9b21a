package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.ledger.CreditLedgerQueries;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Replay detection for ledger idempotency keys.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the credit_ledger unique column (always authoritative)
 * 3. Remember keys in Redis only once their ledger entry has committed
 *
 * The unique index stays the single source of truth: this check only saves a
 * transaction on obvious replays, it never decides that a key is new.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "credit-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final CreditLedgerQueries ledgerQueries;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final CreditMetrics metrics;

    public IdempotencyService(CreditLedgerQueries ledgerQueries,
                              Optional<StringRedisTemplate> redisTemplate,
                              CreditMetrics metrics) {
        this.ledgerQueries = ledgerQueries;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * Throws {@link CreditErrorCode#IDEMPOTENCY_CONFLICT} when the key already has a
     * ledger entry. A null key is never a replay.
     */
    public void assertNotProcessed(String idempotencyKey) {
        if (idempotencyKey == null) {
            return;
        }
        if (isProcessed(idempotencyKey)) {
            metrics.recordIdempotencyHit();
            log.info("Idempotent replay rejected: idempotencyKey={}", idempotencyKey);
            throw conflict(idempotencyKey);
        }
        metrics.recordIdempotencyMiss();
    }

    public boolean isProcessed(String idempotencyKey) {
        if (redisTemplate.isPresent()) {
            try {
                if (Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + idempotencyKey))) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return true;
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        boolean exists = ledgerQueries.idempotencyKeyExists(idempotencyKey);
        if (exists) {
            cache(idempotencyKey);
        }
        return exists;
    }

    /**
     * Caches the key once the surrounding transaction commits. A rolled-back
     * mutation must stay retryable, so nothing is cached before that.
     */
    public void remember(String idempotencyKey) {
        if (idempotencyKey == null) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey);
                }
            });
        } else {
            cache(idempotencyKey);
        }
    }

    public static CreditException conflict(String idempotencyKey) {
        return new CreditException(CreditErrorCode.IDEMPOTENCY_CONFLICT, "Operation already processed",
                Map.of("idempotencyKey", idempotencyKey));
    }

    private void cache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, "1", REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }
}
