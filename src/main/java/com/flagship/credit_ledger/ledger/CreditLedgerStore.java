package com.flagship.credit_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Atomic balance mutations.
 *
 * Every primitive runs in one transaction:
 * 1. Make sure the balance row exists (balance 0) so there is something to lock
 * 2. Lock it with SELECT ... FOR UPDATE
 * 3. Compute and write the new balance
 * 4. Append exactly one ledger entry carrying balance_after
 *
 * Concurrent mutations of the same (holder, key) serialize on the row lock;
 * different keys never block each other. A duplicate idempotency key fails the
 * ledger insert, the whole transaction rolls back and the caller sees
 * {@link CreditErrorCode#IDEMPOTENCY_CONFLICT}.
 */
@Repository
@Slf4j
public class CreditLedgerStore {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTables tables;
    private final ObjectMapper objectMapper;

    public CreditLedgerStore(JdbcTemplate jdbcTemplate, LedgerTables tables, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.tables = tables;
        this.objectMapper = objectMapper;
    }

    /**
     * Adds {@code amount} to the balance. No upper bound is enforced here.
     *
     * @return the new balance
     */
    @Transactional
    public long atomicAdd(String holderId, String key, long amount, LedgerMutation mutation) {
        long current = lockBalance(holderId, key);
        long newBalance = current + amount;

        writeBalance(holderId, key, newBalance, mutation.getCurrency());
        appendEntry(holderId, key, amount, newBalance, TransactionType.GRANT, mutation);
        return newBalance;
    }

    /**
     * Subtracts {@code amount} only if the balance covers it. When it does not,
     * nothing is written and the current balance is reported back.
     */
    @Transactional
    public ConsumeResult atomicConsume(String holderId, String key, long amount, LedgerMutation mutation) {
        long current = lockBalance(holderId, key);
        if (current < amount) {
            return ConsumeResult.insufficient(current);
        }

        long newBalance = current - amount;
        writeBalance(holderId, key, newBalance, null);
        appendEntry(holderId, key, -amount, newBalance, TransactionType.CONSUME, mutation);
        return ConsumeResult.consumed(newBalance);
    }

    /**
     * Revokes {@code min(maxAmount, balance)}. Never drives the balance negative and
     * writes no entry when there is nothing to revoke.
     */
    @Transactional
    public RevokeResult atomicRevoke(String holderId, String key, long maxAmount, LedgerMutation mutation) {
        long current = lockBalance(holderId, key);
        long amountRevoked = Math.max(0, Math.min(maxAmount, current));
        long newBalance = current - amountRevoked;

        if (amountRevoked > 0) {
            writeBalance(holderId, key, newBalance, null);
            appendEntry(holderId, key, -amountRevoked, newBalance, TransactionType.REVOKE, mutation);
        }
        return new RevokeResult(newBalance, amountRevoked);
    }

    /**
     * Sets the balance to {@code target} with a single signed adjust entry of
     * {@code target - previous}. A negative previous balance is absorbed in the
     * same entry. When the balance is already at target the entry is written
     * only if the mutation carries an idempotency key, with amount 0.
     *
     * @return the balance before the adjustment
     */
    @Transactional
    public long atomicSet(String holderId, String key, long target, LedgerMutation mutation) {
        long previous = lockBalance(holderId, key);
        long adjustment = target - previous;

        if (adjustment != 0) {
            writeBalance(holderId, key, target, mutation.getCurrency());
            appendEntry(holderId, key, adjustment, target, TransactionType.ADJUST, mutation);
        } else if (mutation.getIdempotencyKey() != null) {
            // zero entry so a redelivered reset still finds its key
            appendEntry(holderId, key, 0, target, TransactionType.ADJUST, mutation);
        }
        return previous;
    }

    private long lockBalance(String holderId, String key) {
        jdbcTemplate.update(
            "INSERT INTO " + tables.balances() + " (holder_id, key, balance, updated_at) " +
            "VALUES (?, ?, 0, NOW()) ON CONFLICT (holder_id, key) DO NOTHING",
            holderId, key
        );

        Long balance = jdbcTemplate.queryForObject(
            "SELECT balance FROM " + tables.balances() + " WHERE holder_id = ? AND key = ? FOR UPDATE",
            Long.class,
            holderId, key
        );
        return balance != null ? balance : 0L;
    }

    private void writeBalance(String holderId, String key, long balance, String currency) {
        jdbcTemplate.update(
            "UPDATE " + tables.balances() +
            " SET balance = ?, currency = COALESCE(CAST(? AS TEXT), currency), updated_at = NOW()" +
            " WHERE holder_id = ? AND key = ?",
            balance, currency, holderId, key
        );
    }

    private void appendEntry(String holderId, String key, long amount, long balanceAfter,
                             TransactionType type, LedgerMutation mutation) {
        try {
            jdbcTemplate.update(
                "INSERT INTO " + tables.ledger() +
                " (holder_id, key, amount, balance_after, transaction_type, source, source_id," +
                " description, metadata, idempotency_key)" +
                " VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?)",
                holderId,
                key,
                amount,
                balanceAfter,
                type.dbValue(),
                mutation.getSource().dbValue(),
                mutation.getSourceId(),
                mutation.getDescription(),
                toJson(mutation.getMetadata()),
                mutation.getIdempotencyKey()
            );
        } catch (DuplicateKeyException e) {
            if (mutation.getIdempotencyKey() == null) {
                throw e;
            }
            log.info("Idempotency key already used: holder={}, key={}, idempotencyKey={}",
                    holderId, key, mutation.getIdempotencyKey());
            throw new CreditException(CreditErrorCode.IDEMPOTENCY_CONFLICT,
                    "Operation already processed",
                    Map.of("idempotencyKey", mutation.getIdempotencyKey()));
        }
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger metadata is not serializable", e);
        }
    }
}
