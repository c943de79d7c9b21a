package com.flagship.credit_ledger.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only projections over the balance and ledger tables.
 *
 * Seat membership and "net credits granted by a subscription" are not stored
 * anywhere; they are computed from the ledger on every call.
 */
@Repository
public class CreditLedgerQueries {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTables tables;
    private final ObjectMapper objectMapper;

    public CreditLedgerQueries(JdbcTemplate jdbcTemplate, LedgerTables tables, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.tables = tables;
        this.objectMapper = objectMapper;
    }

    public long getBalance(String holderId, String key) {
        return findBalance(holderId, key).map(BalanceSnapshot::getBalance).orElse(0L);
    }

    public Optional<BalanceSnapshot> findBalance(String holderId, String key) {
        List<BalanceSnapshot> rows = jdbcTemplate.query(
            "SELECT balance, currency FROM " + tables.balances() + " WHERE holder_id = ? AND key = ?",
            (rs, rowNum) -> new BalanceSnapshot(rs.getLong("balance"), rs.getString("currency")),
            holderId, key
        );
        return rows.stream().findFirst();
    }

    /**
     * All balance rows of a holder, ordered by key.
     */
    public Map<String, Long> getAllBalances(String holderId) {
        Map<String, Long> balances = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT key, balance FROM " + tables.balances() + " WHERE holder_id = ? ORDER BY key",
            rs -> {
                balances.put(rs.getString("key"), rs.getLong("balance"));
            },
            holderId
        );
        return balances;
    }

    public boolean idempotencyKeyExists(String idempotencyKey) {
        List<Integer> rows = jdbcTemplate.queryForList(
            "SELECT 1 FROM " + tables.ledger() + " WHERE idempotency_key = ?",
            Integer.class,
            idempotencyKey
        );
        return !rows.isEmpty();
    }

    /**
     * Newest first. {@code key} may be null to include every credit type.
     */
    public List<LedgerEntry> getHistory(String holderId, String key, int limit, int offset) {
        String select = "SELECT id, holder_id, key, amount, balance_after, transaction_type, source," +
                " source_id, description, metadata, created_at FROM " + tables.ledger() +
                " WHERE holder_id = ?";
        if (key == null) {
            return jdbcTemplate.query(
                select + " ORDER BY created_at DESC LIMIT ? OFFSET ?",
                ledgerEntryRowMapper(),
                holderId, limit, offset
            );
        }
        return jdbcTemplate.query(
            select + " AND key = ? ORDER BY created_at DESC LIMIT ? OFFSET ?",
            ledgerEntryRowMapper(),
            holderId, key, limit, offset
        );
    }

    /**
     * Holders whose latest seat entry for this subscription is a seat grant.
     */
    public List<String> getActiveSeatUsers(String subscriptionId) {
        return jdbcTemplate.queryForList(
            "SELECT holder_id FROM (" +
            "  SELECT DISTINCT ON (holder_id) holder_id, source" +
            "  FROM " + tables.ledger() +
            "  WHERE source_id = ? AND source IN ('seat_grant', 'seat_revoke')" +
            "  ORDER BY holder_id, created_at DESC" +
            ") latest WHERE source = 'seat_grant' ORDER BY holder_id",
            String.class,
            subscriptionId
        );
    }

    /**
     * The subscription currently claiming this holder as a seat, if any.
     */
    public Optional<String> getUserSeatSubscription(String holderId) {
        List<String> rows = jdbcTemplate.queryForList(
            "SELECT source_id FROM (" +
            "  SELECT DISTINCT ON (holder_id) holder_id, source, source_id" +
            "  FROM " + tables.ledger() +
            "  WHERE holder_id = ? AND source IN ('seat_grant', 'seat_revoke')" +
            "  ORDER BY holder_id, created_at DESC" +
            ") latest WHERE source = 'seat_grant'",
            String.class,
            holderId
        );
        return rows.stream().findFirst();
    }

    /**
     * Net amount per credit key that subscription-lifecycle entries with this
     * source id left on the holder. Keys netting to zero or less are omitted.
     */
    public Map<String, Long> getCreditsGrantedBySource(String holderId, String sourceId) {
        String sources = TransactionSource.SUBSCRIPTION_LIFECYCLE.stream()
                .map(source -> "'" + source.dbValue() + "'")
                .sorted()
                .collect(Collectors.joining(", "));

        Map<String, Long> net = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT key, SUM(amount) AS net_amount FROM " + tables.ledger() +
            " WHERE holder_id = ? AND source_id = ? AND source IN (" + sources + ")" +
            " GROUP BY key HAVING SUM(amount) > 0 ORDER BY key",
            rs -> {
                net.put(rs.getString("key"), rs.getLong("net_amount"));
            },
            holderId, sourceId
        );
        return net;
    }

    /**
     * Successful automatic top-ups recorded since {@code since}.
     */
    public int countAutoTopUpsSince(String holderId, String key, Instant since) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + tables.ledger() +
            " WHERE holder_id = ? AND key = ? AND source = 'auto_topup' AND created_at >= ?",
            Integer.class,
            holderId, key, Timestamp.from(since)
        );
        return count != null ? count : 0;
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            rs.getString("holder_id"),
            rs.getString("key"),
            rs.getLong("amount"),
            rs.getLong("balance_after"),
            TransactionType.fromDbValue(rs.getString("transaction_type")),
            TransactionSource.fromDbValue(rs.getString("source")),
            rs.getString("source_id"),
            rs.getString("description"),
            readMetadata(rs.getString("metadata")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt ledger metadata: " + json, e);
        }
    }
}
