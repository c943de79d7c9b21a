package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.ledger.LedgerTables;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Upsert-style storage of {@link TopUpFailure} rows.
 */
@Repository
public class TopUpFailureRepository {

    private static final String COLUMNS =
            "holder_id, key, payment_method_id, decline_type, decline_code, failure_count, last_failure_at, disabled";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTables tables;
    private final Clock clock;

    public TopUpFailureRepository(JdbcTemplate jdbcTemplate, LedgerTables tables, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.tables = tables;
        this.clock = clock;
    }

    public Optional<TopUpFailure> find(String holderId, String key) {
        List<TopUpFailure> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM " + tables.topUpFailures() + " WHERE holder_id = ? AND key = ?",
            failureRowMapper(),
            holderId, key
        );
        return rows.stream().findFirst();
    }

    /**
     * Creates the record or bumps {@code failure_count} atomically, so two
     * concurrent failures both count.
     */
    public TopUpFailure recordFailure(String holderId, String key, String paymentMethodId,
                                      DeclineType declineType, String declineCode) {
        Instant now = clock.instant();
        return jdbcTemplate.queryForObject(
            "INSERT INTO " + tables.topUpFailures() + " AS f (" + COLUMNS + ")" +
            " VALUES (?, ?, ?, ?, ?, 1, ?, TRUE)" +
            " ON CONFLICT (holder_id, key) DO UPDATE SET" +
            "   payment_method_id = EXCLUDED.payment_method_id," +
            "   decline_type = EXCLUDED.decline_type," +
            "   decline_code = EXCLUDED.decline_code," +
            "   failure_count = f.failure_count + 1," +
            "   last_failure_at = EXCLUDED.last_failure_at," +
            "   disabled = TRUE" +
            " RETURNING " + COLUMNS,
            failureRowMapper(),
            holderId, key, paymentMethodId, declineType.dbValue(), declineCode, Timestamp.from(now)
        );
    }

    /**
     * @return whether a record existed
     */
    public boolean delete(String holderId, String key) {
        return jdbcTemplate.update(
            "DELETE FROM " + tables.topUpFailures() + " WHERE holder_id = ? AND key = ?",
            holderId, key
        ) > 0;
    }

    /**
     * @return number of records removed
     */
    public int deleteAll(String holderId) {
        return jdbcTemplate.update(
            "DELETE FROM " + tables.topUpFailures() + " WHERE holder_id = ?",
            holderId
        );
    }

    /**
     * Drops records that were caused by a payment method other than {@code paymentMethodId}.
     */
    public int deleteWherePaymentMethodDiffers(String holderId, String paymentMethodId) {
        return jdbcTemplate.update(
            "DELETE FROM " + tables.topUpFailures() +
            " WHERE holder_id = ? AND payment_method_id IS DISTINCT FROM ?",
            holderId, paymentMethodId
        );
    }

    private RowMapper<TopUpFailure> failureRowMapper() {
        return (rs, rowNum) -> new TopUpFailure(
            rs.getString("holder_id"),
            rs.getString("key"),
            rs.getString("payment_method_id"),
            DeclineType.fromDbValue(rs.getString("decline_type")),
            rs.getString("decline_code"),
            rs.getInt("failure_count"),
            rs.getTimestamp("last_failure_at").toInstant(),
            rs.getBoolean("disabled")
        );
    }
}
