package com.flagship.credit_ledger.billing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.ledger.LedgerTables;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the billing_customers / billing_subscriptions mirror kept up to date by
 * the provider sync engine.
 */
@Repository
public class JdbcBillingAccountDirectory implements BillingAccountDirectory {

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTables tables;
    private final ObjectMapper objectMapper;

    public JdbcBillingAccountDirectory(JdbcTemplate jdbcTemplate, LedgerTables tables, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.tables = tables;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<BillingCustomer> findCustomerByHolder(String holderId) {
        List<BillingCustomer> rows = jdbcTemplate.query(
            "SELECT holder_id, customer_id, default_payment_method_id, deleted FROM " + tables.customers() +
            " WHERE holder_id = ?",
            (rs, rowNum) -> new BillingCustomer(
                rs.getString("holder_id"),
                rs.getString("customer_id"),
                rs.getString("default_payment_method_id"),
                rs.getBoolean("deleted")
            ),
            holderId
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<String> findHolderByCustomer(String customerId) {
        return jdbcTemplate.queryForList(
            "SELECT holder_id FROM " + tables.customers() + " WHERE customer_id = ?",
            String.class,
            customerId
        ).stream().findFirst();
    }

    @Override
    public Optional<BillingSubscription> findActiveSubscription(String customerId) {
        List<BillingSubscription> rows = jdbcTemplate.query(
            "SELECT id, customer_id, price_id, currency, status, quantity, metadata FROM " + tables.subscriptions() +
            " WHERE customer_id = ? AND status IN ('active', 'trialing', 'past_due')" +
            " ORDER BY created_at DESC LIMIT 1",
            (rs, rowNum) -> BillingSubscription.builder()
                .id(rs.getString("id"))
                .customerId(rs.getString("customer_id"))
                .priceId(rs.getString("price_id"))
                .currency(rs.getString("currency"))
                .status(rs.getString("status"))
                .quantity(rs.getInt("quantity"))
                .metadata(readMetadata(rs.getString("metadata")))
                .build(),
            customerId
        );
        return rows.stream().findFirst();
    }

    private Map<String, String> readMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt subscription metadata: " + json, e);
        }
    }
}
