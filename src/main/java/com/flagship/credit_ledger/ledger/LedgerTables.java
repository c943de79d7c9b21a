package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Schema-qualified table names for JDBC statements.
 */
@Component
public class LedgerTables {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String schema;

    public LedgerTables(CreditLedgerProperties properties) {
        String configured = properties.getSchema();
        if (configured == null || !IDENTIFIER.matcher(configured).matches()) {
            throw new IllegalArgumentException("Invalid credits.schema: " + configured);
        }
        this.schema = configured;
    }

    public String balances() {
        return schema + ".credit_balances";
    }

    public String ledger() {
        return schema + ".credit_ledger";
    }

    public String topUpFailures() {
        return schema + ".topup_failures";
    }

    public String customers() {
        return schema + ".billing_customers";
    }

    public String subscriptions() {
        return schema + ".billing_subscriptions";
    }
}
