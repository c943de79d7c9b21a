package com.flagship.credit_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of ledger entry. Stored lower-case.
 */
public enum TransactionType {
    GRANT,
    CONSUME,
    REVOKE,
    ADJUST;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase();
    }

    public static TransactionType fromDbValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
