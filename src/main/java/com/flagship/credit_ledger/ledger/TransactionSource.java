package com.flagship.credit_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * What caused a ledger entry.
 */
public enum TransactionSource {
    SUBSCRIPTION,
    RENEWAL,
    CANCELLATION,
    MANUAL,
    USAGE,
    TOPUP,
    AUTO_TOPUP,
    SEAT_GRANT,
    SEAT_REVOKE,
    PLAN_CHANGE;

    /**
     * Sources a subscription is accountable for. Top-ups are deliberately absent.
     */
    public static final Set<TransactionSource> SUBSCRIPTION_LIFECYCLE = EnumSet.of(
            SUBSCRIPTION, RENEWAL, SEAT_GRANT, PLAN_CHANGE, CANCELLATION, SEAT_REVOKE);

    @JsonValue
    public String dbValue() {
        return name().toLowerCase();
    }

    public static TransactionSource fromDbValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
