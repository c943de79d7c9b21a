package com.flagship.credit_ledger.credit;

public enum CreditErrorCode {
    INVALID_AMOUNT,
    /** Duplicate idempotency key. Callers treat it as "already done". */
    IDEMPOTENCY_CONFLICT,
    CURRENCY_MISMATCH,
    USER_NOT_FOUND,
    NO_SUBSCRIPTION,
    NO_PAYMENT_METHOD,
    PAYMENT_FAILED,
    TOPUP_NOT_CONFIGURED,
    MONTHLY_LIMIT_REACHED,
    MISSING_METADATA,
    MISSING_CONFIG
}
