package com.flagship.credit_ledger.billing;

public enum ChargeStatus {
    SUCCEEDED,
    /** Asynchronous methods only; the grant arrives later through the payment webhook. */
    PROCESSING,
    FAILED
}
