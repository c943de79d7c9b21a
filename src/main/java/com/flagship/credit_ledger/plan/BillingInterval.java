package com.flagship.credit_ledger.plan;

public enum BillingInterval {
    MONTH,
    YEAR,
    WEEK,
    ONE_TIME
}
