package com.flagship.credit_ledger.plan;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PlanPrice {
    private String id;
    /** Smallest currency unit. */
    private long amount;
    private String currency = "usd";
    private BillingInterval interval = BillingInterval.MONTH;
}
