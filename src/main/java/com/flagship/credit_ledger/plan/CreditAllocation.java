package com.flagship.credit_ledger.plan;

import lombok.Getter;
import lombok.Setter;

/**
 * Configuration of one credit type inside a plan.
 */
@Getter
@Setter
public class CreditAllocation {
    private String displayName;
    /** Base allocation for a monthly period, scaled for other intervals. */
    private long allocation;
    private OnRenewal onRenewal = OnRenewal.RESET;
    /** Price of one credit in the smallest currency unit. Top-up is off when null. */
    private Long pricePerCredit;
    private long minPerPurchase = 1;
    private Long maxPerPurchase;
    private AutoTopUpSettings autoTopUp;
}
