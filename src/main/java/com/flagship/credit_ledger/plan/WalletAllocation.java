package com.flagship.credit_ledger.plan;

import lombok.Getter;
import lombok.Setter;

/**
 * Wallet settings of a plan. All amounts are in cents.
 */
@Getter
@Setter
public class WalletAllocation {
    private Long allocation;
    private OnRenewal onRenewal = OnRenewal.RESET;
    private long minPerPurchase = 50;
    private Long maxPerPurchase;
    private AutoTopUpSettings autoTopUp;
}
