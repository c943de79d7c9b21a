package com.flagship.credit_ledger.plan;

import lombok.Getter;
import lombok.Setter;

/**
 * Threshold-triggered replenishment for one credit type (or the wallet, in cents).
 */
@Getter
@Setter
public class AutoTopUpSettings {
    private long threshold;
    private long amount;
    private int maxPerMonth = 10;
}
