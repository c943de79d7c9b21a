package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.billing.BillingCustomer;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the engine needs for one automatic top-up, resolved by the caller.
 */
@Value
@Builder
public class AutoTopUpAttempt {
    String holderId;
    /** Credit key, or the wallet key. */
    String key;
    BillingCustomer customer;
    /** In the unit the threshold is configured in: credits, or cents for the wallet. */
    long currentBalance;
    long threshold;
    /** Credits, or cents for the wallet. */
    long purchaseAmount;
    long totalCents;
    String currency;
    int maxPerMonth;
    /** Charge idempotency key before the month, count and card suffix, e.g. auto_topup_u1_api_calls. */
    String chargeKeyStem;
    String description;
}
