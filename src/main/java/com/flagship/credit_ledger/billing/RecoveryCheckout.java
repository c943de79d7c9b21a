package com.flagship.credit_ledger.billing;

/**
 * Hosted checkout offered when an automatic or on-demand charge cannot go through.
 * Completing it also stores the new card for future off-session charges.
 */
public interface RecoveryCheckout {

    String createRecoveryUrl(String customerId, String key, long amount, long totalCents, String currency);
}
