package com.flagship.credit_ledger.billing;

/**
 * Outbound calls to the payment provider.
 */
public interface PaymentGateway {

    /**
     * Charges a stored payment method off-session. Card declines come back as
     * {@link ChargeStatus#FAILED}; only infrastructure problems throw.
     */
    ChargeResult createCharge(ChargeRequest request);

    void updateSubscriptionQuantity(String subscriptionId, int quantity, String idempotencyKey);
}
