package com.flagship.credit_ledger.consumer;

import com.flagship.credit_ledger.billing.BillingSubscription;
import com.flagship.credit_ledger.billing.CheckoutSessionPayload;
import com.flagship.credit_ledger.billing.PaymentIntentPayload;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A provider event as normalized by the webhook adapter. Only the fields of the
 * given type are set.
 */
@Value
@Builder
@Jacksonized
public class BillingEvent {

    public static final String SUBSCRIPTION_CREATED = "subscription.created";
    public static final String SUBSCRIPTION_RENEWED = "subscription.renewed";
    public static final String SUBSCRIPTION_CANCELLED = "subscription.cancelled";
    public static final String SUBSCRIPTION_PLAN_CHANGED = "subscription.plan_changed";
    public static final String SUBSCRIPTION_DOWNGRADE_APPLIED = "subscription.downgrade_applied";
    public static final String PAYMENT_INTENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";
    public static final String CUSTOMER_UPDATED = "customer.updated";

    String eventId;
    String type;

    BillingSubscription subscription;
    /** subscription.renewed */
    String invoiceId;
    /** subscription.plan_changed */
    String previousPriceId;
    /** subscription.downgrade_applied */
    String newPriceId;

    PaymentIntentPayload paymentIntent;
    CheckoutSessionPayload checkoutSession;

    /** customer.updated */
    String customerId;
    String defaultPaymentMethodId;
    String previousDefaultPaymentMethodId;

    /**
     * Id of the provider object the event is about, for the processed-event record.
     */
    public String aggregateId() {
        if (subscription != null) {
            return subscription.getId();
        }
        if (paymentIntent != null) {
            return paymentIntent.getId();
        }
        if (checkoutSession != null) {
            return checkoutSession.getId();
        }
        return customerId != null ? customerId : "unknown";
    }

    public String aggregateType() {
        if (subscription != null) {
            return "Subscription";
        }
        if (paymentIntent != null) {
            return "PaymentIntent";
        }
        if (checkoutSession != null) {
            return "CheckoutSession";
        }
        return "Customer";
    }
}
