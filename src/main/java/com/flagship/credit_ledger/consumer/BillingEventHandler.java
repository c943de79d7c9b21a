package com.flagship.credit_ledger.consumer;

import com.flagship.credit_ledger.billing.BillingSubscription;
import com.flagship.credit_ledger.lifecycle.CreditLifecycleService;
import com.flagship.credit_ledger.topup.TopUpService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes normalized billing events into the credit lifecycle and the top-up
 * webhook handlers. Every target is idempotent on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingEventHandler {

    private final CreditLifecycleService lifecycleService;
    private final TopUpService topUpService;

    /**
     * @return false when the event type is not one this service acts on
     */
    public boolean handle(BillingEvent event) {
        switch (event.getType()) {
            case BillingEvent.SUBSCRIPTION_CREATED:
                lifecycleService.onSubscriptionCreated(requireSubscription(event));
                return true;
            case BillingEvent.SUBSCRIPTION_RENEWED:
                lifecycleService.onSubscriptionRenewed(requireSubscription(event),
                        requireField(event, event.getInvoiceId(), "invoiceId"));
                return true;
            case BillingEvent.SUBSCRIPTION_CANCELLED:
                lifecycleService.onSubscriptionCancelled(requireSubscription(event));
                return true;
            case BillingEvent.SUBSCRIPTION_PLAN_CHANGED:
                lifecycleService.onSubscriptionPlanChanged(requireSubscription(event),
                        requireField(event, event.getPreviousPriceId(), "previousPriceId"));
                return true;
            case BillingEvent.SUBSCRIPTION_DOWNGRADE_APPLIED:
                lifecycleService.onDowngradeApplied(requireSubscription(event),
                        requireField(event, event.getNewPriceId(), "newPriceId"));
                return true;
            case BillingEvent.PAYMENT_INTENT_SUCCEEDED:
                topUpService.handlePaymentIntentSucceeded(
                        requireField(event, event.getPaymentIntent(), "paymentIntent"));
                return true;
            case BillingEvent.CHECKOUT_SESSION_COMPLETED:
                topUpService.handleTopUpCheckoutCompleted(
                        requireField(event, event.getCheckoutSession(), "checkoutSession"));
                return true;
            case BillingEvent.CUSTOMER_UPDATED:
                topUpService.handleCustomerUpdated(
                        requireField(event, event.getCustomerId(), "customerId"),
                        event.getDefaultPaymentMethodId(),
                        event.getPreviousDefaultPaymentMethodId());
                return true;
            default:
                log.debug("Ignoring billing event type {}", event.getType());
                return false;
        }
    }

    private static BillingSubscription requireSubscription(BillingEvent event) {
        BillingSubscription subscription = requireField(event, event.getSubscription(), "subscription");
        if (subscription.getEventId() == null && event.getEventId() != null) {
            return subscription.toBuilder().eventId(event.getEventId()).build();
        }
        return subscription;
    }

    private static <T> T requireField(BillingEvent event, T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(
                    "Billing event " + event.getEventId() + " (" + event.getType() + ") has no " + field);
        }
        return value;
    }
}
