package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.billing.BillingAccountDirectory;
import com.flagship.credit_ledger.billing.BillingCustomer;
import com.flagship.credit_ledger.billing.BillingSubscription;
import com.flagship.credit_ledger.billing.ChargeRequest;
import com.flagship.credit_ledger.billing.ChargeResult;
import com.flagship.credit_ledger.billing.CheckoutSessionPayload;
import com.flagship.credit_ledger.billing.PaymentGateway;
import com.flagship.credit_ledger.billing.PaymentIntentPayload;
import com.flagship.credit_ledger.billing.RecoveryCheckout;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.CreditMetrics;
import com.flagship.credit_ledger.plan.CreditAllocation;
import com.flagship.credit_ledger.plan.Plan;
import com.flagship.credit_ledger.plan.PlanResolver;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Paid credit purchases: on-demand top-ups, the webhook confirmations that
 * complete them, and the auto top-up block state.
 *
 * Not transactional: every ledger write runs in its own transaction so an
 * idempotency conflict on one grant never poisons anything else.
 */
@Service
@Slf4j
public class TopUpService {

    /** Providers reject tiny charges; 60 leaves room for currency conversion. */
    public static final long MINIMUM_CHARGE = 60;

    private final BillingAccountDirectory accountDirectory;
    private final PlanResolver planResolver;
    private final PaymentGateway paymentGateway;
    private final RecoveryCheckout recoveryCheckout;
    private final TopUpFulfillment fulfillment;
    private final TopUpFailureRepository failureRepository;
    private final CreditMetrics metrics;

    public TopUpService(BillingAccountDirectory accountDirectory,
                        PlanResolver planResolver,
                        PaymentGateway paymentGateway,
                        RecoveryCheckout recoveryCheckout,
                        TopUpFulfillment fulfillment,
                        TopUpFailureRepository failureRepository,
                        CreditMetrics metrics) {
        this.accountDirectory = accountDirectory;
        this.planResolver = planResolver;
        this.paymentGateway = paymentGateway;
        this.recoveryCheckout = recoveryCheckout;
        this.fulfillment = fulfillment;
        this.failureRepository = failureRepository;
        this.metrics = metrics;
    }

    /**
     * Buys {@code amount} credits of {@code key} with the holder's stored card.
     *
     * @param idempotencyKey forwarded to the provider so a retried request charges once; may be null
     */
    public TopUpResult topUp(String holderId, String key, long amount, String idempotencyKey) {
        MDC.put(CorrelationContext.HOLDER_ID_MDC_KEY, holderId);
        MDC.put(CorrelationContext.CREDIT_KEY_MDC_KEY, key);
        try {
            TopUpResult result = purchase(holderId, key, amount, idempotencyKey);
            metrics.recordTopUpAttempt("on_demand", result.isSuccess()
                    ? result.getOutcome().name().toLowerCase()
                    : result.getErrorCode().name().toLowerCase());
            return result;
        } finally {
            MDC.remove(CorrelationContext.HOLDER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CREDIT_KEY_MDC_KEY);
        }
    }

    private TopUpResult purchase(String holderId, String key, long amount, String idempotencyKey) {
        if (amount <= 0) {
            return TopUpResult.failed(CreditErrorCode.INVALID_AMOUNT, "Amount must be a positive integer");
        }

        Optional<BillingCustomer> customer = accountDirectory.findCustomerByHolder(holderId);
        if (customer.isEmpty()) {
            return TopUpResult.failed(CreditErrorCode.USER_NOT_FOUND, "No billing customer found for holder");
        }
        if (customer.get().isDeleted()) {
            return TopUpResult.failed(CreditErrorCode.USER_NOT_FOUND, "Customer has been deleted");
        }

        Optional<BillingSubscription> subscription = accountDirectory.findActiveSubscription(customer.get().getCustomerId());
        if (subscription.isEmpty()) {
            return TopUpResult.failed(CreditErrorCode.NO_SUBSCRIPTION, "No active subscription found");
        }

        Optional<Plan> plan = planResolver.findPlanByPriceId(subscription.get().getPriceId());
        if (plan.isEmpty()) {
            return TopUpResult.failed(CreditErrorCode.TOPUP_NOT_CONFIGURED, "Could not determine plan from subscription");
        }

        CreditAllocation credit = plan.get().findCredit(key).orElse(null);
        if (credit == null || credit.getPricePerCredit() == null) {
            return TopUpResult.failed(CreditErrorCode.TOPUP_NOT_CONFIGURED, "Top-up not configured for " + key);
        }
        if (amount < credit.getMinPerPurchase()) {
            return TopUpResult.failed(CreditErrorCode.INVALID_AMOUNT,
                    "Minimum purchase is " + credit.getMinPerPurchase() + " credits");
        }
        if (credit.getMaxPerPurchase() != null && amount > credit.getMaxPerPurchase()) {
            return TopUpResult.failed(CreditErrorCode.INVALID_AMOUNT,
                    "Maximum purchase is " + credit.getMaxPerPurchase() + " credits");
        }

        long pricePerCredit = credit.getPricePerCredit();
        long totalCents = Math.multiplyExact(amount, pricePerCredit);
        if (totalCents < MINIMUM_CHARGE) {
            long minimumCredits = (MINIMUM_CHARGE + pricePerCredit - 1) / pricePerCredit;
            return TopUpResult.failed(CreditErrorCode.INVALID_AMOUNT,
                    "Minimum purchase amount is " + MINIMUM_CHARGE + " (" + minimumCredits + " credits at current price)");
        }

        String currency = subscription.get().getCurrency();
        BillingCustomer billingCustomer = customer.get();
        if (!billingCustomer.hasPaymentMethod()) {
            return TopUpResult.failed(CreditErrorCode.NO_PAYMENT_METHOD, "No payment method on file",
                    tryCreateRecoveryUrl(billingCustomer.getCustomerId(), key, amount, totalCents, currency));
        }

        ChargeRequest request = ChargeRequest.builder()
                .amount(totalCents)
                .currency(currency)
                .customerId(billingCustomer.getCustomerId())
                .paymentMethodId(billingCustomer.getDefaultPaymentMethodId())
                .idempotencyKey(idempotencyKey)
                .description(amount + " " + (credit.getDisplayName() != null ? credit.getDisplayName() : key) + " (credit top-up)")
                .metadataEntry(TopUpMetadata.KEY, key)
                .metadataEntry(TopUpMetadata.AMOUNT, String.valueOf(amount))
                .metadataEntry(TopUpMetadata.HOLDER_ID, holderId)
                .build();

        ChargeResult charge;
        try {
            charge = metrics.timeCharge(() -> paymentGateway.createCharge(request));
        } catch (RuntimeException e) {
            log.error("Top-up charge errored for holder {}", holderId, e);
            return TopUpResult.failed(CreditErrorCode.PAYMENT_FAILED, e.getMessage(),
                    tryCreateRecoveryUrl(billingCustomer.getCustomerId(), key, amount, totalCents, currency));
        }

        switch (charge.getStatus()) {
            case SUCCEEDED:
                long balance = fulfillment.fulfill(holderId, key, amount, charge.getChargeId(), false,
                        totalCents, currency);
                failureRepository.delete(holderId, key);
                return TopUpResult.succeeded(balance, totalCents, currency, charge.getChargeId());
            case PROCESSING:
                log.info("Top-up payment {} is processing; credits follow with the webhook", charge.getChargeId());
                return TopUpResult.pending(charge.getChargeId());
            default:
                log.warn("Top-up charge failed: declineCode={}, message={}", charge.getDeclineCode(), charge.getMessage());
                return TopUpResult.failed(CreditErrorCode.PAYMENT_FAILED,
                        charge.getMessage() != null ? charge.getMessage() : "Payment failed",
                        tryCreateRecoveryUrl(billingCustomer.getCustomerId(), key, amount, totalCents, currency));
        }
    }

    public boolean hasPaymentMethod(String holderId) {
        return accountDirectory.findCustomerByHolder(holderId)
                .filter(customer -> !customer.isDeleted())
                .map(BillingCustomer::hasPaymentMethod)
                .orElse(false);
    }

    /**
     * Grants a top-up confirmed by the provider. Payments without top-up metadata
     * are not ours and are ignored.
     */
    public void handlePaymentIntentSucceeded(PaymentIntentPayload paymentIntent) {
        String key = paymentIntent.metadataValue(TopUpMetadata.KEY);
        if (key == null) {
            return;
        }
        long amount = parseAmount(paymentIntent.metadataValue(TopUpMetadata.AMOUNT), paymentIntent.getId());
        String holderId = paymentIntent.metadataValue(TopUpMetadata.HOLDER_ID);
        if (holderId == null && paymentIntent.getCustomerId() != null) {
            holderId = accountDirectory.findHolderByCustomer(paymentIntent.getCustomerId()).orElse(null);
        }
        if (holderId == null) {
            throw new CreditException(CreditErrorCode.MISSING_METADATA,
                    "Missing top-up holder on payment " + paymentIntent.getId());
        }

        boolean automatic = "true".equals(paymentIntent.metadataValue(TopUpMetadata.AUTO));
        fulfillment.fulfill(holderId, key, amount, paymentIntent.getId(), automatic,
                paymentIntent.getAmount(), paymentIntent.getCurrency());
        failureRepository.delete(holderId, key);
    }

    /**
     * Grants a recovery checkout once it is paid. Uses the same grant key as the
     * payment webhook, so receiving both grants once.
     */
    public void handleTopUpCheckoutCompleted(CheckoutSessionPayload session) {
        String key = session.metadataValue(TopUpMetadata.KEY);
        String amountValue = session.metadataValue(TopUpMetadata.AMOUNT);
        if (key == null || amountValue == null) {
            return;
        }
        if (!CheckoutSessionPayload.PAID.equals(session.getPaymentStatus())) {
            log.warn("Top-up checkout {} has payment_status '{}', skipping", session.getId(), session.getPaymentStatus());
            return;
        }
        long amount = parseAmount(amountValue, session.getId());
        if (session.getCustomerId() == null) {
            throw new CreditException(CreditErrorCode.MISSING_METADATA, "No customer on checkout session " + session.getId());
        }
        String holderId = accountDirectory.findHolderByCustomer(session.getCustomerId())
                .orElseThrow(() -> new CreditException(CreditErrorCode.USER_NOT_FOUND,
                        "No holder mapped to customer " + session.getCustomerId()));

        fulfillment.fulfill(holderId, key, amount, session.chargeId(), false,
                session.getAmountTotal() != null ? session.getAmountTotal() : 0,
                session.getCurrency() != null ? session.getCurrency() : "usd");
        failureRepository.delete(holderId, key);
    }

    /**
     * A new default card unblocks every key of the holder. Records left by a card
     * other than the current default are dropped even when no change is reported.
     */
    public void handleCustomerUpdated(String customerId, String newDefaultPaymentMethodId,
                                      String previousDefaultPaymentMethodId) {
        Optional<String> holderId = accountDirectory.findHolderByCustomer(customerId);
        if (holderId.isEmpty()) {
            log.debug("customer.updated for unmapped customer {}", customerId);
            return;
        }
        if (!Objects.equals(newDefaultPaymentMethodId, previousDefaultPaymentMethodId)) {
            int cleared = unblockAllAutoTopUps(holderId.get());
            log.info("Default payment method changed for holder {}, cleared {} auto top-up blocks",
                    holderId.get(), cleared);
            return;
        }
        if (newDefaultPaymentMethodId != null) {
            failureRepository.deleteWherePaymentMethodDiffers(holderId.get(), newDefaultPaymentMethodId);
        }
    }

    public Optional<TopUpFailure> getAutoTopUpStatus(String holderId, String key) {
        return failureRepository.find(holderId, key);
    }

    public boolean unblockAutoTopUp(String holderId, String key) {
        boolean cleared = failureRepository.delete(holderId, key);
        if (cleared) {
            log.info("Auto top-up unblocked: holderId={}, key={}", holderId, key);
        }
        return cleared;
    }

    public int unblockAllAutoTopUps(String holderId) {
        return failureRepository.deleteAll(holderId);
    }

    private String tryCreateRecoveryUrl(String customerId, String key, long amount, long totalCents, String currency) {
        try {
            return recoveryCheckout.createRecoveryUrl(customerId, key, amount, totalCents, currency);
        } catch (RuntimeException e) {
            log.error("Failed to create recovery checkout for customer {}", customerId, e);
            return null;
        }
    }

    private static long parseAmount(String value, String reference) {
        if (value == null || !value.matches("\\d{1,18}") || Long.parseLong(value) <= 0) {
            throw new CreditException(CreditErrorCode.MISSING_METADATA, "Invalid top_up_amount on " + reference);
        }
        return Long.parseLong(value);
    }
}
