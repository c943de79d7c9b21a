package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.billing.BillingAccountDirectory;
import com.flagship.credit_ledger.billing.BillingCustomer;
import com.flagship.credit_ledger.billing.BillingSubscription;
import com.flagship.credit_ledger.billing.ChargeRequest;
import com.flagship.credit_ledger.billing.ChargeResult;
import com.flagship.credit_ledger.billing.PaymentGateway;
import com.flagship.credit_ledger.billing.RecoveryCheckout;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.observability.CreditMetrics;
import com.flagship.credit_ledger.plan.AutoTopUpSettings;
import com.flagship.credit_ledger.plan.PlanResolver;
import com.flagship.credit_ledger.plan.WalletAllocation;
import com.flagship.credit_ledger.topup.AutoTopUpAttempt;
import com.flagship.credit_ledger.topup.AutoTopUpEngine;
import com.flagship.credit_ledger.topup.AutoTopUpResult;
import com.flagship.credit_ledger.topup.TopUpFailureRepository;
import com.flagship.credit_ledger.topup.TopUpFulfillment;
import com.flagship.credit_ledger.topup.TopUpMetadata;
import com.flagship.credit_ledger.topup.TopUpResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Funds the wallet with the holder's stored card, on demand or when it runs low.
 * Amounts are cents; the plan's wallet section sets the limits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletTopUpService {

    private final BillingAccountDirectory accountDirectory;
    private final PlanResolver planResolver;
    private final PaymentGateway paymentGateway;
    private final RecoveryCheckout recoveryCheckout;
    private final TopUpFulfillment fulfillment;
    private final TopUpFailureRepository failureRepository;
    private final AutoTopUpEngine engine;
    private final WalletService walletService;
    private final CreditMetrics metrics;

    public TopUpResult topUp(String holderId, long cents, String idempotencyKey) {
        if (cents <= 0) {
            return TopUpResult.failed(CreditErrorCode.INVALID_AMOUNT, "Amount must be a positive integer");
        }
        Optional<BillingCustomer> customer = accountDirectory.findCustomerByHolder(holderId)
                .filter(found -> !found.isDeleted());
        if (customer.isEmpty()) {
            return TopUpResult.failed(CreditErrorCode.USER_NOT_FOUND, "No billing customer found for holder");
        }
        Optional<BillingSubscription> subscription = accountDirectory.findActiveSubscription(customer.get().getCustomerId());
        if (subscription.isEmpty()) {
            return TopUpResult.failed(CreditErrorCode.NO_SUBSCRIPTION, "No active subscription found");
        }
        WalletAllocation wallet = planResolver.findPlanByPriceId(subscription.get().getPriceId())
                .map(plan -> plan.getWallet())
                .orElse(null);
        if (wallet == null) {
            return TopUpResult.failed(CreditErrorCode.TOPUP_NOT_CONFIGURED, "Wallet not configured for this plan");
        }

        String currency = subscription.get().getCurrency();
        if (cents < wallet.getMinPerPurchase()) {
            return TopUpResult.failed(CreditErrorCode.INVALID_AMOUNT, "Minimum top-up is "
                    + WalletFormatter.format(WalletFormatter.centsToMilliCents(wallet.getMinPerPurchase()), currency));
        }
        if (wallet.getMaxPerPurchase() != null && cents > wallet.getMaxPerPurchase()) {
            return TopUpResult.failed(CreditErrorCode.INVALID_AMOUNT, "Maximum top-up is "
                    + WalletFormatter.format(WalletFormatter.centsToMilliCents(wallet.getMaxPerPurchase()), currency));
        }

        if (!walletService.acceptsCurrency(holderId, currency)) {
            return TopUpResult.failed(CreditErrorCode.CURRENCY_MISMATCH, "Wallet currency is "
                    + walletService.currencyOf(holderId) + ", subscription bills in " + currency);
        }

        BillingCustomer billingCustomer = customer.get();
        if (!billingCustomer.hasPaymentMethod()) {
            metrics.recordTopUpAttempt("wallet", "no_payment_method");
            return TopUpResult.failed(CreditErrorCode.NO_PAYMENT_METHOD, "No payment method on file",
                    tryCreateRecoveryUrl(billingCustomer.getCustomerId(), cents, currency));
        }

        ChargeRequest request = ChargeRequest.builder()
                .amount(cents)
                .currency(currency)
                .customerId(billingCustomer.getCustomerId())
                .paymentMethodId(billingCustomer.getDefaultPaymentMethodId())
                .idempotencyKey(idempotencyKey)
                .description("Wallet top-up")
                .metadataEntry(TopUpMetadata.KEY, WalletService.WALLET_KEY)
                .metadataEntry(TopUpMetadata.AMOUNT, String.valueOf(cents))
                .metadataEntry(TopUpMetadata.HOLDER_ID, holderId)
                .build();

        ChargeResult charge;
        try {
            charge = metrics.timeCharge(() -> paymentGateway.createCharge(request));
        } catch (RuntimeException e) {
            log.error("Wallet top-up charge errored for holder {}", holderId, e);
            metrics.recordTopUpAttempt("wallet", "error");
            return TopUpResult.failed(CreditErrorCode.PAYMENT_FAILED, e.getMessage(),
                    tryCreateRecoveryUrl(billingCustomer.getCustomerId(), cents, currency));
        }
        metrics.recordTopUpAttempt("wallet", charge.getStatus().name().toLowerCase());

        switch (charge.getStatus()) {
            case SUCCEEDED:
                long milliCents = fulfillment.fulfill(holderId, WalletService.WALLET_KEY, cents,
                        charge.getChargeId(), false, cents, currency);
                failureRepository.delete(holderId, WalletService.WALLET_KEY);
                return TopUpResult.succeeded(milliCents / WalletFormatter.MILLI_CENTS_PER_CENT, cents, currency,
                        charge.getChargeId());
            case PROCESSING:
                return TopUpResult.pending(charge.getChargeId());
            default:
                return TopUpResult.failed(CreditErrorCode.PAYMENT_FAILED,
                        charge.getMessage() != null ? charge.getMessage() : "Payment failed",
                        tryCreateRecoveryUrl(billingCustomer.getCustomerId(), cents, currency));
        }
    }

    /**
     * Wallet counterpart of the credit auto top-up; threshold and amount are cents.
     */
    public AutoTopUpResult triggerAutoTopUpIfNeeded(String holderId) {
        Optional<BillingCustomer> customer = accountDirectory.findCustomerByHolder(holderId)
                .filter(found -> !found.isDeleted());
        if (customer.isEmpty()) {
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.USER_NOT_FOUND);
        }
        Optional<BillingSubscription> subscription = accountDirectory.findActiveSubscription(customer.get().getCustomerId());
        if (subscription.isEmpty()) {
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.NO_SUBSCRIPTION);
        }
        AutoTopUpSettings settings = planResolver.findPlanByPriceId(subscription.get().getPriceId())
                .map(plan -> plan.getWallet())
                .map(WalletAllocation::getAutoTopUp)
                .orElse(null);
        if (settings == null || settings.getAmount() <= 0 || settings.getThreshold() <= 0) {
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.NOT_CONFIGURED);
        }
        if (!walletService.acceptsCurrency(holderId, subscription.get().getCurrency())) {
            log.warn("Wallet auto top-up skipped: holderId={}, walletCurrency={}, subscriptionCurrency={}",
                    holderId, walletService.currencyOf(holderId), subscription.get().getCurrency());
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.CURRENCY_MISMATCH);
        }

        long balanceCents = Math.floorDiv(walletService.getBalanceMilliCents(holderId), WalletFormatter.MILLI_CENTS_PER_CENT);
        return engine.run(AutoTopUpAttempt.builder()
                .holderId(holderId)
                .key(WalletService.WALLET_KEY)
                .customer(customer.get())
                .currentBalance(balanceCents)
                .threshold(settings.getThreshold())
                .purchaseAmount(settings.getAmount())
                .totalCents(settings.getAmount())
                .currency(subscription.get().getCurrency())
                .maxPerMonth(settings.getMaxPerMonth())
                .chargeKeyStem("wallet_auto_topup_" + holderId)
                .description("Wallet auto top-up")
                .build());
    }

    private String tryCreateRecoveryUrl(String customerId, long cents, String currency) {
        try {
            return recoveryCheckout.createRecoveryUrl(customerId, WalletService.WALLET_KEY, cents, cents, currency);
        } catch (RuntimeException e) {
            log.error("Failed to create wallet recovery checkout for customer {}", customerId, e);
            return null;
        }
    }
}
