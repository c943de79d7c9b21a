package com.flagship.credit_ledger.billing;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.wallet.WalletFormatter;
import com.flagship.credit_ledger.wallet.WalletService;
import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.checkout.Session;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a one-off Stripe Checkout session for the failed top-up amount. The
 * session saves the card for off-session use, which in turn clears the block.
 */
@Service
@Slf4j
public class StripeRecoveryCheckout implements RecoveryCheckout {

    private final Optional<StripeClient> stripeClient;
    private final CreditLedgerProperties properties;

    public StripeRecoveryCheckout(Optional<StripeClient> stripeClient, CreditLedgerProperties properties) {
        this.stripeClient = stripeClient;
        this.properties = properties;
    }

    @Override
    public String createRecoveryUrl(String customerId, String key, long amount, long totalCents, String currency) {
        if (!StringUtils.hasText(properties.getSuccessUrl()) || !StringUtils.hasText(properties.getCancelUrl())) {
            throw new CreditException(CreditErrorCode.MISSING_CONFIG,
                    "credits.success-url and credits.cancel-url are required for recovery checkout");
        }
        StripeClient client = stripeClient.orElseThrow(
                () -> new PaymentGatewayException("Stripe is not configured (stripe.api-key)"));

        SessionCreateParams params = SessionCreateParams.builder()
                .setCustomer(customerId)
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .addPaymentMethodType(SessionCreateParams.PaymentMethodType.CARD)
                .setPaymentIntentData(SessionCreateParams.PaymentIntentData.builder()
                        .setSetupFutureUsage(SessionCreateParams.PaymentIntentData.SetupFutureUsage.OFF_SESSION)
                        .build())
                .addLineItem(SessionCreateParams.LineItem.builder()
                        .setQuantity(1L)
                        .setPriceData(SessionCreateParams.LineItem.PriceData.builder()
                                .setCurrency(currency)
                                .setUnitAmount(totalCents)
                                .setProductData(SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                        .setName(productName(key, amount, currency))
                                        .setDescription(WalletService.WALLET_KEY.equals(key) ? "Wallet top-up" : "Credit top-up")
                                        .build())
                                .build())
                        .build())
                .putMetadata("top_up_key", key)
                .putMetadata("top_up_amount", String.valueOf(amount))
                .setSuccessUrl(properties.getSuccessUrl())
                .setCancelUrl(properties.getCancelUrl())
                .build();

        try {
            Session session = client.checkout().sessions().create(params);
            log.info("Created recovery checkout {} for customer {} key {}", session.getId(), customerId, key);
            return session.getUrl();
        } catch (StripeException e) {
            throw new PaymentGatewayException("Failed to create recovery checkout: " + e.getMessage(), e);
        }
    }

    static String productName(String key, long amount, String currency) {
        if (WalletService.WALLET_KEY.equals(key)) {
            return "Add " + WalletFormatter.format(WalletFormatter.centsToMilliCents(amount), currency) + " to wallet";
        }
        return amount + " " + displayName(key);
    }

    /** email_credits -> Email Credits */
    static String displayName(String key) {
        return Arrays.stream(key.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining(" "));
    }
}
