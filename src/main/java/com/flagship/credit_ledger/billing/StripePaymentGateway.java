package com.flagship.credit_ledger.billing;

import com.stripe.StripeClient;
import com.stripe.exception.CardException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.SubscriptionItemUpdateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Stripe implementation of {@link PaymentGateway} using off-session PaymentIntents.
 */
@Service
@Slf4j
public class StripePaymentGateway implements PaymentGateway {

    private final Optional<StripeClient> stripeClient;

    public StripePaymentGateway(Optional<StripeClient> stripeClient) {
        this.stripeClient = stripeClient;
    }

    @Override
    public ChargeResult createCharge(ChargeRequest request) {
        StripeClient client = requireClient();

        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
                .setAmount(request.getAmount())
                .setCurrency(request.getCurrency())
                .setCustomer(request.getCustomerId())
                .setPaymentMethod(request.getPaymentMethodId())
                .setConfirm(true)
                .setOffSession(true)
                .setDescription(request.getDescription())
                .putAllMetadata(request.getMetadata())
                .build();

        try {
            PaymentIntent intent = client.paymentIntents().create(params, requestOptions(request.getIdempotencyKey()));
            log.info("PaymentIntent {} created: status={}, amount={} {}",
                    intent.getId(), intent.getStatus(), request.getAmount(), request.getCurrency());

            return switch (intent.getStatus()) {
                case "succeeded" -> ChargeResult.succeeded(intent.getId());
                case "processing" -> ChargeResult.processing(intent.getId());
                default -> ChargeResult.failed(intent.getId(), null, "Payment status: " + intent.getStatus());
            };
        } catch (CardException e) {
            String declineCode = e.getDeclineCode() != null ? e.getDeclineCode() : e.getCode();
            log.warn("Card declined for customer {}: declineCode={}, message={}",
                    request.getCustomerId(), declineCode, e.getMessage());
            return ChargeResult.failed(null, declineCode, e.getMessage());
        } catch (StripeException e) {
            log.error("Stripe charge failed for customer {}: {}", request.getCustomerId(), e.getMessage());
            throw new PaymentGatewayException("Stripe charge failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void updateSubscriptionQuantity(String subscriptionId, int quantity, String idempotencyKey) {
        StripeClient client = requireClient();
        try {
            Subscription subscription = client.subscriptions().retrieve(subscriptionId);
            SubscriptionItem item = subscription.getItems().getData().get(0);
            client.subscriptionItems().update(
                    item.getId(),
                    SubscriptionItemUpdateParams.builder().setQuantity((long) quantity).build(),
                    requestOptions(idempotencyKey));
            log.info("Subscription {} quantity set to {}", subscriptionId, quantity);
        } catch (StripeException e) {
            throw new PaymentGatewayException("Failed to update quantity of " + subscriptionId, e);
        }
    }

    private StripeClient requireClient() {
        return stripeClient.orElseThrow(() -> new PaymentGatewayException("Stripe is not configured (stripe.api-key)"));
    }

    private RequestOptions requestOptions(String idempotencyKey) {
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder();
        if (idempotencyKey != null) {
            builder.setIdempotencyKey(idempotencyKey);
        }
        return builder.build();
    }
}
