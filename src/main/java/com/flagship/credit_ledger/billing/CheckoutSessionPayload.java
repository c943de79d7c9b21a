package com.flagship.credit_ledger.billing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A completed hosted checkout, as delivered by the webhook adapter.
 */
@Value
@Builder
@Jacksonized
public class CheckoutSessionPayload {

    public static final String PAID = "paid";

    String id;
    String customerId;
    String paymentIntentId;
    String paymentStatus;
    Long amountTotal;
    String currency;
    @Singular("metadataEntry")
    Map<String, String> metadata;

    public String metadataValue(String name) {
        return metadata == null ? null : metadata.get(name);
    }

    /** The payment intent id when there is one, the session id otherwise. */
    public String chargeId() {
        return paymentIntentId != null ? paymentIntentId : id;
    }
}
