package com.flagship.credit_ledger.billing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A succeeded provider payment, as delivered by the webhook adapter.
 */
@Value
@Builder
@Jacksonized
public class PaymentIntentPayload {
    String id;
    String customerId;
    /** Smallest currency unit. */
    long amount;
    String currency;
    @Singular("metadataEntry")
    Map<String, String> metadata;

    public String metadataValue(String name) {
        return metadata == null ? null : metadata.get(name);
    }
}
