package com.flagship.credit_ledger.billing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ChargeRequest {
    /** Smallest currency unit. */
    long amount;
    String currency;
    String customerId;
    String paymentMethodId;
    String idempotencyKey;
    String description;
    @Singular("metadataEntry")
    Map<String, String> metadata;
}
