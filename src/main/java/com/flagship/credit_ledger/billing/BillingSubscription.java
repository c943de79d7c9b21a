package com.flagship.credit_ledger.billing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * The parts of a provider subscription the ledger cares about.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BillingSubscription {

    public static final String FIRST_SEAT_USER_ID = "first_seat_user_id";
    public static final String PENDING_CREDIT_DOWNGRADE = "pending_credit_downgrade";
    public static final String UPGRADE_FROM_PRICE_AMOUNT = "upgrade_from_price_amount";

    String id;
    String customerId;
    String priceId;
    String currency;
    String status;
    @Builder.Default
    int quantity = 1;
    @Singular("metadataEntry")
    Map<String, String> metadata;
    /**
     * Provider event that delivered this snapshot. Tells apart repeated plan
     * changes between the same two prices; null outside event delivery.
     */
    String eventId;

    public String metadataValue(String name) {
        return metadata == null ? null : metadata.get(name);
    }
}
