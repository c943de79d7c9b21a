package com.flagship.credit_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Audit attributes attached to a single balance mutation.
 *
 * The idempotency key is never generated here: callers that can be re-invoked
 * derive it from immutable inputs.
 */
@Value
@Builder(toBuilder = true)
public class LedgerMutation {
    TransactionSource source;
    String sourceId;
    String description;
    Map<String, Object> metadata;
    String idempotencyKey;
    /** Only set for the wallet, recorded on the balance row. */
    String currency;

    public static LedgerMutation of(TransactionSource source) {
        return LedgerMutation.builder().source(source).build();
    }
}
