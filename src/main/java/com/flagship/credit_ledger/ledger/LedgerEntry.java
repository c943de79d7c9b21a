package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable ledger row.
 *
 * {@code amount} is signed; {@code balanceAfter} is the balance row's value right
 * after this entry was applied, so consecutive entries of one (holder, key) replay
 * to the current balance.
 */
@Value
public class LedgerEntry {
    UUID id;
    String holderId;
    String key;
    long amount;
    long balanceAfter;
    TransactionType transactionType;
    TransactionSource source;
    String sourceId;
    String description;
    Map<String, Object> metadata;
    Instant createdAt;
}
