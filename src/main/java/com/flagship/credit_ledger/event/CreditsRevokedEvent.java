package com.flagship.credit_ledger.event;

import com.flagship.credit_ledger.ledger.TransactionSource;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CreditsRevokedEvent implements CreditEvent {
    UUID eventId;
    String holderId;
    String key;
    long amount;
    long previousBalance;
    long newBalance;
    TransactionSource source;
    String sourceId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditsRevoked";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CreditsRevokedEvent of(String holderId, String key, long amount, long previousBalance,
                                         long newBalance, TransactionSource source, String sourceId) {
        return new CreditsRevokedEvent(UUID.randomUUID(), holderId, key, amount, previousBalance,
                newBalance, source, sourceId, Instant.now());
    }
}
