package com.flagship.credit_ledger.event;

import com.flagship.credit_ledger.ledger.TransactionSource;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CreditsGrantedEvent implements CreditEvent {
    UUID eventId;
    String holderId;
    String key;
    long amount;
    long newBalance;
    TransactionSource source;
    String sourceId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditsGranted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CreditsGrantedEvent of(String holderId, String key, long amount, long newBalance,
                                         TransactionSource source, String sourceId) {
        return new CreditsGrantedEvent(UUID.randomUUID(), holderId, key, amount, newBalance,
                source, sourceId, Instant.now());
    }
}
