package com.flagship.credit_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TopUpCompletedEvent implements CreditEvent {
    UUID eventId;
    String holderId;
    String key;
    long creditsAdded;
    long amountCharged;
    String currency;
    long newBalance;
    String sourceId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TopUpCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TopUpCompletedEvent of(String holderId, String key, long creditsAdded, long amountCharged,
                                         String currency, long newBalance, String sourceId) {
        return new TopUpCompletedEvent(UUID.randomUUID(), holderId, key, creditsAdded, amountCharged,
                currency, newBalance, sourceId, Instant.now());
    }
}
