package com.flagship.credit_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CreditsLowEvent implements CreditEvent {
    UUID eventId;
    String holderId;
    String key;
    long balance;
    long threshold;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditsLow";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CreditsLowEvent of(String holderId, String key, long balance, long threshold) {
        return new CreditsLowEvent(UUID.randomUUID(), holderId, key, balance, threshold, Instant.now());
    }
}
