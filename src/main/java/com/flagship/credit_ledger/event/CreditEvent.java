package com.flagship.credit_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact about a holder's credits, published through the outbox.
 * The engine never notifies holders itself; downstream consumers do.
 */
public interface CreditEvent {

    UUID getEventId();

    /** Kafka key, keeps one holder's events ordered. */
    String getHolderId();

    Instant getOccurredAt();

    String getEventType();
}
