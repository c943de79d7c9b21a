package com.flagship.credit_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Credit event stored next to the ledger mutation that produced it, waiting
 * for the publisher to hand it to Kafka.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    /** Holder id; doubles as the Kafka record key. */
    String aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
