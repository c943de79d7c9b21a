package com.flagship.credit_ledger.consumer;

import lombok.Value;

import java.time.Instant;

/**
 * Record of a billing event handled by a consumer group.
 */
@Value
public class ProcessedEvent {
    String eventId;
    String eventType;
    String aggregateType;
    String aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        /** Not relevant to this consumer */
        SKIPPED,
        /** Redelivery runs the handler again */
        FAILED
    }

    public static ProcessedEvent success(String eventId, String eventType,
                                         String aggregateType, String aggregateId,
                                         String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(String eventId, String eventType,
                                         String aggregateType, String aggregateId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(String eventId, String eventType,
                                        String aggregateType, String aggregateId,
                                        String consumerGroup, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.FAILED, errorMessage);
    }
}
