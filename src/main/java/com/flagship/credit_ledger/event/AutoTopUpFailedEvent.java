package com.flagship.credit_ledger.event;

import com.flagship.credit_ledger.topup.AutoTopUpTrigger;
import com.flagship.credit_ledger.topup.RetryStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted for every automatic top-up that did not add credits, including
 * attempts skipped by the cooldown or the monthly cap.
 */
@Value
public class AutoTopUpFailedEvent implements CreditEvent {
    UUID eventId;
    String holderId;
    String customerId;
    String key;
    AutoTopUpTrigger trigger;
    RetryStatus status;
    Instant nextAttemptAt;
    Integer failureCount;
    String declineCode;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AutoTopUpFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
