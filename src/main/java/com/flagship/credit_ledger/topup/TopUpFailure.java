package com.flagship.credit_ledger.topup;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Current auto top-up block state of one (holder, key). At most one exists;
 * deleted on recovery.
 */
@Value
public class TopUpFailure {

    public static final Duration SOFT_DECLINE_COOLDOWN = Duration.ofHours(24);
    public static final int ESCALATION_THRESHOLD = 3;

    String holderId;
    String key;
    String paymentMethodId;
    DeclineType declineType;
    String declineCode;
    int failureCount;
    Instant lastFailureAt;
    boolean disabled;

    /**
     * Hard decline, or the third soft one. Stored decline type stays "soft" in the latter case.
     */
    public boolean requiresAction() {
        return declineType == DeclineType.HARD || failureCount >= ESCALATION_THRESHOLD;
    }

    public Instant cooldownEndsAt() {
        return lastFailureAt.plus(SOFT_DECLINE_COOLDOWN);
    }
}
