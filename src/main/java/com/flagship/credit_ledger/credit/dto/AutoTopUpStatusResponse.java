package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.credit_ledger.topup.DeclineType;
import com.flagship.credit_ledger.topup.TopUpFailure;
import lombok.Value;

import java.time.Instant;

/**
 * Auto top-up state for one credit key. {@code blocked=false} with no other
 * fields means no failure is on record.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutoTopUpStatusResponse {
    String holderId;
    String key;
    boolean blocked;
    DeclineType declineType;
    String declineCode;
    Integer failureCount;
    Instant lastFailureAt;
    Boolean requiresAction;
    Instant retriesAt;

    public static AutoTopUpStatusResponse clear(String holderId, String key) {
        return new AutoTopUpStatusResponse(holderId, key, false, null, null, null, null, null, null);
    }

    public static AutoTopUpStatusResponse from(TopUpFailure failure) {
        boolean requiresAction = failure.requiresAction();
        return new AutoTopUpStatusResponse(
                failure.getHolderId(),
                failure.getKey(),
                failure.isDisabled(),
                failure.getDeclineType(),
                failure.getDeclineCode(),
                failure.getFailureCount(),
                failure.getLastFailureAt(),
                requiresAction,
                requiresAction ? null : failure.cooldownEndsAt());
    }
}
