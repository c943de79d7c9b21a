package com.flagship.credit_ledger.topup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of an automatic top-up check.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutoTopUpResult {

    public enum Reason {
        BALANCE_ABOVE_THRESHOLD,
        NOT_CONFIGURED,
        MAX_PER_MONTH_REACHED,
        NO_PAYMENT_METHOD,
        NO_SUBSCRIPTION,
        USER_NOT_FOUND,
        DISABLED_HARD_DECLINE,
        IN_COOLDOWN,
        CURRENCY_MISMATCH,
        PAYMENT_FAILED;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }

    boolean triggered;
    /** Set when triggered: true once granted, false while the payment is still processing. */
    Boolean completed;
    String sourceId;
    Reason reason;
    Instant retriesAt;
    String error;
    String declineCode;
    DeclineType declineType;

    public static AutoTopUpResult succeeded(String sourceId) {
        return new AutoTopUpResult(true, true, sourceId, null, null, null, null, null);
    }

    public static AutoTopUpResult pending(String sourceId) {
        return new AutoTopUpResult(true, false, sourceId, null, null, null, null, null);
    }

    public static AutoTopUpResult skipped(Reason reason) {
        return skipped(reason, null);
    }

    public static AutoTopUpResult skipped(Reason reason, Instant retriesAt) {
        return new AutoTopUpResult(false, null, null, reason, retriesAt, null, null, null);
    }

    public static AutoTopUpResult failed(String error, String declineCode, DeclineType declineType) {
        return new AutoTopUpResult(false, null, null, Reason.PAYMENT_FAILED, null, error, declineCode, declineType);
    }
}
