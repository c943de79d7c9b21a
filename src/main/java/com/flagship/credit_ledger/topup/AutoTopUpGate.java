package com.flagship.credit_ledger.topup;

import lombok.Value;

import java.time.Instant;

/**
 * Decides whether the failure record allows another automatic charge.
 *
 * clear -> allowed; soft-blocked -> allowed once the 24h cooldown has passed;
 * hard-blocked or escalated -> blocked until the record is cleared.
 */
public final class AutoTopUpGate {

    private AutoTopUpGate() {
    }

    public static Decision evaluate(TopUpFailure failure, Instant now) {
        if (failure == null || !failure.isDisabled()) {
            return Decision.ALLOWED;
        }
        if (failure.requiresAction()) {
            return new Decision(false, AutoTopUpTrigger.BLOCKED_UNTIL_CARD_UPDATED,
                    RetryStatus.ACTION_REQUIRED, null);
        }
        Instant cooldownEnd = failure.cooldownEndsAt();
        if (now.isBefore(cooldownEnd)) {
            return new Decision(false, AutoTopUpTrigger.WAITING_FOR_RETRY_COOLDOWN,
                    RetryStatus.WILL_RETRY, cooldownEnd);
        }
        return Decision.ALLOWED;
    }

    @Value
    public static class Decision {
        static final Decision ALLOWED = new Decision(true, null, null, null);

        boolean allowed;
        AutoTopUpTrigger trigger;
        RetryStatus status;
        Instant nextAttemptAt;
    }
}
