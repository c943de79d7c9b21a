package com.flagship.credit_ledger.topup;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an automatic top-up did not add credits.
 */
public enum AutoTopUpTrigger {
    STRIPE_DECLINED_PAYMENT(RetryStatus.WILL_RETRY),
    WAITING_FOR_RETRY_COOLDOWN(RetryStatus.WILL_RETRY),
    BLOCKED_UNTIL_CARD_UPDATED(RetryStatus.ACTION_REQUIRED),
    NO_PAYMENT_METHOD(RetryStatus.ACTION_REQUIRED),
    MONTHLY_LIMIT_REACHED(RetryStatus.WILL_RETRY),
    UNEXPECTED_ERROR(RetryStatus.WILL_RETRY);

    /** Status reported unless the failure itself says otherwise (a hard decline, for one). */
    private final RetryStatus defaultStatus;

    AutoTopUpTrigger(RetryStatus defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    public RetryStatus defaultStatus() {
        return defaultStatus;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
