package com.flagship.credit_ledger.topup;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RetryStatus {
    /** The engine will try again on a later trigger. */
    WILL_RETRY,
    /** Nothing happens until the holder fixes their payment method. */
    ACTION_REQUIRED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
