package com.flagship.credit_ledger.topup;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeclineType {
    /** The instrument is unusable until the holder replaces it. */
    HARD,
    /** Probably temporary; retried after the cooldown. */
    SOFT;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase();
    }

    public static DeclineType fromDbValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
