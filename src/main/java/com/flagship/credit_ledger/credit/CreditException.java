package com.flagship.credit_ledger.credit;

import lombok.Getter;

import java.util.Map;

/**
 * Typed failure of a credit operation.
 */
@Getter
public class CreditException extends RuntimeException {

    private final CreditErrorCode code;
    private final Map<String, String> details;

    public CreditException(CreditErrorCode code, String message) {
        this(code, message, Map.of());
    }

    public CreditException(CreditErrorCode code, String message, Map<String, String> details) {
        super(message);
        this.code = code;
        this.details = details;
    }

    public boolean is(CreditErrorCode expected) {
        return code == expected;
    }
}
