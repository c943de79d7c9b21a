package com.flagship.credit_ledger.topup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import lombok.Value;

/**
 * Outcome of an on-demand top-up. Payment problems are reported here, never thrown.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TopUpResult {

    public enum Outcome {
        /** Charged and granted. */
        SUCCEEDED,
        /** Asynchronous payment method; the webhook grants later. */
        PENDING,
        FAILED
    }

    Outcome outcome;
    Long balance;
    Long chargedAmount;
    String currency;
    String sourceId;
    CreditErrorCode errorCode;
    String message;
    /** Hosted checkout that completes the purchase and stores a card, when one could be created. */
    String recoveryUrl;

    public static TopUpResult succeeded(long balance, long chargedAmount, String currency, String sourceId) {
        return new TopUpResult(Outcome.SUCCEEDED, balance, chargedAmount, currency, sourceId, null, null, null);
    }

    public static TopUpResult pending(String sourceId) {
        return new TopUpResult(Outcome.PENDING, null, null, null, sourceId, null,
                "Payment is processing. Credits will be added once payment completes.", null);
    }

    public static TopUpResult failed(CreditErrorCode errorCode, String message) {
        return failed(errorCode, message, null);
    }

    public static TopUpResult failed(CreditErrorCode errorCode, String message, String recoveryUrl) {
        return new TopUpResult(Outcome.FAILED, null, null, null, null, errorCode, message, recoveryUrl);
    }

    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }
}
