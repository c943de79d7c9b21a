package com.flagship.credit_ledger.billing;

import lombok.Value;

/**
 * Everything the ledger reads back from a charge: status and decline code.
 */
@Value
public class ChargeResult {
    ChargeStatus status;
    String chargeId;
    String declineCode;
    String message;

    public static ChargeResult succeeded(String chargeId) {
        return new ChargeResult(ChargeStatus.SUCCEEDED, chargeId, null, null);
    }

    public static ChargeResult processing(String chargeId) {
        return new ChargeResult(ChargeStatus.PROCESSING, chargeId, null, null);
    }

    public static ChargeResult failed(String chargeId, String declineCode, String message) {
        return new ChargeResult(ChargeStatus.FAILED, chargeId, declineCode, message);
    }

    public boolean isSucceeded() {
        return status == ChargeStatus.SUCCEEDED;
    }
}
