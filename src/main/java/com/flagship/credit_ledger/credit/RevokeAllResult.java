package com.flagship.credit_ledger.credit;

import lombok.Value;

@Value
public class RevokeAllResult {
    long previousBalance;
    long amountRevoked;

    public static RevokeAllResult nothing() {
        return new RevokeAllResult(0, 0);
    }
}
