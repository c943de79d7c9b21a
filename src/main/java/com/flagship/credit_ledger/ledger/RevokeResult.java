package com.flagship.credit_ledger.ledger;

import lombok.Value;

@Value
public class RevokeResult {
    long newBalance;
    /** May be lower than requested, including zero. */
    long amountRevoked;
}
