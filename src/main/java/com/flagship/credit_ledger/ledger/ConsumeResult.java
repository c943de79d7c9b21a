package com.flagship.credit_ledger.ledger;

import lombok.Value;

/**
 * Outcome of a consume. Insufficient balance is a normal outcome, not an error.
 */
@Value
public class ConsumeResult {
    boolean success;
    /** New balance when successful, untouched current balance otherwise. */
    long balance;

    public static ConsumeResult consumed(long newBalance) {
        return new ConsumeResult(true, newBalance);
    }

    public static ConsumeResult insufficient(long currentBalance) {
        return new ConsumeResult(false, currentBalance);
    }
}
