package com.flagship.credit_ledger.wallet;

import lombok.Value;

@Value
public class WalletConsumeResult {
    boolean success;
    /** After the spend, or the untouched balance when it was insufficient. */
    WalletBalance balance;
}
