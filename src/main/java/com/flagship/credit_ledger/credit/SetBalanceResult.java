package com.flagship.credit_ledger.credit;

import lombok.Value;

@Value
public class SetBalanceResult {
    long balance;
    long previousBalance;
}
