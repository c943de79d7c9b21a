package com.flagship.credit_ledger.ledger;

import lombok.Value;

@Value
public class BalanceSnapshot {
    long balance;
    String currency;
}
