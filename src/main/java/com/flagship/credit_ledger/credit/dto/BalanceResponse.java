package com.flagship.credit_ledger.credit.dto;

import lombok.Value;

@Value
public class BalanceResponse {
    String holderId;
    String key;
    long balance;
}
