package com.flagship.credit_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class WalletBalance {
    /** May carry a fraction of a cent. */
    BigDecimal cents;
    String formatted;
    String currency;

    public static WalletBalance of(long milliCents, String currency) {
        return new WalletBalance(WalletFormatter.milliCentsToCents(milliCents),
                WalletFormatter.format(milliCents, currency), currency);
    }
}
