package com.flagship.credit_ledger.wallet;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WalletFormatterTest {

    @Test
    @DisplayName("Known currencies use their symbol with two decimals")
    void formatsWithSymbol() {
        assertEquals("$1.50", WalletFormatter.format(150_000, "usd"));
        assertEquals("€0.05", WalletFormatter.format(5_000, "eur"));
        assertEquals("£12.00", WalletFormatter.format(1_200_000, "GBP"));
    }

    @Test
    @DisplayName("Zero-decimal currencies show whole units")
    void zeroDecimalCurrencies() {
        assertEquals("¥5000", WalletFormatter.format(5_000_000, "jpy"));
        assertEquals("₩1200", WalletFormatter.format(1_200_000, "krw"));
        assertTrue(WalletFormatter.isZeroDecimal("XOF"));
        assertFalse(WalletFormatter.isZeroDecimal("usd"));
    }

    @Test
    @DisplayName("Other currencies are prefixed with their code")
    void unknownCurrencyUsesCode() {
        assertEquals("CHF 1.50", WalletFormatter.format(150_000, "chf"));
    }

    @Test
    @DisplayName("Negative balances carry the sign before the symbol")
    void negativeAmounts() {
        assertEquals("-$1.50", WalletFormatter.format(-150_000, "usd"));
    }

    @Test
    @DisplayName("Sub-cent remainders survive the conversion to cents")
    void milliCentConversion() {
        assertEquals(250_000, WalletFormatter.centsToMilliCents(250));
        assertEquals(0, new BigDecimal("12.5").compareTo(WalletFormatter.milliCentsToCents(12_500)));
        assertThrows(ArithmeticException.class, () -> WalletFormatter.centsToMilliCents(Long.MAX_VALUE));
    }
}
