package com.flagship.credit_ledger.wallet;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Unit conversion and display formatting for wallet amounts.
 *
 * The ledger stores milli-cents: 1000 per smallest currency unit.
 */
public final class WalletFormatter {

    public static final long MILLI_CENTS_PER_CENT = 1000;

    private static final Set<String> ZERO_DECIMAL_CURRENCIES = Set.of(
            "bif", "clp", "djf", "gnf", "jpy", "kmf", "krw", "mga", "pyg", "rwf",
            "ugx", "vnd", "vuv", "xaf", "xof", "xpf");

    private static final Map<String, String> SYMBOLS = Map.of(
            "usd", "$",
            "eur", "€",
            "gbp", "£",
            "jpy", "¥",
            "krw", "₩");

    private WalletFormatter() {
    }

    public static long centsToMilliCents(long cents) {
        return Math.multiplyExact(cents, MILLI_CENTS_PER_CENT);
    }

    public static BigDecimal milliCentsToCents(long milliCents) {
        return BigDecimal.valueOf(milliCents).divide(BigDecimal.valueOf(MILLI_CENTS_PER_CENT));
    }

    public static boolean isZeroDecimal(String currency) {
        return ZERO_DECIMAL_CURRENCIES.contains(currency.toLowerCase(Locale.ROOT));
    }

    /**
     * 150000 usd -> "$1.50", 5000000 jpy -> "¥5000", -150000 usd -> "-$1.50".
     */
    public static String format(long milliCents, String currency) {
        String code = currency.toLowerCase(Locale.ROOT);
        String symbol = SYMBOLS.getOrDefault(code, currency.toUpperCase(Locale.ROOT) + " ");
        BigDecimal cents = milliCentsToCents(milliCents);

        BigDecimal display = isZeroDecimal(code)
                ? cents.setScale(0, RoundingMode.HALF_UP)
                : cents.movePointLeft(2).setScale(2, RoundingMode.HALF_UP);
        String sign = display.signum() < 0 ? "-" : "";
        return sign + symbol + display.abs().toPlainString();
    }
}
