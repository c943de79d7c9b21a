package com.flagship.credit_ledger.plan;

/**
 * Scales a monthly base allocation to the billing interval.
 *
 * The provider renews once per interval, so a yearly subscriber gets the whole
 * year up front. Weekly rounds up.
 */
public final class AllocationScaler {

    private AllocationScaler() {
    }

    public static long scale(long base, BillingInterval interval) {
        if (interval == null) {
            return base;
        }
        return switch (interval) {
            case YEAR -> base * 12;
            case WEEK -> (base + 3) / 4;
            case MONTH, ONE_TIME -> base;
        };
    }
}
