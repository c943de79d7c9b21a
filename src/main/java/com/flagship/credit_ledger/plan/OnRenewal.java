package com.flagship.credit_ledger.plan;

/**
 * What a renewal does to an existing balance.
 */
public enum OnRenewal {
    /** Set the balance to the allocation, discarding leftovers and debt. */
    RESET,
    /** Add the allocation on top of the current balance. */
    ADD
}
