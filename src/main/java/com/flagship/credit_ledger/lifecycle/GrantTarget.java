package com.flagship.credit_ledger.lifecycle;

/**
 * Who receives credits when a subscription event arrives.
 */
public enum GrantTarget {
    /** The billing entity itself holds one shared pool. */
    SUBSCRIBER,
    /** Same as {@link #SUBSCRIBER}; reads better when the customer is an organization. */
    ORGANIZATION,
    /** Every active seat of the subscription holds its own balance. */
    SEAT_USERS,
    /** Subscription events change nothing; the application grants by hand. */
    MANUAL
}
