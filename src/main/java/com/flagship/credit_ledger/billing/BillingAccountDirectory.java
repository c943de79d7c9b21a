package com.flagship.credit_ledger.billing;

import java.util.Optional;

/**
 * Read access to the provider's customers and subscriptions as mirrored locally.
 */
public interface BillingAccountDirectory {

    Optional<BillingCustomer> findCustomerByHolder(String holderId);

    Optional<String> findHolderByCustomer(String customerId);

    /**
     * Newest subscription that still grants access (active, trialing or past due).
     */
    Optional<BillingSubscription> findActiveSubscription(String customerId);
}
