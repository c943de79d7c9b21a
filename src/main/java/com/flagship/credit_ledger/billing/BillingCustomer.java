package com.flagship.credit_ledger.billing;

import lombok.Value;

@Value
public class BillingCustomer {
    String holderId;
    String customerId;
    String defaultPaymentMethodId;
    boolean deleted;

    public boolean hasPaymentMethod() {
        return defaultPaymentMethodId != null && !defaultPaymentMethodId.isBlank();
    }
}
