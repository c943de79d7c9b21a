package com.flagship.credit_ledger.plan;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A billing plan and the credits it grants.
 */
@Getter
@Setter
public class Plan {
    private String id;
    private String name;
    /** Subscription quantity follows the number of seats. */
    private boolean perSeat;
    private List<PlanPrice> prices = new ArrayList<>();
    private Map<String, CreditAllocation> credits = new LinkedHashMap<>();
    private WalletAllocation wallet;

    public Optional<PlanPrice> findPrice(String priceId) {
        return prices.stream()
                .filter(price -> price.getId().equals(priceId))
                .findFirst();
    }

    public Optional<CreditAllocation> findCredit(String key) {
        return Optional.ofNullable(credits.get(key));
    }

    public boolean hasWalletAllocation() {
        return wallet != null && wallet.getAllocation() != null && wallet.getAllocation() > 0;
    }
}
