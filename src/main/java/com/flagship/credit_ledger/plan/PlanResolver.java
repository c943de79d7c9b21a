package com.flagship.credit_ledger.plan;

import java.util.Optional;

/**
 * Lookup from a provider price id to the plan it belongs to.
 */
public interface PlanResolver {

    Optional<Plan> findPlanByPriceId(String priceId);

    Optional<PlanPrice> findPrice(String priceId);
}
