package com.flagship.credit_ledger.plan;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Component
public class ConfiguredPlanResolver implements PlanResolver {

    private final BillingPlanProperties properties;

    public ConfiguredPlanResolver(BillingPlanProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<Plan> findPlanByPriceId(String priceId) {
        if (priceId == null) {
            return Optional.empty();
        }
        return properties.getPlans().stream()
                .filter(plan -> plan.findPrice(priceId).isPresent())
                .findFirst();
    }

    @Override
    public Optional<PlanPrice> findPrice(String priceId) {
        if (priceId == null) {
            return Optional.empty();
        }
        return properties.getPlans().stream()
                .map(plan -> plan.findPrice(priceId).orElse(null))
                .filter(Objects::nonNull)
                .findFirst();
    }
}
