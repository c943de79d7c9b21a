package com.flagship.credit_ledger.plan;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Plan catalogue bound from {@code billing.plans}.
 */
@ConfigurationProperties(prefix = "billing")
@Getter
@Setter
public class BillingPlanProperties {
    private List<Plan> plans = new ArrayList<>();
}
