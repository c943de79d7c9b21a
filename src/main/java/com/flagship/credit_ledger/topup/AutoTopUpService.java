package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.billing.BillingAccountDirectory;
import com.flagship.credit_ledger.billing.BillingCustomer;
import com.flagship.credit_ledger.billing.BillingSubscription;
import com.flagship.credit_ledger.plan.AutoTopUpSettings;
import com.flagship.credit_ledger.plan.CreditAllocation;
import com.flagship.credit_ledger.plan.PlanResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Replenishes a credit type whose balance fell below its configured threshold.
 * Called by whoever consumed the credits, after the consume committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoTopUpService {

    private final BillingAccountDirectory accountDirectory;
    private final PlanResolver planResolver;
    private final AutoTopUpEngine engine;

    public AutoTopUpResult triggerAutoTopUpIfNeeded(String holderId, String key, long currentBalance) {
        Optional<BillingCustomer> customer = accountDirectory.findCustomerByHolder(holderId)
                .filter(found -> !found.isDeleted());
        if (customer.isEmpty()) {
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.USER_NOT_FOUND);
        }

        Optional<BillingSubscription> subscription = accountDirectory.findActiveSubscription(customer.get().getCustomerId());
        if (subscription.isEmpty()) {
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.NO_SUBSCRIPTION);
        }

        CreditAllocation credit = planResolver.findPlanByPriceId(subscription.get().getPriceId())
                .flatMap(plan -> plan.findCredit(key))
                .orElse(null);
        if (credit == null || credit.getPricePerCredit() == null || credit.getAutoTopUp() == null) {
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.NOT_CONFIGURED);
        }

        AutoTopUpSettings settings = credit.getAutoTopUp();
        if (settings.getAmount() <= 0 || settings.getThreshold() <= 0 || credit.getPricePerCredit() <= 0) {
            log.error("Invalid auto top-up config for {}: amount={}, threshold={}, pricePerCredit={}",
                    key, settings.getAmount(), settings.getThreshold(), credit.getPricePerCredit());
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.NOT_CONFIGURED);
        }

        return engine.run(AutoTopUpAttempt.builder()
                .holderId(holderId)
                .key(key)
                .customer(customer.get())
                .currentBalance(currentBalance)
                .threshold(settings.getThreshold())
                .purchaseAmount(settings.getAmount())
                .totalCents(Math.multiplyExact(settings.getAmount(), credit.getPricePerCredit()))
                .currency(subscription.get().getCurrency())
                .maxPerMonth(settings.getMaxPerMonth())
                .chargeKeyStem("auto_topup_" + holderId + "_" + key)
                .description(settings.getAmount() + " " + displayName(credit, key) + " (auto top-up)")
                .build());
    }

    private static String displayName(CreditAllocation credit, String key) {
        return credit.getDisplayName() != null ? credit.getDisplayName() : key;
    }
}
