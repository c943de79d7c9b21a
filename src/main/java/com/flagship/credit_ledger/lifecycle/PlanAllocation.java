package com.flagship.credit_ledger.lifecycle;

import com.flagship.credit_ledger.plan.AllocationScaler;
import com.flagship.credit_ledger.plan.BillingInterval;
import com.flagship.credit_ledger.plan.OnRenewal;
import com.flagship.credit_ledger.plan.Plan;
import com.flagship.credit_ledger.wallet.WalletFormatter;
import com.flagship.credit_ledger.wallet.WalletService;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One balance a plan hands out per period, already scaled to the billing
 * interval. The wallet appears as an allocation of milli-cents.
 */
@Value
public class PlanAllocation {
    String key;
    long amount;
    OnRenewal onRenewal;
    /** Only for the wallet. */
    String currency;

    public static List<PlanAllocation> of(Plan plan, BillingInterval interval, String currency) {
        List<PlanAllocation> allocations = new ArrayList<>();
        plan.getCredits().forEach((key, credit) -> allocations.add(new PlanAllocation(
                key, AllocationScaler.scale(credit.getAllocation(), interval), credit.getOnRenewal(), null)));
        if (plan.hasWalletAllocation()) {
            long milliCents = WalletFormatter.centsToMilliCents(plan.getWallet().getAllocation());
            allocations.add(new PlanAllocation(WalletService.WALLET_KEY,
                    AllocationScaler.scale(milliCents, interval),
                    plan.getWallet().getOnRenewal(),
                    currency != null ? currency : WalletService.DEFAULT_CURRENCY));
        }
        return allocations;
    }

    public boolean isWallet() {
        return WalletService.WALLET_KEY.equals(key);
    }

    public boolean resets() {
        return onRenewal != OnRenewal.ADD;
    }
}
