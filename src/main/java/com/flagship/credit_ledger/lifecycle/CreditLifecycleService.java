package com.flagship.credit_ledger.lifecycle;

import com.flagship.credit_ledger.billing.BillingAccountDirectory;
import com.flagship.credit_ledger.billing.BillingSubscription;
import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.credit.CreditService;
import com.flagship.credit_ledger.ledger.CreditLedgerQueries;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.plan.BillingInterval;
import com.flagship.credit_ledger.plan.Plan;
import com.flagship.credit_ledger.plan.PlanPrice;
import com.flagship.credit_ledger.plan.PlanResolver;
import com.flagship.credit_ledger.wallet.WalletService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns subscription events into ledger mutations.
 *
 * Every mutation carries an idempotency key namespaced by the provider event
 * (subscription or invoice id) and the credit key, so a redelivered event is a
 * no-op. This class is deliberately not transactional: each mutation commits
 * on its own and a conflict on one key does not undo the others.
 */
@Service
@Slf4j
public class CreditLifecycleService {

    private final CreditService creditService;
    private final CreditLedgerQueries ledgerQueries;
    private final BillingAccountDirectory accountDirectory;
    private final PlanResolver planResolver;
    private final CreditLedgerProperties properties;

    public CreditLifecycleService(CreditService creditService,
                                  CreditLedgerQueries ledgerQueries,
                                  BillingAccountDirectory accountDirectory,
                                  PlanResolver planResolver,
                                  CreditLedgerProperties properties) {
        this.creditService = creditService;
        this.ledgerQueries = ledgerQueries;
        this.accountDirectory = accountDirectory;
        this.planResolver = planResolver;
        this.properties = properties;
    }

    public void onSubscriptionCreated(BillingSubscription subscription) {
        GrantTarget target = properties.getGrantTo();
        if (target == GrantTarget.MANUAL) {
            return;
        }
        Optional<Plan> plan = planResolver.findPlanByPriceId(subscription.getPriceId());
        if (plan.isEmpty()) {
            log.debug("No plan for price {}, nothing to grant", subscription.getPriceId());
            return;
        }
        List<PlanAllocation> allocations = allocationsFor(plan.get(), subscription.getPriceId(), subscription.getCurrency());

        if (target == GrantTarget.SEAT_USERS) {
            String firstSeatUserId = subscription.metadataValue(BillingSubscription.FIRST_SEAT_USER_ID);
            if (firstSeatUserId == null) {
                // seats arrive later through addSeat
                return;
            }
            for (PlanAllocation allocation : allocations) {
                grant(firstSeatUserId, allocation, TransactionSource.SEAT_GRANT, subscription.getId(),
                        "seat_" + firstSeatUserId + "_" + subscription.getId() + ":" + allocation.getKey(),
                        "Seat credits");
            }
            return;
        }

        resolveSubscriber(subscription).ifPresent(holderId -> {
            for (PlanAllocation allocation : allocations) {
                grant(holderId, allocation, TransactionSource.SUBSCRIPTION, subscription.getId(),
                        subscription.getId() + ":" + allocation.getKey(), "Subscription credits");
            }
        });
    }

    public void onSubscriptionRenewed(BillingSubscription subscription, String invoiceId) {
        GrantTarget target = properties.getGrantTo();
        if (target == GrantTarget.MANUAL) {
            return;
        }
        Optional<Plan> plan = planResolver.findPlanByPriceId(subscription.getPriceId());
        if (plan.isEmpty()) {
            return;
        }
        List<PlanAllocation> allocations = allocationsFor(plan.get(), subscription.getPriceId(), subscription.getCurrency());

        if (target == GrantTarget.SEAT_USERS) {
            for (String seatUserId : ledgerQueries.getActiveSeatUsers(subscription.getId())) {
                for (PlanAllocation allocation : allocations) {
                    renew(seatUserId, allocation, TransactionSource.RENEWAL, subscription.getId(),
                            "renewal_" + invoiceId + "_" + seatUserId + ":" + allocation.getKey(), invoiceId);
                }
            }
            return;
        }

        resolveSubscriber(subscription).ifPresent(holderId -> {
            for (PlanAllocation allocation : allocations) {
                renew(holderId, allocation, TransactionSource.RENEWAL, subscription.getId(),
                        "renewal_" + invoiceId + ":" + allocation.getKey(), invoiceId);
            }
        });
    }

    /**
     * Revokes every balance of the affected holders, top-ups included: access ends entirely.
     */
    public void onSubscriptionCancelled(BillingSubscription subscription) {
        GrantTarget target = properties.getGrantTo();
        if (target == GrantTarget.MANUAL) {
            return;
        }

        if (target == GrantTarget.SEAT_USERS) {
            for (String seatUserId : ledgerQueries.getActiveSeatUsers(subscription.getId())) {
                revokeEverything(seatUserId, TransactionSource.SEAT_REVOKE, subscription.getId(),
                        "cancel_" + subscription.getId() + "_" + seatUserId);
            }
            return;
        }

        resolveSubscriber(subscription).ifPresent(holderId ->
                revokeEverything(holderId, TransactionSource.CANCELLATION, subscription.getId(),
                        "cancel_" + subscription.getId()));
    }

    /**
     * Upgrades apply at once. Downgrades carry {@code pending_credit_downgrade} and
     * wait for {@link #onDowngradeApplied} at the next renewal boundary.
     */
    public void onSubscriptionPlanChanged(BillingSubscription subscription, String previousPriceId) {
        GrantTarget target = properties.getGrantTo();
        if (target == GrantTarget.MANUAL) {
            return;
        }
        if ("true".equals(subscription.metadataValue(BillingSubscription.PENDING_CREDIT_DOWNGRADE))) {
            log.info("Downgrade of subscription {} deferred to the next renewal", subscription.getId());
            return;
        }
        if (Objects.equals(previousPriceId, subscription.getPriceId())) {
            return;
        }
        Optional<Plan> newPlan = planResolver.findPlanByPriceId(subscription.getPriceId());
        if (newPlan.isEmpty()) {
            return;
        }

        boolean fromFreePlan = isFreeUpgrade(subscription, previousPriceId);
        Optional<Plan> oldPlan = planResolver.findPlanByPriceId(previousPriceId);
        List<PlanAllocation> allocations = allocationsFor(newPlan.get(), subscription.getPriceId(), subscription.getCurrency());
        String prefix = "plan_change_" + subscription.getId() + "_" + previousPriceId + "_" + subscription.getPriceId()
                + eventSuffix(subscription);

        for (String holderId : holdersOf(subscription, target)) {
            if (fromFreePlan && oldPlan.isPresent()) {
                for (String key : keysOf(oldPlan.get())) {
                    revokeBalance(holderId, key, TransactionSource.PLAN_CHANGE, subscription.getId(),
                            prefix + "_revoke_" + holderId + ":" + key);
                }
            }
            for (PlanAllocation allocation : allocations) {
                grant(holderId, allocation, TransactionSource.PLAN_CHANGE, subscription.getId(),
                        prefix + "_" + holderId + ":" + allocation.getKey(), "Plan change credits");
            }
        }
    }

    /**
     * Applies a deferred downgrade: keys the new plan lacks are revoked, the rest
     * renew as usual.
     */
    public void onDowngradeApplied(BillingSubscription subscription, String newPriceId) {
        GrantTarget target = properties.getGrantTo();
        if (target == GrantTarget.MANUAL) {
            return;
        }
        Optional<Plan> newPlan = planResolver.findPlanByPriceId(newPriceId);
        if (newPlan.isEmpty()) {
            return;
        }
        Set<String> keptKeys = keysOf(newPlan.get());
        List<PlanAllocation> allocations = allocationsFor(newPlan.get(), newPriceId, subscription.getCurrency());
        Optional<Plan> oldPlan = Objects.equals(subscription.getPriceId(), newPriceId)
                ? Optional.empty()
                : planResolver.findPlanByPriceId(subscription.getPriceId());
        String prefix = "downgrade_" + subscription.getId() + "_" + newPriceId + eventSuffix(subscription);

        for (String holderId : holdersOf(subscription, target)) {
            Set<String> droppedKeys = new LinkedHashSet<>(oldPlan.map(this::keysOf)
                    .orElseGet(() -> ledgerQueries.getAllBalances(holderId).keySet()));
            droppedKeys.removeAll(keptKeys);
            for (String key : droppedKeys) {
                revokeBalance(holderId, key, TransactionSource.PLAN_CHANGE, subscription.getId(),
                        prefix + "_revoke_" + holderId + ":" + key);
            }
            for (PlanAllocation allocation : allocations) {
                renew(holderId, allocation, TransactionSource.PLAN_CHANGE, subscription.getId(),
                        prefix + "_" + holderId + ":" + allocation.getKey(), null);
            }
        }
        log.info("Downgrade applied: subscriptionId={}, newPriceId={}, revokedKeysAbsentFrom={}",
                subscription.getId(), newPriceId, newPlan.get().getId());
    }

    private void grant(String holderId, PlanAllocation allocation, TransactionSource source,
                       String subscriptionId, String idempotencyKey, String description) {
        if (allocation.getAmount() <= 0) {
            return;
        }
        LedgerMutation mutation = LedgerMutation.builder()
                .source(source)
                .sourceId(subscriptionId)
                .description(description)
                .idempotencyKey(idempotencyKey)
                .currency(allocation.getCurrency())
                .build();
        runOnce(idempotencyKey, () -> creditService.grant(holderId, allocation.getKey(), allocation.getAmount(), mutation));
    }

    /**
     * Reset: one signed adjust entry to the allocation, wiping any residue. Add: accumulate.
     */
    private void renew(String holderId, PlanAllocation allocation, TransactionSource source,
                       String subscriptionId, String idempotencyKey, String invoiceId) {
        LedgerMutation mutation = LedgerMutation.builder()
                .source(source)
                .sourceId(subscriptionId)
                .description(allocation.resets() ? "Renewal reset" : "Renewal credits")
                .metadata(invoiceId != null ? Map.of("invoiceId", invoiceId) : null)
                .idempotencyKey(idempotencyKey)
                .currency(allocation.getCurrency())
                .build();
        if (allocation.resets()) {
            runOnce(idempotencyKey, () -> creditService.setBalance(holderId, allocation.getKey(), allocation.getAmount(), mutation));
        } else if (allocation.getAmount() > 0) {
            runOnce(idempotencyKey, () -> creditService.grant(holderId, allocation.getKey(), allocation.getAmount(), mutation));
        }
    }

    private void revokeBalance(String holderId, String key, TransactionSource source,
                               String subscriptionId, String idempotencyKey) {
        LedgerMutation mutation = LedgerMutation.builder()
                .source(source)
                .sourceId(subscriptionId)
                .description("Plan change revoke")
                .idempotencyKey(idempotencyKey)
                .build();
        runOnce(idempotencyKey, () -> creditService.revokeAll(holderId, key, mutation));
    }

    private void revokeEverything(String holderId, TransactionSource source, String subscriptionId,
                                  String idempotencyPrefix) {
        LedgerMutation mutation = LedgerMutation.builder()
                .source(source)
                .sourceId(subscriptionId)
                .description("Subscription cancelled")
                .idempotencyKey(idempotencyPrefix)
                .build();
        runOnce(idempotencyPrefix, () -> creditService.revokeAllForHolder(holderId, mutation));
    }

    private void runOnce(String idempotencyKey, Runnable mutation) {
        try {
            mutation.run();
        } catch (CreditException e) {
            if (!e.is(CreditErrorCode.IDEMPOTENCY_CONFLICT)) {
                throw e;
            }
            log.info("Lifecycle mutation already applied: idempotencyKey={}", idempotencyKey);
        }
    }

    /**
     * The same price pair can change back and forth within one subscription, so
     * plan change keys also carry the delivering event.
     */
    private static String eventSuffix(BillingSubscription subscription) {
        return subscription.getEventId() != null ? "_" + subscription.getEventId() : "";
    }

    private boolean isFreeUpgrade(BillingSubscription subscription, String previousPriceId) {
        if ("0".equals(subscription.metadataValue(BillingSubscription.UPGRADE_FROM_PRICE_AMOUNT))) {
            return true;
        }
        return planResolver.findPrice(previousPriceId)
                .map(price -> price.getAmount() == 0)
                .orElse(false);
    }

    private List<String> holdersOf(BillingSubscription subscription, GrantTarget target) {
        if (target == GrantTarget.SEAT_USERS) {
            return ledgerQueries.getActiveSeatUsers(subscription.getId());
        }
        return resolveSubscriber(subscription).map(List::of).orElse(List.of());
    }

    private Optional<String> resolveSubscriber(BillingSubscription subscription) {
        Optional<String> holderId = accountDirectory.findHolderByCustomer(subscription.getCustomerId());
        if (holderId.isEmpty()) {
            log.warn("No holder mapped to customer {} of subscription {}",
                    subscription.getCustomerId(), subscription.getId());
        }
        return holderId;
    }

    private List<PlanAllocation> allocationsFor(Plan plan, String priceId, String currency) {
        BillingInterval interval = planResolver.findPrice(priceId)
                .map(PlanPrice::getInterval)
                .orElse(BillingInterval.MONTH);
        return PlanAllocation.of(plan, interval, currency);
    }

    private Set<String> keysOf(Plan plan) {
        Set<String> keys = new LinkedHashSet<>(plan.getCredits().keySet());
        if (plan.hasWalletAllocation()) {
            keys.add(WalletService.WALLET_KEY);
        }
        return keys;
    }
}
