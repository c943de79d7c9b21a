package com.flagship.credit_ledger.seat;

import com.flagship.credit_ledger.billing.BillingAccountDirectory;
import com.flagship.credit_ledger.billing.BillingCustomer;
import com.flagship.credit_ledger.billing.BillingSubscription;
import com.flagship.credit_ledger.billing.PaymentGateway;
import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.credit.CreditService;
import com.flagship.credit_ledger.ledger.CreditLedgerQueries;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.RevokeResult;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.lifecycle.GrantTarget;
import com.flagship.credit_ledger.lifecycle.PlanAllocation;
import com.flagship.credit_ledger.plan.BillingInterval;
import com.flagship.credit_ledger.plan.Plan;
import com.flagship.credit_ledger.plan.PlanPrice;
import com.flagship.credit_ledger.plan.PlanResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Adds and removes holders as seats of an organization's subscription.
 *
 * Membership is never stored: a holder is a seat while their latest
 * seat_grant/seat_revoke entry for the subscription is a grant. Removing a seat
 * revokes only what the subscription granted, so top-ups survive.
 */
@Service
@Slf4j
public class SeatService {

    private final CreditService creditService;
    private final CreditLedgerQueries ledgerQueries;
    private final BillingAccountDirectory accountDirectory;
    private final PlanResolver planResolver;
    private final PaymentGateway paymentGateway;
    private final CreditLedgerProperties properties;

    public SeatService(CreditService creditService,
                       CreditLedgerQueries ledgerQueries,
                       BillingAccountDirectory accountDirectory,
                       PlanResolver planResolver,
                       PaymentGateway paymentGateway,
                       CreditLedgerProperties properties) {
        this.creditService = creditService;
        this.ledgerQueries = ledgerQueries;
        this.accountDirectory = accountDirectory;
        this.planResolver = planResolver;
        this.paymentGateway = paymentGateway;
        this.properties = properties;
    }

    /**
     * @param creditKey restricts the grant to one credit type; null grants every type of the plan
     */
    public SeatResult addSeat(String userId, String orgId, String creditKey) {
        Optional<BillingSubscription> subscription = findOrgSubscription(orgId);
        if (subscription.isEmpty()) {
            return SeatResult.failed("No active subscription found for org");
        }
        Optional<Plan> plan = planResolver.findPlanByPriceId(subscription.get().getPriceId());
        if (plan.isEmpty()) {
            return SeatResult.failed("Could not resolve plan from subscription");
        }
        String subscriptionId = subscription.get().getId();
        GrantTarget target = properties.getGrantTo();

        Map<String, Long> creditsGranted = new LinkedHashMap<>();
        boolean alreadyProcessed = false;
        if (target != GrantTarget.MANUAL) {
            String recipient = target == GrantTarget.SEAT_USERS ? userId : orgId;
            if (target == GrantTarget.SEAT_USERS) {
                Optional<String> existing = ledgerQueries.getUserSeatSubscription(userId);
                if (existing.isPresent() && !existing.get().equals(subscriptionId)) {
                    return SeatResult.failed("User is already a seat of another subscription");
                }
                alreadyProcessed = existing.isPresent();
            }

            if (!alreadyProcessed) {
                String prefix = "seat_" + orgId + "_" + userId + "_" + subscriptionId;
                for (PlanAllocation allocation : seatAllocations(plan.get(), subscription.get(), creditKey)) {
                    LedgerMutation mutation = LedgerMutation.builder()
                            .source(TransactionSource.SEAT_GRANT)
                            .sourceId(subscriptionId)
                            .description("Seat credits")
                            .idempotencyKey(prefix + ":" + allocation.getKey())
                            .build();
                    try {
                        creditService.grant(recipient, allocation.getKey(), allocation.getAmount(), mutation);
                        creditsGranted.put(allocation.getKey(), allocation.getAmount());
                    } catch (CreditException e) {
                        if (!e.is(CreditErrorCode.IDEMPOTENCY_CONFLICT)) {
                            throw e;
                        }
                        alreadyProcessed = true;
                    }
                }
            }
        }

        if (plan.get().isPerSeat()) {
            // the provider's idempotency key makes a repeated add a no-op there too
            paymentGateway.updateSubscriptionQuantity(subscriptionId, subscription.get().getQuantity() + 1,
                    "add_seat_" + orgId + "_" + userId + "_" + subscriptionId);
        }

        log.info("Seat added: userId={}, orgId={}, subscriptionId={}, creditsGranted={}, alreadyProcessed={}",
                userId, orgId, subscriptionId, creditsGranted, alreadyProcessed);
        return SeatResult.granted(creditsGranted, alreadyProcessed);
    }

    /**
     * @param creditKey restricts the revoke to one credit type; null revokes every type
     */
    public SeatResult removeSeat(String userId, String orgId, String creditKey) {
        Optional<BillingSubscription> subscription = findOrgSubscription(orgId);
        if (subscription.isEmpty()) {
            return SeatResult.failed("No active subscription found for org");
        }
        Optional<Plan> plan = planResolver.findPlanByPriceId(subscription.get().getPriceId());
        if (plan.isEmpty()) {
            return SeatResult.failed("Could not resolve plan from subscription");
        }
        String subscriptionId = subscription.get().getId();
        GrantTarget target = properties.getGrantTo();

        Map<String, Long> creditsRevoked = new LinkedHashMap<>();
        if (target != GrantTarget.MANUAL) {
            String holder = target == GrantTarget.SEAT_USERS ? userId : orgId;
            Map<String, Long> granted = ledgerQueries.getCreditsGrantedBySource(holder, subscriptionId);
            for (Map.Entry<String, Long> entry : granted.entrySet()) {
                if (creditKey != null && !creditKey.equals(entry.getKey())) {
                    continue;
                }
                long amountToRevoke = Math.min(entry.getValue(), ledgerQueries.getBalance(holder, entry.getKey()));
                if (amountToRevoke <= 0) {
                    continue;
                }
                RevokeResult result = creditService.revoke(holder, entry.getKey(), amountToRevoke,
                        LedgerMutation.builder()
                                .source(TransactionSource.SEAT_REVOKE)
                                .sourceId(subscriptionId)
                                .description("Seat removed")
                                .build());
                creditsRevoked.put(entry.getKey(), result.getAmountRevoked());
            }
        }

        if (plan.get().isPerSeat()) {
            int currentQuantity = subscription.get().getQuantity();
            int newQuantity = Math.max(1, currentQuantity - 1);
            if (newQuantity != currentQuantity) {
                paymentGateway.updateSubscriptionQuantity(subscriptionId, newQuantity,
                        "remove_seat_" + orgId + "_" + userId + "_" + subscriptionId);
            }
        }

        log.info("Seat removed: userId={}, orgId={}, subscriptionId={}, creditsRevoked={}",
                userId, orgId, subscriptionId, creditsRevoked);
        return SeatResult.revoked(creditsRevoked);
    }

    private Optional<BillingSubscription> findOrgSubscription(String orgId) {
        return accountDirectory.findCustomerByHolder(orgId)
                .filter(customer -> !customer.isDeleted())
                .map(BillingCustomer::getCustomerId)
                .flatMap(accountDirectory::findActiveSubscription);
    }

    private List<PlanAllocation> seatAllocations(Plan plan, BillingSubscription subscription, String creditKey) {
        BillingInterval interval = planResolver.findPrice(subscription.getPriceId())
                .map(PlanPrice::getInterval)
                .orElse(BillingInterval.MONTH);
        return PlanAllocation.of(plan, interval, subscription.getCurrency()).stream()
                .filter(allocation -> !allocation.isWallet())
                .filter(allocation -> allocation.getAmount() > 0)
                .filter(allocation -> creditKey == null || creditKey.equals(allocation.getKey()))
                .collect(Collectors.toList());
    }
}
