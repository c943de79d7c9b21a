package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.billing.ChargeRequest;
import com.flagship.credit_ledger.billing.ChargeResult;
import com.flagship.credit_ledger.billing.PaymentGateway;
import com.flagship.credit_ledger.event.AutoTopUpFailedEvent;
import com.flagship.credit_ledger.event.CreditEventPublisher;
import com.flagship.credit_ledger.event.CreditsLowEvent;
import com.flagship.credit_ledger.ledger.CreditLedgerQueries;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Runs one automatic top-up for credits or the wallet.
 *
 * Order of checks:
 * 1. Balance still below the threshold
 * 2. Failure record (hard block, escalation, 24h soft cooldown)
 * 3. Successful automatic top-ups this calendar month against the cap
 * 4. A stored payment method
 *
 * The charge idempotency key depends on the month and the count so far, never
 * on wall-clock time: concurrent triggers collapse into one provider charge and
 * a failed attempt cannot be retried under a fresh key. The card suffix gives
 * a replaced card its own key.
 */
@Component
@Slf4j
public class AutoTopUpEngine {

    /** Recorded when the provider call itself fails; classified as soft. */
    static final String CHARGE_ERROR_CODE = "processing_error";

    private final TopUpFailureRepository failureRepository;
    private final CreditLedgerQueries ledgerQueries;
    private final PaymentGateway paymentGateway;
    private final TopUpFulfillment fulfillment;
    private final CreditEventPublisher eventPublisher;
    private final CreditMetrics metrics;
    private final Clock clock;

    public AutoTopUpEngine(TopUpFailureRepository failureRepository,
                           CreditLedgerQueries ledgerQueries,
                           PaymentGateway paymentGateway,
                           TopUpFulfillment fulfillment,
                           CreditEventPublisher eventPublisher,
                           CreditMetrics metrics,
                           Clock clock) {
        this.failureRepository = failureRepository;
        this.ledgerQueries = ledgerQueries;
        this.paymentGateway = paymentGateway;
        this.fulfillment = fulfillment;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    public AutoTopUpResult run(AutoTopUpAttempt attempt) {
        MDC.put(CorrelationContext.HOLDER_ID_MDC_KEY, attempt.getHolderId());
        MDC.put(CorrelationContext.CREDIT_KEY_MDC_KEY, attempt.getKey());
        try {
            AutoTopUpResult result = attemptTopUp(attempt);
            metrics.recordTopUpAttempt("auto", outcomeTag(result));
            return result;
        } finally {
            MDC.remove(CorrelationContext.HOLDER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CREDIT_KEY_MDC_KEY);
        }
    }

    private AutoTopUpResult attemptTopUp(AutoTopUpAttempt attempt) {
        if (attempt.getCurrentBalance() >= attempt.getThreshold()) {
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.BALANCE_ABOVE_THRESHOLD);
        }

        String paymentMethodId = attempt.getCustomer().getDefaultPaymentMethodId();
        TopUpFailure failure = failureRepository.find(attempt.getHolderId(), attempt.getKey()).orElse(null);
        if (failure != null && attempt.getCustomer().hasPaymentMethod() && failure.getPaymentMethodId() != null
                && !failure.getPaymentMethodId().equals(paymentMethodId)) {
            log.info("Default payment method changed since the last decline, clearing block");
            failureRepository.delete(attempt.getHolderId(), attempt.getKey());
            failure = null;
        }

        Instant now = clock.instant();
        AutoTopUpGate.Decision decision = AutoTopUpGate.evaluate(failure, now);
        if (!decision.isAllowed()) {
            log.info("Auto top-up blocked: trigger={}, failureCount={}, nextAttemptAt={}",
                    decision.getTrigger().value(), failure.getFailureCount(), decision.getNextAttemptAt());
            publishFailure(attempt, decision.getTrigger(), decision.getStatus(), decision.getNextAttemptAt(),
                    failure.getFailureCount(), failure.getDeclineCode());
            return decision.getTrigger() == AutoTopUpTrigger.WAITING_FOR_RETRY_COOLDOWN
                    ? AutoTopUpResult.skipped(AutoTopUpResult.Reason.IN_COOLDOWN, decision.getNextAttemptAt())
                    : AutoTopUpResult.skipped(AutoTopUpResult.Reason.DISABLED_HARD_DECLINE);
        }

        eventPublisher.publish(CreditsLowEvent.of(attempt.getHolderId(), attempt.getKey(),
                attempt.getCurrentBalance(), attempt.getThreshold()));

        int failureCount = failure != null ? failure.getFailureCount() : 0;
        YearMonth month = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        Instant monthStart = month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        int topUpsThisMonth = ledgerQueries.countAutoTopUpsSince(attempt.getHolderId(), attempt.getKey(), monthStart);
        if (topUpsThisMonth >= attempt.getMaxPerMonth()) {
            log.info("Auto top-up monthly limit reached: count={}, max={}", topUpsThisMonth, attempt.getMaxPerMonth());
            publishFailure(attempt, AutoTopUpTrigger.MONTHLY_LIMIT_REACHED, RetryStatus.WILL_RETRY, null,
                    failureCount, null);
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.MAX_PER_MONTH_REACHED);
        }

        if (!attempt.getCustomer().hasPaymentMethod()) {
            publishFailure(attempt, AutoTopUpTrigger.NO_PAYMENT_METHOD, RetryStatus.ACTION_REQUIRED, null,
                    failureCount, null);
            return AutoTopUpResult.skipped(AutoTopUpResult.Reason.NO_PAYMENT_METHOD);
        }

        String idempotencyKey = attempt.getChargeKeyStem() + "_" + month + "_" + (topUpsThisMonth + 1)
                + "_" + cardSuffix(paymentMethodId);
        ChargeRequest request = ChargeRequest.builder()
                .amount(attempt.getTotalCents())
                .currency(attempt.getCurrency())
                .customerId(attempt.getCustomer().getCustomerId())
                .paymentMethodId(paymentMethodId)
                .idempotencyKey(idempotencyKey)
                .description(attempt.getDescription())
                .metadataEntry(TopUpMetadata.KEY, attempt.getKey())
                .metadataEntry(TopUpMetadata.AMOUNT, String.valueOf(attempt.getPurchaseAmount()))
                .metadataEntry(TopUpMetadata.HOLDER_ID, attempt.getHolderId())
                .metadataEntry(TopUpMetadata.AUTO, "true")
                .build();

        ChargeResult charge;
        try {
            charge = metrics.timeCharge(() -> paymentGateway.createCharge(request));
        } catch (RuntimeException e) {
            log.error("Auto top-up charge errored: idempotencyKey={}", idempotencyKey, e);
            return recordChargeError(attempt, paymentMethodId, e);
        }

        switch (charge.getStatus()) {
            case SUCCEEDED:
                failureRepository.delete(attempt.getHolderId(), attempt.getKey());
                fulfillment.fulfill(attempt.getHolderId(), attempt.getKey(), attempt.getPurchaseAmount(),
                        charge.getChargeId(), true, attempt.getTotalCents(), attempt.getCurrency());
                log.info("Auto top-up succeeded: chargeId={}, amount={}", charge.getChargeId(),
                        attempt.getPurchaseAmount());
                return AutoTopUpResult.succeeded(charge.getChargeId());
            case PROCESSING:
                // the record is cleared when the webhook confirms the payment
                log.info("Auto top-up processing: chargeId={}", charge.getChargeId());
                return AutoTopUpResult.pending(charge.getChargeId());
            default:
                return recordDecline(attempt, paymentMethodId, charge);
        }
    }

    private AutoTopUpResult recordDecline(AutoTopUpAttempt attempt, String paymentMethodId, ChargeResult charge) {
        DeclineType declineType = DeclineClassifier.classify(charge.getDeclineCode());
        TopUpFailure recorded = failureRepository.recordFailure(attempt.getHolderId(), attempt.getKey(),
                paymentMethodId, declineType, charge.getDeclineCode());

        boolean actionRequired = recorded.requiresAction();
        Instant nextAttemptAt = actionRequired ? null : recorded.cooldownEndsAt();
        log.warn("Auto top-up declined: declineCode={}, declineType={}, failureCount={}, actionRequired={}",
                charge.getDeclineCode(), declineType.dbValue(), recorded.getFailureCount(), actionRequired);

        metrics.recordDecline(declineType.dbValue());
        publishFailure(attempt, AutoTopUpTrigger.STRIPE_DECLINED_PAYMENT,
                actionRequired ? RetryStatus.ACTION_REQUIRED : RetryStatus.WILL_RETRY,
                nextAttemptAt, recorded.getFailureCount(), charge.getDeclineCode());
        return AutoTopUpResult.failed(charge.getMessage(), charge.getDeclineCode(), declineType);
    }

    /**
     * A charge that errored instead of returning a status counts as a soft
     * decline, so it cools down and escalates like one.
     */
    private AutoTopUpResult recordChargeError(AutoTopUpAttempt attempt, String paymentMethodId, RuntimeException error) {
        TopUpFailure recorded = failureRepository.recordFailure(attempt.getHolderId(), attempt.getKey(),
                paymentMethodId, DeclineType.SOFT, CHARGE_ERROR_CODE);

        boolean actionRequired = recorded.requiresAction();
        Instant nextAttemptAt = actionRequired ? null : recorded.cooldownEndsAt();
        metrics.recordDecline(DeclineType.SOFT.dbValue());
        publishFailure(attempt, AutoTopUpTrigger.UNEXPECTED_ERROR,
                actionRequired ? RetryStatus.ACTION_REQUIRED : RetryStatus.WILL_RETRY,
                nextAttemptAt, recorded.getFailureCount(), CHARGE_ERROR_CODE);
        return AutoTopUpResult.failed(error.getMessage(), CHARGE_ERROR_CODE, DeclineType.SOFT);
    }

    private void publishFailure(AutoTopUpAttempt attempt, AutoTopUpTrigger trigger, RetryStatus status,
                                Instant nextAttemptAt, int failureCount, String declineCode) {
        eventPublisher.publish(new AutoTopUpFailedEvent(
                UUID.randomUUID(),
                attempt.getHolderId(),
                attempt.getCustomer().getCustomerId(),
                attempt.getKey(),
                trigger,
                status,
                nextAttemptAt,
                failureCount,
                declineCode,
                clock.instant()));
    }

    private static String cardSuffix(String paymentMethodId) {
        return paymentMethodId.length() <= 8 ? paymentMethodId : paymentMethodId.substring(paymentMethodId.length() - 8);
    }

    private static String outcomeTag(AutoTopUpResult result) {
        if (result.isTriggered()) {
            return Boolean.TRUE.equals(result.getCompleted()) ? "succeeded" : "pending";
        }
        return result.getReason().value();
    }
}
