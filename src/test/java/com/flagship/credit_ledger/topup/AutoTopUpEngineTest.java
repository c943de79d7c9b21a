package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.billing.ChargeRequest;
import com.flagship.credit_ledger.billing.ChargeResult;
import com.flagship.credit_ledger.billing.PaymentGatewayException;
import com.flagship.credit_ledger.billing.PaymentIntentPayload;
import com.flagship.credit_ledger.credit.CreditService;
import com.flagship.credit_ledger.event.AutoTopUpFailedEvent;
import com.flagship.credit_ledger.event.CreditsLowEvent;
import com.flagship.credit_ledger.event.TopUpCompletedEvent;
import com.flagship.credit_ledger.support.CreditLedgerIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.YearMonth;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Automatic top-ups for credit keys, driven through {@link AutoTopUpService}
 * against a stubbed payment provider.
 */
class AutoTopUpEngineTest extends CreditLedgerIntegrationTest {

    private static final String HOLDER = "user_auto";
    private static final String KEY = "api_calls";

    @Autowired
    private AutoTopUpService autoTopUpService;

    @Autowired
    private TopUpService topUpService;

    @Autowired
    private CreditService creditService;

    @BeforeEach
    void setUpSubscriber() {
        givenCustomer(HOLDER, "cus_auto", "pm_card_visa_4242");
        givenSubscription("sub_auto", "cus_auto", "price_pro_monthly", 1);
    }

    private AutoTopUpResult triggerAtBalance(long balance) {
        return autoTopUpService.triggerAutoTopUpIfNeeded(HOLDER, KEY, balance);
    }

    @Nested
    @DisplayName("Preconditions")
    class Preconditions {

        @Test
        @DisplayName("Nothing happens while the balance is at or above the threshold")
        void aboveThreshold() {
            AutoTopUpResult result = triggerAtBalance(500);

            assertFalse(result.isTriggered());
            assertEquals(AutoTopUpResult.Reason.BALANCE_ABOVE_THRESHOLD, result.getReason());
            verify(paymentGateway, never()).createCharge(any());
        }

        @Test
        @DisplayName("Keys without a price or auto top-up settings are not configured")
        void notConfigured() {
            AutoTopUpResult result = autoTopUpService.triggerAutoTopUpIfNeeded(HOLDER, "exports", 0);

            assertEquals(AutoTopUpResult.Reason.NOT_CONFIGURED, result.getReason());
            verify(paymentGateway, never()).createCharge(any());
        }

        @Test
        @DisplayName("A customer without a card gets an action-required event and no charge")
        void noPaymentMethod() {
            givenCustomer("user_nocard", "cus_nocard", null);
            givenSubscription("sub_nocard", "cus_nocard", "price_pro_monthly", 1);

            AutoTopUpResult result = autoTopUpService.triggerAutoTopUpIfNeeded("user_nocard", KEY, 10);

            assertEquals(AutoTopUpResult.Reason.NO_PAYMENT_METHOD, result.getReason());
            assertEquals(1, countOutboxEvents("user_nocard", CreditsLowEvent.EVENT_TYPE));
            assertEquals(1, countOutboxEvents("user_nocard", AutoTopUpFailedEvent.EVENT_TYPE));
            verify(paymentGateway, never()).createCharge(any());
        }
    }

    @Test
    @DisplayName("A successful charge grants the configured amount with a month-scoped key")
    void successfulTopUp() {
        printTestHeader("Auto top-up success");

        // Given
        creditService.grant(HOLDER, KEY, 100, null);
        when(paymentGateway.createCharge(any())).thenReturn(ChargeResult.succeeded("pi_auto_1"));

        // When
        AutoTopUpResult result = triggerAtBalance(100);
        printOutput("Result", result);

        // Then
        assertTrue(result.isTriggered());
        assertEquals(Boolean.TRUE, result.getCompleted());
        assertEquals(5_100, creditService.getBalance(HOLDER, KEY));

        ArgumentCaptor<ChargeRequest> captor = ArgumentCaptor.forClass(ChargeRequest.class);
        verify(paymentGateway).createCharge(captor.capture());
        ChargeRequest charge = captor.getValue();
        YearMonth month = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        assertEquals(10_000, charge.getAmount());
        assertEquals("pm_card_visa_4242", charge.getPaymentMethodId());
        assertEquals("auto_topup_" + HOLDER + "_" + KEY + "_" + month + "_1_" + "isa_4242", charge.getIdempotencyKey());
        assertEquals("true", charge.getMetadata().get(TopUpMetadata.AUTO));

        assertEquals(1, countOutboxEvents(HOLDER, CreditsLowEvent.EVENT_TYPE));
        assertEquals(1, countOutboxEvents(HOLDER, TopUpCompletedEvent.EVENT_TYPE));
        printSuccess("Charged once and granted 5000 credits");
    }

    @Test
    @DisplayName("Soft declines cool down for 24 hours and escalate on the third")
    void softDeclineEscalation() {
        printTestHeader("Soft decline escalation");

        when(paymentGateway.createCharge(any()))
                .thenReturn(ChargeResult.failed("ch_1", "insufficient_funds", "Your card has insufficient funds."));

        // First decline starts the cooldown
        AutoTopUpResult first = triggerAtBalance(10);
        assertEquals(AutoTopUpResult.Reason.PAYMENT_FAILED, first.getReason());
        assertEquals(DeclineType.SOFT, first.getDeclineType());

        AutoTopUpResult cooling = triggerAtBalance(10);
        printOutput("During cooldown", cooling);
        assertEquals(AutoTopUpResult.Reason.IN_COOLDOWN, cooling.getReason());
        assertNotNull(cooling.getRetriesAt());

        // Second and third declines after each cooldown
        clock.advance(Duration.ofHours(25));
        triggerAtBalance(10);
        clock.advance(Duration.ofHours(25));
        triggerAtBalance(10);

        TopUpFailure failure = topUpService.getAutoTopUpStatus(HOLDER, KEY).orElseThrow();
        printOutput("Failure record", failure);
        assertEquals(3, failure.getFailureCount());
        assertEquals(DeclineType.SOFT, failure.getDeclineType());
        assertTrue(failure.requiresAction());

        clock.advance(Duration.ofHours(25));
        AutoTopUpResult blocked = triggerAtBalance(10);
        assertEquals(AutoTopUpResult.Reason.DISABLED_HARD_DECLINE, blocked.getReason());
        verify(paymentGateway, times(3)).createCharge(any());
        printSuccess("Blocked after three soft declines");
    }

    @Test
    @DisplayName("A hard decline blocks until the default card changes")
    void hardDeclineUntilCardChange() {
        printTestHeader("Hard decline");

        when(paymentGateway.createCharge(any()))
                .thenReturn(ChargeResult.failed("ch_1", "expired_card", "Your card has expired."))
                .thenReturn(ChargeResult.succeeded("pi_new_card"));

        AutoTopUpResult declined = triggerAtBalance(10);
        assertEquals(DeclineType.HARD, declined.getDeclineType());

        clock.advance(Duration.ofDays(3));
        AutoTopUpResult stillBlocked = triggerAtBalance(10);
        assertEquals(AutoTopUpResult.Reason.DISABLED_HARD_DECLINE, stillBlocked.getReason());

        // When the customer saves a new card
        changeDefaultPaymentMethod(HOLDER, "pm_card_mastercard_4444");
        AutoTopUpResult recovered = triggerAtBalance(10);

        // Then
        assertTrue(recovered.isTriggered());
        assertTrue(topUpService.getAutoTopUpStatus(HOLDER, KEY).isEmpty());
        assertEquals(5_000, creditService.getBalance(HOLDER, KEY));
        printSuccess("New card cleared the block");
    }

    @Test
    @DisplayName("A charge that errors cools down like a soft decline")
    void chargeErrorCoolsDown() {
        printTestHeader("Charge error");

        // Given
        when(paymentGateway.createCharge(any())).thenThrow(new PaymentGatewayException("api down"));

        // When
        AutoTopUpResult errored = triggerAtBalance(10);
        printOutput("Result", errored);
        AutoTopUpResult retried = triggerAtBalance(10);

        // Then
        assertEquals(AutoTopUpResult.Reason.PAYMENT_FAILED, errored.getReason());
        assertEquals(DeclineType.SOFT, errored.getDeclineType());
        assertEquals(AutoTopUpEngine.CHARGE_ERROR_CODE, errored.getDeclineCode());
        assertEquals(AutoTopUpResult.Reason.IN_COOLDOWN, retried.getReason());

        TopUpFailure failure = topUpService.getAutoTopUpStatus(HOLDER, KEY).orElseThrow();
        assertEquals(1, failure.getFailureCount());
        assertEquals(AutoTopUpEngine.CHARGE_ERROR_CODE, failure.getDeclineCode());
        verify(paymentGateway, times(1)).createCharge(any());
        printSuccess("One charge attempt, the retry waited for the cooldown");
    }

    @Test
    @DisplayName("The monthly cap counts successful automatic top-ups")
    void monthlyCap() {
        when(paymentGateway.createCharge(any()))
                .thenReturn(ChargeResult.succeeded("pi_cap_1"))
                .thenReturn(ChargeResult.succeeded("pi_cap_2"));

        triggerAtBalance(10);
        triggerAtBalance(10);
        AutoTopUpResult third = triggerAtBalance(10);

        assertEquals(AutoTopUpResult.Reason.MAX_PER_MONTH_REACHED, third.getReason());
        assertEquals(10_000, creditService.getBalance(HOLDER, KEY));
        verify(paymentGateway, times(2)).createCharge(any());
    }

    @Test
    @DisplayName("A processing charge grants once when the payment webhook arrives")
    void processingThenWebhook() {
        when(paymentGateway.createCharge(any())).thenReturn(ChargeResult.processing("pi_slow"));

        AutoTopUpResult result = triggerAtBalance(10);

        assertTrue(result.isTriggered());
        assertEquals(Boolean.FALSE, result.getCompleted());
        assertEquals(0, creditService.getBalance(HOLDER, KEY));

        PaymentIntentPayload webhook = PaymentIntentPayload.builder()
                .id("pi_slow")
                .customerId("cus_auto")
                .amount(10_000)
                .currency("usd")
                .metadataEntry(TopUpMetadata.KEY, KEY)
                .metadataEntry(TopUpMetadata.AMOUNT, "5000")
                .metadataEntry(TopUpMetadata.HOLDER_ID, HOLDER)
                .metadataEntry(TopUpMetadata.AUTO, "true")
                .build();
        topUpService.handlePaymentIntentSucceeded(webhook);
        topUpService.handlePaymentIntentSucceeded(webhook);

        assertEquals(5_000, creditService.getBalance(HOLDER, KEY));
        Integer autoEntries = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM billing.credit_ledger WHERE holder_id = ? AND source = 'auto_topup'",
                Integer.class, HOLDER);
        assertEquals(1, autoEntries);
    }
}
