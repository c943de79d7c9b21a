package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.billing.CheckoutSessionPayload;
import com.flagship.credit_ledger.billing.ChargeResult;
import com.flagship.credit_ledger.billing.PaymentIntentPayload;
import com.flagship.credit_ledger.credit.CreditController;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.credit.CreditService;
import com.flagship.credit_ledger.event.TopUpCompletedEvent;
import com.flagship.credit_ledger.support.CreditLedgerIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TopUpServiceTest extends CreditLedgerIntegrationTest {

    private static final String HOLDER = "user_topup";
    private static final String CUSTOMER = "cus_topup";

    @Autowired
    private TopUpService topUpService;

    @Autowired
    private TopUpFailureRepository failureRepository;

    @Autowired
    private CreditService creditService;

    @BeforeEach
    void setUpSubscriber() {
        givenCustomer(HOLDER, CUSTOMER, "pm_card_visa");
        givenSubscription("sub_topup", CUSTOMER, "price_pro_monthly", 1);
    }

    @Nested
    @DisplayName("On-demand purchases")
    class OnDemand {

        @Test
        @DisplayName("A successful charge grants the credits at the configured price")
        void success() {
            printTestHeader("On-demand top-up");

            // Given
            when(paymentGateway.createCharge(any())).thenReturn(ChargeResult.succeeded("pi_100"));

            // When
            TopUpResult result = topUpService.topUp(HOLDER, "api_calls", 1_000, "req-topup-1");
            printOutput("Result", result);

            // Then
            assertEquals(TopUpResult.Outcome.SUCCEEDED, result.getOutcome());
            assertEquals(1_000L, result.getBalance());
            assertEquals(2_000L, result.getChargedAmount());
            assertEquals("pi_100", result.getSourceId());
            assertEquals(1_000, creditService.getBalance(HOLDER, "api_calls"));
            assertEquals(1, countOutboxEvents(HOLDER, TopUpCompletedEvent.EVENT_TYPE));
            verify(paymentGateway).createCharge(argThat(charge ->
                    charge.getAmount() == 2_000
                            && "req-topup-1".equals(charge.getIdempotencyKey())
                            && "1000".equals(charge.getMetadata().get(TopUpMetadata.AMOUNT))));
            printSuccess("Charged 2000 cents for 1000 credits");
        }

        @Test
        @DisplayName("Purchase limits are enforced before charging")
        void limits() {
            TopUpResult tooSmall = topUpService.topUp(HOLDER, "api_calls", 99, null);
            TopUpResult tooLarge = topUpService.topUp(HOLDER, "api_calls", 100_001, null);
            TopUpResult notConfigured = topUpService.topUp(HOLDER, "exports", 10, null);
            TopUpResult negative = topUpService.topUp(HOLDER, "api_calls", -1, null);

            assertEquals(CreditErrorCode.INVALID_AMOUNT, tooSmall.getErrorCode());
            assertEquals("Minimum purchase is 100 credits", tooSmall.getMessage());
            assertEquals(CreditErrorCode.INVALID_AMOUNT, tooLarge.getErrorCode());
            assertEquals(CreditErrorCode.TOPUP_NOT_CONFIGURED, notConfigured.getErrorCode());
            assertEquals(CreditErrorCode.INVALID_AMOUNT, negative.getErrorCode());
            verify(paymentGateway, never()).createCharge(any());
        }

        @Test
        @DisplayName("Without a stored card the result carries a recovery checkout")
        void noPaymentMethod() {
            givenCustomer("user_nocard", "cus_nocard", null);
            givenSubscription("sub_nocard", "cus_nocard", "price_pro_monthly", 1);
            when(recoveryCheckout.createRecoveryUrl("cus_nocard", "api_calls", 500, 1_000, "usd"))
                    .thenReturn("https://checkout.example.test/c/1");

            TopUpResult result = topUpService.topUp("user_nocard", "api_calls", 500, null);

            assertEquals(CreditErrorCode.NO_PAYMENT_METHOD, result.getErrorCode());
            assertEquals("https://checkout.example.test/c/1", result.getRecoveryUrl());
            assertEquals(HttpStatus.PAYMENT_REQUIRED, CreditController.statusOf(result));
        }

        @Test
        @DisplayName("A declined charge is reported, not thrown, and grants nothing")
        void declined() {
            when(paymentGateway.createCharge(any()))
                    .thenReturn(ChargeResult.failed("ch_1", "card_declined", "Your card was declined."));
            when(recoveryCheckout.createRecoveryUrl(any(), any(), anyLong(), anyLong(), any()))
                    .thenThrow(new IllegalStateException("provider down"));

            TopUpResult result = topUpService.topUp(HOLDER, "api_calls", 500, null);

            assertEquals(CreditErrorCode.PAYMENT_FAILED, result.getErrorCode());
            assertEquals("Your card was declined.", result.getMessage());
            assertNull(result.getRecoveryUrl());
            assertEquals(0, creditService.getBalance(HOLDER, "api_calls"));
        }

        @Test
        @DisplayName("Holders without billing account or subscription are rejected")
        void missingAccount() {
            givenCustomer("user_lapsed", "cus_lapsed", "pm_card_visa");

            TopUpResult unknown = topUpService.topUp("user_ghost", "api_calls", 500, null);
            TopUpResult lapsed = topUpService.topUp("user_lapsed", "api_calls", 500, null);

            assertEquals(CreditErrorCode.USER_NOT_FOUND, unknown.getErrorCode());
            assertEquals(HttpStatus.NOT_FOUND, CreditController.statusOf(unknown));
            assertEquals(CreditErrorCode.NO_SUBSCRIPTION, lapsed.getErrorCode());
            assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, CreditController.statusOf(lapsed));
        }

        @Test
        @DisplayName("A processing charge answers pending and grants nothing yet")
        void processing() {
            when(paymentGateway.createCharge(any())).thenReturn(ChargeResult.processing("pi_ach"));

            TopUpResult result = topUpService.topUp(HOLDER, "api_calls", 500, null);

            assertEquals(TopUpResult.Outcome.PENDING, result.getOutcome());
            assertEquals(HttpStatus.ACCEPTED, CreditController.statusOf(result));
            assertEquals(0, creditService.getBalance(HOLDER, "api_calls"));
        }
    }

    @Nested
    @DisplayName("Webhooks")
    class Webhooks {

        private PaymentIntentPayload.PaymentIntentPayloadBuilder paymentIntent(String id) {
            return PaymentIntentPayload.builder()
                    .id(id)
                    .customerId(CUSTOMER)
                    .amount(1_000)
                    .currency("usd")
                    .metadataEntry(TopUpMetadata.KEY, "api_calls")
                    .metadataEntry(TopUpMetadata.AMOUNT, "500");
        }

        @Test
        @DisplayName("The inline grant and the payment webhook grant once together")
        void inlineThenWebhook() {
            printTestHeader("Duplicate fulfillment");

            when(paymentGateway.createCharge(any())).thenReturn(ChargeResult.succeeded("pi_dup"));
            topUpService.topUp(HOLDER, "api_calls", 500, null);

            topUpService.handlePaymentIntentSucceeded(paymentIntent("pi_dup").build());

            assertEquals(500, creditService.getBalance(HOLDER, "api_calls"));
            assertEquals(1, countLedgerEntries(HOLDER, "api_calls"));
            printSuccess("Second delivery was a no-op");
        }

        @Test
        @DisplayName("The holder is resolved from the customer when metadata omits it")
        void holderFromCustomer() {
            topUpService.handlePaymentIntentSucceeded(paymentIntent("pi_hook").build());

            assertEquals(500, creditService.getBalance(HOLDER, "api_calls"));
        }

        @Test
        @DisplayName("Payments without top-up metadata are ignored, malformed amounts are rejected")
        void metadataHandling() {
            topUpService.handlePaymentIntentSucceeded(PaymentIntentPayload.builder()
                    .id("pi_subscription_invoice")
                    .customerId(CUSTOMER)
                    .amount(2_000)
                    .currency("usd")
                    .build());

            CreditException e = assertThrows(CreditException.class, () ->
                    topUpService.handlePaymentIntentSucceeded(PaymentIntentPayload.builder()
                            .id("pi_bad")
                            .customerId(CUSTOMER)
                            .amount(1_000)
                            .currency("usd")
                            .metadataEntry(TopUpMetadata.KEY, "api_calls")
                            .metadataEntry(TopUpMetadata.AMOUNT, "12abc")
                            .build()));

            assertEquals(CreditErrorCode.MISSING_METADATA, e.getCode());
            assertEquals(0, countLedgerEntries(HOLDER, "api_calls"));
        }

        @Test
        @DisplayName("A paid recovery checkout grants and clears the block; an unpaid one does nothing")
        void checkoutCompleted() {
            failureRepository.recordFailure(HOLDER, "api_calls", "pm_card_visa", DeclineType.HARD, "expired_card");
            CheckoutSessionPayload.CheckoutSessionPayloadBuilder session = CheckoutSessionPayload.builder()
                    .id("cs_1")
                    .customerId(CUSTOMER)
                    .paymentIntentId("pi_checkout")
                    .amountTotal(1_000L)
                    .currency("usd")
                    .metadataEntry(TopUpMetadata.KEY, "api_calls")
                    .metadataEntry(TopUpMetadata.AMOUNT, "500");

            topUpService.handleTopUpCheckoutCompleted(session.paymentStatus("unpaid").build());
            assertEquals(0, creditService.getBalance(HOLDER, "api_calls"));

            topUpService.handleTopUpCheckoutCompleted(session.paymentStatus(CheckoutSessionPayload.PAID).build());
            topUpService.handlePaymentIntentSucceeded(paymentIntent("pi_checkout").build());

            assertEquals(500, creditService.getBalance(HOLDER, "api_calls"));
            assertTrue(topUpService.getAutoTopUpStatus(HOLDER, "api_calls").isEmpty());
        }
    }

    @Nested
    @DisplayName("Card changes")
    class CardChanges {

        @Test
        @DisplayName("A new default card clears every block of the holder")
        void newDefaultCard() {
            failureRepository.recordFailure(HOLDER, "api_calls", "pm_card_visa", DeclineType.HARD, "expired_card");
            failureRepository.recordFailure(HOLDER, "wallet", "pm_card_visa", DeclineType.SOFT, "insufficient_funds");

            topUpService.handleCustomerUpdated(CUSTOMER, "pm_card_new", "pm_card_visa");

            assertTrue(topUpService.getAutoTopUpStatus(HOLDER, "api_calls").isEmpty());
            assertTrue(topUpService.getAutoTopUpStatus(HOLDER, "wallet").isEmpty());
        }

        @Test
        @DisplayName("Without a reported change only records of other cards are dropped")
        void staleRecordsOnly() {
            failureRepository.recordFailure(HOLDER, "api_calls", "pm_card_visa", DeclineType.HARD, "expired_card");
            failureRepository.recordFailure(HOLDER, "wallet", "pm_card_old", DeclineType.HARD, "expired_card");

            topUpService.handleCustomerUpdated(CUSTOMER, "pm_card_visa", "pm_card_visa");

            assertTrue(topUpService.getAutoTopUpStatus(HOLDER, "api_calls").isPresent());
            assertTrue(topUpService.getAutoTopUpStatus(HOLDER, "wallet").isEmpty());
        }

        @Test
        @DisplayName("Manual unblock reports whether a record existed")
        void manualUnblock() {
            failureRepository.recordFailure(HOLDER, "api_calls", "pm_card_visa", DeclineType.HARD, "expired_card");

            assertTrue(topUpService.unblockAutoTopUp(HOLDER, "api_calls"));
            assertFalse(topUpService.unblockAutoTopUp(HOLDER, "api_calls"));
            assertEquals(0, topUpService.unblockAllAutoTopUps(HOLDER));
        }
    }
}
