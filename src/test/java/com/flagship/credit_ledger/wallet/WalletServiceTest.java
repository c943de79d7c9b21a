package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.billing.ChargeResult;
import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.event.TopUpCompletedEvent;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.support.CreditLedgerIntegrationTest;
import com.flagship.credit_ledger.topup.AutoTopUpResult;
import com.flagship.credit_ledger.topup.TopUpFulfillment;
import com.flagship.credit_ledger.topup.TopUpResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WalletServiceTest extends CreditLedgerIntegrationTest {

    private static final String HOLDER = "user_wallet";

    @Autowired
    private WalletService walletService;

    @Autowired
    private WalletTopUpService walletTopUpService;

    @Autowired
    private TopUpFulfillment topUpFulfillment;

    @Nested
    @DisplayName("Balance operations")
    class BalanceOperations {

        @Test
        @DisplayName("Adding funds fixes the wallet currency and formats the balance")
        void addFunds() {
            printTestHeader("Wallet add");

            WalletBalance balance = walletService.add(HOLDER, 1_000, "USD", null);
            printOutput("Balance", balance);

            assertEquals(0, new BigDecimal("1000").compareTo(balance.getCents()));
            assertEquals("$10.00", balance.getFormatted());
            assertEquals("usd", walletService.currencyOf(HOLDER));
            assertEquals(1_000_000, walletService.getBalanceMilliCents(HOLDER));
            printSuccess("Stored as milli-cents in usd");
        }

        @Test
        @DisplayName("A second currency is rejected")
        void currencyMismatch() {
            walletService.add(HOLDER, 1_000, "usd", null);

            CreditException e = assertThrows(CreditException.class,
                    () -> walletService.add(HOLDER, 500, "eur", null));

            assertEquals(CreditErrorCode.CURRENCY_MISMATCH, e.getCode());
            assertEquals(1_000_000, walletService.getBalanceMilliCents(HOLDER));
        }

        @Test
        @DisplayName("Spending succeeds while the balance covers it and leaves it untouched otherwise")
        void consume() {
            walletService.add(HOLDER, 1_000, "usd", null);

            WalletConsumeResult spent = walletService.consume(HOLDER, 250, "Image generation", null);
            WalletConsumeResult refused = walletService.consume(HOLDER, 800, "Video render", null);

            assertTrue(spent.isSuccess());
            assertEquals("$7.50", spent.getBalance().getFormatted());
            assertFalse(refused.isSuccess());
            assertEquals("$7.50", refused.getBalance().getFormatted());
        }

        @Test
        @DisplayName("A holder that never funded a wallet has no balance")
        void noWallet() {
            assertTrue(walletService.getBalance(HOLDER).isEmpty());
        }

        @Test
        @DisplayName("History reports cents with grants shown as adds")
        void history() {
            walletService.add(HOLDER, 1_000, "usd", LedgerMutation.of(TransactionSource.TOPUP));
            walletService.consume(HOLDER, 250, null, null);

            List<WalletEntry> history = walletService.getHistory(HOLDER, 10, 0);

            assertEquals(2, history.size());
            assertEquals("consume", history.get(0).getType());
            assertEquals(0, new BigDecimal("-250").compareTo(history.get(0).getCents()));
            assertEquals("add", history.get(1).getType());
            assertEquals("topup", history.get(1).getSource());
        }
    }

    @Nested
    @DisplayName("Wallet top-ups")
    class TopUps {

        @Test
        @DisplayName("Purchases are bounded by the plan's wallet limits")
        void limits() {
            givenCustomer(HOLDER, "cus_wallet", "pm_card_visa");
            givenSubscription("sub_wallet", "cus_wallet", "price_pro_monthly", 1);

            TopUpResult tooSmall = walletTopUpService.topUp(HOLDER, 499, null);
            TopUpResult tooLarge = walletTopUpService.topUp(HOLDER, 50_001, null);

            assertEquals("Minimum top-up is $5.00", tooSmall.getMessage());
            assertEquals("Maximum top-up is $500.00", tooLarge.getMessage());
            verify(paymentGateway, never()).createCharge(any());
        }

        @Test
        @DisplayName("Plans without a wallet section cannot top up")
        void notConfigured() {
            givenCustomer(HOLDER, "cus_wallet", "pm_card_visa");
            givenSubscription("sub_wallet", "cus_wallet", "price_starter_monthly", 1);

            TopUpResult result = walletTopUpService.topUp(HOLDER, 1_000, null);

            assertEquals(CreditErrorCode.TOPUP_NOT_CONFIGURED, result.getErrorCode());
        }

        @Test
        @DisplayName("A successful charge adds the cents to the wallet")
        void topUp() {
            givenCustomer(HOLDER, "cus_wallet", "pm_card_visa");
            givenSubscription("sub_wallet", "cus_wallet", "price_pro_monthly", 1);
            when(paymentGateway.createCharge(any())).thenReturn(ChargeResult.succeeded("pi_wallet"));

            TopUpResult result = walletTopUpService.topUp(HOLDER, 2_000, "wallet-req-1");

            assertEquals(TopUpResult.Outcome.SUCCEEDED, result.getOutcome());
            assertEquals(2_000L, result.getBalance());
            assertEquals(2_000_000, walletService.getBalanceMilliCents(HOLDER));
            Integer keyed = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM billing.credit_ledger WHERE idempotency_key = 'wallet_topup_pi_wallet'",
                    Integer.class);
            assertEquals(1, keyed);
        }

        @Test
        @DisplayName("Falling below the threshold in cents triggers an automatic wallet top-up")
        void autoTopUp() {
            printTestHeader("Wallet auto top-up");

            givenCustomer(HOLDER, "cus_wallet", "pm_card_visa");
            givenSubscription("sub_wallet", "cus_wallet", "price_pro_monthly", 1);
            walletService.add(HOLDER, 300, "usd", null);
            walletService.consume(HOLDER, 150, null, null);
            when(paymentGateway.createCharge(any())).thenReturn(ChargeResult.succeeded("pi_wallet_auto"));

            AutoTopUpResult result = walletTopUpService.triggerAutoTopUpIfNeeded(HOLDER);
            printOutput("Result", result);

            assertTrue(result.isTriggered());
            assertEquals(1_150_000, walletService.getBalanceMilliCents(HOLDER));
            String month = YearMonth.now(clock.withZone(ZoneOffset.UTC)).toString();
            verify(paymentGateway).createCharge(argThat(charge -> charge.getAmount() == 1_000
                    && ("wallet_auto_topup_" + HOLDER + "_" + month + "_1_ard_visa").equals(charge.getIdempotencyKey())));
            printSuccess("Wallet refilled by $10.00");
        }

        @Test
        @DisplayName("A wallet held in another currency is refused before any charge")
        void currencyMismatchBeforeCharge() {
            printTestHeader("Wallet top-up currency mismatch");

            // Given: a eur wallet under a usd subscription
            givenCustomer(HOLDER, "cus_wallet", "pm_card_visa");
            givenSubscription("sub_wallet", "cus_wallet", "price_pro_monthly", 1);
            walletService.add(HOLDER, 1_000, "eur", null);

            // When
            TopUpResult manual = walletTopUpService.topUp(HOLDER, 2_000, "wallet-req-eur");
            AutoTopUpResult automatic = walletTopUpService.triggerAutoTopUpIfNeeded(HOLDER);
            printOutput("Manual", manual);
            printOutput("Automatic", automatic);

            // Then
            assertEquals(CreditErrorCode.CURRENCY_MISMATCH, manual.getErrorCode());
            assertEquals(AutoTopUpResult.Reason.CURRENCY_MISMATCH, automatic.getReason());
            assertEquals(1_000_000, walletService.getBalanceMilliCents(HOLDER));
            verify(paymentGateway, never()).createCharge(any());
            printSuccess("No charge was attempted");
        }

        @Test
        @DisplayName("A paid wallet top-up in the wrong currency is logged and leaves the balance alone")
        void currencyMismatchAfterPayment() {
            walletService.add(HOLDER, 1_000, "eur", null);

            long balance = topUpFulfillment.fulfill(HOLDER, WalletService.WALLET_KEY, 2_000, "pi_wallet_usd",
                    false, 2_000, "usd");

            assertEquals(1_000_000, balance);
            assertEquals(1_000_000, walletService.getBalanceMilliCents(HOLDER));
            assertEquals(0, countOutboxEvents(HOLDER, TopUpCompletedEvent.EVENT_TYPE));
        }
    }
}
