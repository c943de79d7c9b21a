package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.event.CreditsGrantedEvent;
import com.flagship.credit_ledger.event.CreditsRevokedEvent;
import com.flagship.credit_ledger.ledger.ConsumeResult;
import com.flagship.credit_ledger.ledger.LedgerEntry;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.ledger.TransactionType;
import com.flagship.credit_ledger.support.CreditLedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CreditServiceTest extends CreditLedgerIntegrationTest {

    private static final String HOLDER = "user_service";

    @Autowired
    private CreditService creditService;

    @Nested
    @DisplayName("Amount validation")
    class Validation {

        @Test
        @DisplayName("Zero and negative amounts are rejected before touching the ledger")
        void nonPositiveAmounts() {
            for (long amount : new long[]{0, -5}) {
                CreditException grant = assertThrows(CreditException.class,
                        () -> creditService.grant(HOLDER, "api_calls", amount, null));
                CreditException consume = assertThrows(CreditException.class,
                        () -> creditService.consume(HOLDER, "api_calls", amount, null));
                CreditException revoke = assertThrows(CreditException.class,
                        () -> creditService.revoke(HOLDER, "api_calls", amount, null));

                assertEquals(CreditErrorCode.INVALID_AMOUNT, grant.getCode());
                assertEquals(CreditErrorCode.INVALID_AMOUNT, consume.getCode());
                assertEquals(CreditErrorCode.INVALID_AMOUNT, revoke.getCode());
            }
            assertEquals(0, countLedgerEntries(HOLDER, "api_calls"));
        }

        @Test
        @DisplayName("Setting a negative balance is rejected, zero is allowed")
        void setBalanceBounds() {
            creditService.grant(HOLDER, "api_calls", 10, null);

            CreditException e = assertThrows(CreditException.class,
                    () -> creditService.setBalance(HOLDER, "api_calls", -1, null));
            SetBalanceResult result = creditService.setBalance(HOLDER, "api_calls", 0, null);

            assertEquals(CreditErrorCode.INVALID_AMOUNT, e.getCode());
            assertEquals(10, result.getPreviousBalance());
            assertEquals(0, creditService.getBalance(HOLDER, "api_calls"));
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("Replaying a grant key is rejected by the pre-check")
        void replayedGrant() {
            printTestHeader("Replayed grant");

            LedgerMutation mutation = LedgerMutation.builder().idempotencyKey("req-1").build();
            creditService.grant(HOLDER, "api_calls", 100, mutation);

            CreditException e = assertThrows(CreditException.class,
                    () -> creditService.grant(HOLDER, "api_calls", 250, mutation));

            assertEquals(CreditErrorCode.IDEMPOTENCY_CONFLICT, e.getCode());
            assertEquals(100, creditService.getBalance(HOLDER, "api_calls"));
            assertEquals(1, countOutboxEvents(HOLDER, CreditsGrantedEvent.EVENT_TYPE));
            printSuccess("Replay with another amount rejected, one event in the outbox");
        }

        @Test
        @DisplayName("Keys seen in Redis short-circuit without a ledger lookup")
        void redisHit() {
            when(redisTemplate.hasKey(eq("credit-idempotency:cached-key"))).thenReturn(true);

            CreditException e = assertThrows(CreditException.class,
                    () -> creditService.grant(HOLDER, "api_calls", 5,
                            LedgerMutation.builder().idempotencyKey("cached-key").build()));

            assertEquals(CreditErrorCode.IDEMPOTENCY_CONFLICT, e.getCode());
            assertEquals(0, countLedgerEntries(HOLDER, "api_calls"));
        }

        @Test
        @DisplayName("A committed key is remembered in Redis")
        void keyCachedAfterCommit() {
            creditService.grant(HOLDER, "api_calls", 5,
                    LedgerMutation.builder().idempotencyKey("fresh-key").build());

            verify(valueOperations).set(eq("credit-idempotency:fresh-key"), eq("1"), any(Duration.class));
        }

        @Test
        @DisplayName("A failed consume keeps its key usable")
        void insufficientConsumeDoesNotBurnKey() {
            LedgerMutation mutation = LedgerMutation.builder().idempotencyKey("consume-1").build();

            ConsumeResult first = creditService.consume(HOLDER, "api_calls", 10, mutation);
            creditService.grant(HOLDER, "api_calls", 10, null);
            ConsumeResult second = creditService.consume(HOLDER, "api_calls", 10, mutation);

            assertFalse(first.isSuccess());
            assertTrue(second.isSuccess());
            assertEquals(0, second.getBalance());
        }
    }

    @Nested
    @DisplayName("Events")
    class Events {

        @Test
        @DisplayName("Grants and revokes write their events to the outbox, consumes do not")
        void mutationsPublishEvents() {
            creditService.grant(HOLDER, "api_calls", 100, null);
            creditService.consume(HOLDER, "api_calls", 10, null);
            creditService.revoke(HOLDER, "api_calls", 20, null);

            assertEquals(1, countOutboxEvents(HOLDER, CreditsGrantedEvent.EVENT_TYPE));
            assertEquals(1, countOutboxEvents(HOLDER, CreditsRevokedEvent.EVENT_TYPE));
            Integer total = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM billing.outbox_events WHERE aggregate_id = ?", Integer.class, HOLDER);
            assertEquals(2, total);
        }

        @Test
        @DisplayName("Setting a lower balance publishes a revoke for the difference")
        void setBalancePublishesDirection() {
            creditService.grant(HOLDER, "api_calls", 100, null);

            creditService.setBalance(HOLDER, "api_calls", 40, null);

            assertEquals(1, countOutboxEvents(HOLDER, CreditsRevokedEvent.EVENT_TYPE));
            Long revoked = jdbcTemplate.queryForObject(
                    "SELECT (payload->>'amount')::bigint FROM billing.outbox_events WHERE aggregate_id = ? AND event_type = ?",
                    Long.class, HOLDER, CreditsRevokedEvent.EVENT_TYPE);
            assertEquals(60L, revoked);
        }
    }

    @Test
    @DisplayName("revokeAllForHolder empties every balance and suffixes the key per credit type")
    void revokeAllForHolder() {
        printTestHeader("Revoke all for holder");

        // Given
        creditService.grant(HOLDER, "api_calls", 100, null);
        creditService.grant(HOLDER, "exports", 7, null);

        // When
        Map<String, RevokeAllResult> results = creditService.revokeAllForHolder(HOLDER,
                LedgerMutation.builder()
                        .source(TransactionSource.CANCELLATION)
                        .idempotencyKey("cancel_sub_1")
                        .build());
        printOutput("Results", results);

        // Then
        assertEquals(100, results.get("api_calls").getAmountRevoked());
        assertEquals(7, results.get("exports").getAmountRevoked());
        assertEquals(Map.of("api_calls", 0L, "exports", 0L), creditService.getAllBalances(HOLDER));
        Integer suffixed = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM billing.credit_ledger WHERE idempotency_key IN ('cancel_sub_1:api_calls', 'cancel_sub_1:exports')",
                Integer.class);
        assertEquals(2, suffixed);
        printSuccess("Both balances revoked under per-key idempotency keys");
    }

    @Test
    @DisplayName("History is newest first and can span every credit type")
    void historyAcrossKeys() {
        creditService.grant(HOLDER, "api_calls", 100, null);
        creditService.grant(HOLDER, "exports", 3, null);
        creditService.consume(HOLDER, "api_calls", 1, null);

        List<LedgerEntry> all = creditService.getHistory(HOLDER, null, 10, 0);
        List<LedgerEntry> apiCalls = creditService.getHistory(HOLDER, "api_calls", 1, 0);

        assertEquals(3, all.size());
        assertEquals(TransactionType.CONSUME, all.get(0).getTransactionType());
        assertEquals(1, apiCalls.size());
        assertEquals(-1, apiCalls.get(0).getAmount());
        assertTrue(creditService.hasCredits(HOLDER, "api_calls", 99));
        assertFalse(creditService.hasCredits(HOLDER, "api_calls", 100));
    }
}
