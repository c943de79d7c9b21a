package com.flagship.credit_ledger.outbox;

import com.flagship.credit_ledger.credit.CreditService;
import com.flagship.credit_ledger.event.CreditsGrantedEvent;
import com.flagship.credit_ledger.event.CreditsRevokedEvent;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.support.CreditLedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Outbox rows written alongside ledger mutations, and the bookkeeping the
 * publisher relies on.
 */
class OutboxServiceTest extends CreditLedgerIntegrationTest {

    private static final String HOLDER = "user_outbox";

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private CreditService creditService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("Events keep the order of the mutations that produced them")
    void eventsInMutationOrder() {
        printTestHeader("Outbox Ordering");

        // Given
        creditService.grant(HOLDER, "api_calls", 100, null);
        creditService.revoke(HOLDER, "api_calls", 40, null);

        // When
        List<OutboxEvent> events = outboxService.getEventsForHolder(HOLDER);

        // Then
        assertEquals(2, events.size());
        assertEquals(CreditsGrantedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertEquals(CreditsRevokedEvent.EVENT_TYPE, events.get(1).getEventType());
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());
        assertTrue(events.get(0).getPayload().contains(HOLDER));
        assertFalse(events.get(0).isPublished());
        printSuccess("events stored in order with holder as aggregate id");
    }

    @Test
    @DisplayName("An event cannot be saved outside a transaction")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () ->
                outboxService.saveEvent("CreditHolder", HOLDER, "CreditsGranted", "{}"));
    }

    @Test
    @DisplayName("A rolled back mutation leaves no event behind")
    void rollbackDropsEvent() {
        // Given: a grant followed by a failing statement in the same transaction
        assertThrows(DataIntegrityViolationException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            creditService.grant(HOLDER, "api_calls", 100, LedgerMutation.builder().idempotencyKey("rolled-back").build());
            jdbcTemplate.update("INSERT INTO billing.billing_customers (holder_id, customer_id) VALUES (NULL, NULL)");
        }));

        // Then
        assertEquals(0, countOutboxEvents(HOLDER, CreditsGrantedEvent.EVENT_TYPE));
        assertEquals(0, creditService.getBalance(HOLDER, "api_calls"));
    }

    @Test
    @DisplayName("Published events leave the backlog and failures count retries")
    void publishBookkeeping() {
        creditService.grant(HOLDER, "api_calls", 10, null);
        creditService.grant(HOLDER, "exports", 5, null);

        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10);
        assertEquals(2, pending.size());
        assertEquals(2, outboxEventRepository.countUnpublished());

        outboxService.markPublished(pending.get(0).getId());
        outboxService.markFailed(pending.get(1).getId(), "broker unavailable");
        outboxService.markFailed(pending.get(1).getId(), "broker unavailable");

        assertEquals(1, outboxEventRepository.countUnpublished());
        OutboxEventEntity failed = outboxEventRepository.findById(pending.get(1).getId()).orElseThrow();
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());
        assertNotNull(outboxEventRepository.findById(pending.get(0).getId()).orElseThrow().getPublishedAt());
        assertEquals(1, outboxEventRepository.countByRetryCountGreaterThanEqual(2));
    }
}
