package com.flagship.credit_ledger.event;

import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes credit events to the outbox. Joins the caller's transaction when there
 * is one, so an event exists if and only if its ledger mutation committed.
 */
@Service
@RequiredArgsConstructor
public class CreditEventPublisher {

    public static final String AGGREGATE_TYPE = "CreditHolder";

    private final OutboxService outboxService;

    @Transactional
    public void publish(CreditEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, event.getHolderId(), event.getEventType(), event);
    }
}
