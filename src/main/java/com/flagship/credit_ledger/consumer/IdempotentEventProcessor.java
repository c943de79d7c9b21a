package com.flagship.credit_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs a billing event handler at most once per consumer group.
 *
 * Deliberately not transactional: the handlers commit their ledger mutations
 * one by one, and the event is recorded only after all of them succeeded. A
 * crash in between is covered by the ledger idempotency keys, which make the
 * redelivered handler a no-op for the parts already done.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private static final Set<ProcessedEvent.ProcessingResult> DONE =
        EnumSet.of(ProcessedEvent.ProcessingResult.SUCCESS, ProcessedEvent.ProcessingResult.SKIPPED);

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    public boolean processEvent(BillingEvent event, String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(event.getEventId(), consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    event.getEventId(), consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            recordProcessed(ProcessedEvent.failed(
                event.getEventId(), event.getType(), event.aggregateType(), event.aggregateId(),
                consumerGroup, e.getMessage()
            ));
            log.error("Failed to process event {} by consumer group {}: {}",
                    event.getEventId(), consumerGroup, e.getMessage(), e);
            throw e;
        }

        recordProcessed(ProcessedEvent.success(
            event.getEventId(), event.getType(), event.aggregateType(), event.aggregateId(), consumerGroup
        ));
        log.debug("Successfully processed event {} by consumer group {}", event.getEventId(), consumerGroup);
        return true;
    }

    /**
     * Marks an event this consumer has no use for, so it is not looked at again.
     */
    public void skipEvent(BillingEvent event, String consumerGroup, String reason) {
        if (isAlreadyProcessed(event.getEventId(), consumerGroup)) {
            return;
        }
        recordProcessed(ProcessedEvent.skipped(
            event.getEventId(), event.getType(), event.aggregateType(), event.aggregateId(),
            consumerGroup, reason
        ));
        log.debug("Skipped event {} by consumer group {}: {}", event.getEventId(), consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(String eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroupAndProcessingResultIn(eventId, consumerGroup, DONE);
    }

    /**
     * Everything recorded for one provider object, oldest first.
     */
    public List<ProcessedEvent> getProcessingHistory(String aggregateType, String aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(aggregateType, aggregateId)
            .stream()
            .map(ProcessedEventEntity::toDomain)
            .collect(Collectors.toList());
    }

    /**
     * Events whose last attempt failed and that have not succeeded since.
     */
    public long countFailed(String consumerGroup) {
        return repository.countFailedByConsumerGroup(consumerGroup);
    }

    private void recordProcessed(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
