package com.flagship.credit_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, String> {

    /**
     * Primary deduplication check. FAILED rows are not passed in, so a failed
     * event is handled again on redelivery.
     */
    boolean existsByEventIdAndConsumerGroupAndProcessingResultIn(
        String eventId, String consumerGroup, Collection<ProcessedEvent.ProcessingResult> results);

    List<ProcessedEventEntity> findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(
        String aggregateType, String aggregateId);

    @Query("""
        SELECT COUNT(e) FROM ProcessedEventEntity e
        WHERE e.consumerGroup = :consumerGroup
        AND e.processingResult = 'FAILED'
        """)
    long countFailedByConsumerGroup(@Param("consumerGroup") String consumerGroup);
}
