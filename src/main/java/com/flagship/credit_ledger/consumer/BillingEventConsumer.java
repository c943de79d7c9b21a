package com.flagship.credit_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Kafka consumer for normalized billing provider events.
 *
 * Offsets are committed manually after the event was handled. A failing
 * handler leaves the offset alone so the event is redelivered; events that can
 * never succeed (unparseable, missing fields) are acknowledged and logged.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BillingEventConsumer {

    public static final String CONSUMER_GROUP = "credit-ledger-billing";

    private final IdempotentEventProcessor eventProcessor;
    private final BillingEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.billing-events:billing-events}",
        groupId = "${spring.kafka.consumer.group-id:credit-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationIdOf(record));
        try {
            log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                    record.topic(), record.partition(), record.offset(), record.key());

            BillingEvent event = parseEvent(record.value());
            if (event == null) {
                log.warn("Could not parse billing event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            boolean processed = route(event);
            ack.acknowledge();
            if (processed) {
                log.info("Processed billing event: type={}, eventId={}, aggregateId={}",
                        event.getType(), event.getEventId(), event.aggregateId());
            }
        } catch (IllegalArgumentException e) {
            log.error("Malformed billing event at offset {}, acknowledging to skip: {}",
                    record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing billing event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    boolean route(BillingEvent event) {
        if (!isKnownType(event.getType())) {
            eventProcessor.skipEvent(event, CONSUMER_GROUP, "Unknown event type");
            return false;
        }
        return eventProcessor.processEvent(event, CONSUMER_GROUP, () -> eventHandler.handle(event));
    }

    private static boolean isKnownType(String type) {
        if (type == null) {
            return false;
        }
        switch (type) {
            case BillingEvent.SUBSCRIPTION_CREATED:
            case BillingEvent.SUBSCRIPTION_RENEWED:
            case BillingEvent.SUBSCRIPTION_CANCELLED:
            case BillingEvent.SUBSCRIPTION_PLAN_CHANGED:
            case BillingEvent.SUBSCRIPTION_DOWNGRADE_APPLIED:
            case BillingEvent.PAYMENT_INTENT_SUCCEEDED:
            case BillingEvent.CHECKOUT_SESSION_COMPLETED:
            case BillingEvent.CUSTOMER_UPDATED:
                return true;
            default:
                return false;
        }
    }

    private BillingEvent parseEvent(String json) {
        try {
            BillingEvent event = objectMapper.readValue(json, BillingEvent.class);
            if (event.getEventId() == null || event.getType() == null) {
                log.error("Billing event without eventId or type: {}", json);
                return null;
            }
            return event;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse billing event: {}", e.getMessage());
            return null;
        }
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        String candidate = header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
        return CorrelationContext.orGenerate(candidate);
    }
}
