package com.flagship.credit_ledger.observability;

import com.flagship.credit_ledger.consumer.BillingEventConsumer;
import com.flagship.credit_ledger.consumer.IdempotentEventProcessor;
import com.flagship.credit_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health checks beyond the ones Spring Boot ships.
 */
public class HealthIndicators {

    /**
     * Degrades as undelivered credit events pile up.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
                return builder.withDetail("backlogSize", backlogSize).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", String.valueOf(e.getMessage())).build();
            }
        }
    }

    /**
     * Billing events whose handler keeps failing. Each one is a subscription or
     * payment whose credits are not applied yet.
     */
    @Component("billingEventsHealth")
    public static class BillingEventsHealthIndicator implements HealthIndicator {

        private final IdempotentEventProcessor eventProcessor;

        public BillingEventsHealthIndicator(IdempotentEventProcessor eventProcessor) {
            this.eventProcessor = eventProcessor;
        }

        @Override
        public Health health() {
            try {
                long failed = eventProcessor.countFailed(BillingEventConsumer.CONSUMER_GROUP);
                Health.Builder builder = failed == 0 ? Health.up() : Health.status("WARNING");
                return builder.withDetail("failedEvents", failed).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", String.valueOf(e.getMessage())).build();
            }
        }
    }

    /**
     * Redis only accelerates idempotency checks, so an outage is DEGRADED, not DOWN.
     */
    @Component("idempotencyCacheHealth")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public IdempotencyCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String pong = connection.ping();
                    return "PONG".equals(pong)
                            ? Health.up().build()
                            : degraded("Unexpected ping response: " + pong);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("fallback", "credit_ledger idempotency_key lookup")
                    .build();
        }
    }
}
