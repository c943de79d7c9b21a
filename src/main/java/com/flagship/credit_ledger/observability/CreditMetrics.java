package com.flagship.credit_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Counters and timers for credit operations.
 *
 * - credits.mutations{operation,source}: committed grants, revokes, sets
 * - credits.consume{result}: consumed / insufficient
 * - idempotency.cache{result}: replays caught before touching the ledger
 * - topup.attempts{mode,outcome} and topup.declines{decline_type}
 * - topup.charge.duration: time spent in the payment provider
 */
@Component
public class CreditMetrics {

    private final MeterRegistry registry;
    private final Timer chargeTimer;

    public CreditMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.chargeTimer = Timer.builder("topup.charge.duration")
                .description("Time spent charging the payment provider")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordMutation(String operation, String source) {
        registry.counter("credits.mutations",
                "operation", sanitizeTag(operation),
                "source", sanitizeTag(source)
        ).increment();
    }

    public void recordConsume(boolean success) {
        registry.counter("credits.consume", "result", success ? "consumed" : "insufficient").increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordTopUpAttempt(String mode, String outcome) {
        registry.counter("topup.attempts",
                "mode", sanitizeTag(mode),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDecline(String declineType) {
        registry.counter("topup.declines", "decline_type", sanitizeTag(declineType)).increment();
    }

    public <T> T timeCharge(Supplier<T> charge) {
        return chargeTimer.record(charge);
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
