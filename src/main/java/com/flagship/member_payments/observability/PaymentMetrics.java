package com.flagship.member_payments.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for payment operations.
 *
 * Metrics exposed:
 * - payments.created / payments.completed / payments.failed / payments.refunded
 * - payments.verifications: verification outcomes
 * - payments.webhooks: inbound webhook events
 * - payments.latency: per-operation API latency
 * - idempotency.cache: hits and misses on Idempotency-Key lookups
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;
    private final Counter duplicateRequests;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.duplicateRequests = Counter.builder("payments.duplicate_requests")
                .description("Number of duplicate create-order requests (idempotency hits)")
                .register(registry);
    }

    public void recordPaymentCreated(String currency, String type) {
        registry.counter("payments.created",
                "currency", sanitizeTag(currency),
                "type", sanitizeTag(type)
        ).increment();
    }

    public void recordPaymentCompleted(String currency) {
        registry.counter("payments.completed", "currency", sanitizeTag(currency)).increment();
    }

    public void recordPaymentFailed(String reason) {
        registry.counter("payments.failed", "reason", sanitizeTag(reason)).increment();
    }

    public void recordPaymentRefunded(String currency) {
        registry.counter("payments.refunded", "currency", sanitizeTag(currency)).increment();
    }

    public void recordVerification(String outcome) {
        registry.counter("payments.verifications", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordWebhook(String gateway, String event) {
        registry.counter("payments.webhooks",
                "gateway", sanitizeTag(gateway),
                "event", sanitizeTag(event)
        ).increment();
    }

    public void recordPaymentLatency(String operation, long durationMs) {
        registry.timer("payments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        duplicateRequests.increment();
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordEventProcessed(String eventType, boolean wasNew) {
        Counter.builder("event.processed")
                .tag("event_type", eventType)
                .tag("was_new", String.valueOf(wasNew))
                .register(registry)
                .increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        Counter.builder("event.processing.failure")
                .tag("event_type", eventType)
                .tag("error", sanitizeTag(error))
                .register(registry)
                .increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
