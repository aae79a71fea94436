package com.flagship.member_payments.observability;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Counters for email dispatch outcomes, tagged by template.
 */
@Component
@RequiredArgsConstructor
public class NotificationMetrics {

    private final MeterRegistry registry;

    public void recordSent(String template) {
        record(template, "sent");
    }

    public void recordFailed(String template) {
        record(template, "failed");
    }

    public void recordSuppressed(String template) {
        record(template, "suppressed");
    }

    private void record(String template, String result) {
        registry.counter("notifications.dispatched",
                "template", template,
                "result", result
        ).increment();
    }
}
