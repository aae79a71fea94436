package com.flagship.member_payments.observability;

import com.flagship.member_payments.document.GenerationQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need database queries, so Prometheus scrapes stay cheap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final GenerationQueueMetrics generationQueueMetrics;
    private final GenerationQueueService generationQueueService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGenerationQueueMetrics() {
        try {
            generationQueueMetrics.updateDepth(generationQueueService.metrics());
        } catch (Exception e) {
            log.warn("Failed to refresh generation queue metrics: {}", e.getMessage());
        }
    }
}
