package com.flagship.member_payments.document;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drives the generation queue: polling, reaping and retention cleanup.
 *
 * Disabled with documents.worker.enabled=false; tests then call
 * {@link GenerationWorker#runOnce()} directly.
 */
@Component
@ConditionalOnProperty(name = "documents.worker.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class GenerationScheduler {

    private final GenerationWorker worker;
    private final GenerationJobReaper reaper;
    private final GenerationQueueService queueService;
    private final Clock clock;

    @Value("${documents.cleanup.retention-days:30}")
    private int retentionDays;

    @Scheduled(fixedDelayString = "${documents.worker.poll-interval-ms:2000}")
    public void poll() {
        try {
            int processed;
            do {
                processed = worker.runOnce();
            } while (processed > 0);
        } catch (Exception e) {
            log.error("Error in generation worker polling loop", e);
        }
    }

    @Scheduled(fixedDelayString = "${documents.reaper.interval-ms:60000}")
    public void reap() {
        try {
            reaper.reap();
        } catch (Exception e) {
            log.error("Error in generation job reaper", e);
        }
    }

    @Scheduled(cron = "${documents.cleanup.cron:0 30 3 * * *}")
    public void cleanup() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = queueService.deleteSucceededBefore(cutoff);
        log.info("Generation queue cleanup removed {} succeeded jobs completed before {}", deleted, cutoff);
    }
}
