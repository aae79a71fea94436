package com.flagship.member_payments.document;

import com.flagship.member_payments.observability.GenerationQueueMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Recovers jobs left RUNNING by a worker that died mid-render.
 *
 * A RUNNING job whose pickedUpAt is older than {@code documents.reaper.stale-after-ms}
 * counts as a failed attempt: it is requeued immediately, or failed for good when
 * it has no attempts left.
 */
@Component
@Slf4j
public class GenerationJobReaper {

    private final GenerationQueueService queueService;
    private final DocumentGenerators generators;
    private final GenerationQueueMetrics metrics;
    private final Clock clock;
    private final Duration staleAfter;

    public GenerationJobReaper(GenerationQueueService queueService,
                               DocumentGenerators generators,
                               GenerationQueueMetrics metrics,
                               Clock clock,
                               @Value("${documents.reaper.stale-after-ms:600000}") long staleAfterMs) {
        this.queueService = queueService;
        this.generators = generators;
        this.metrics = metrics;
        this.clock = clock;
        this.staleAfter = Duration.ofMillis(staleAfterMs);
    }

    public int reap() {
        Instant cutoff = clock.instant().minus(staleAfter);
        List<GenerationJob> reaped = queueService.reapStale(cutoff);
        for (GenerationJob job : reaped) {
            if (job.getStatus() == JobStatus.FAILED) {
                log.error("Stale {} job {} out of attempts, marked FAILED", job.getKind(), job.getId());
                generators.forKind(job.getKind()).onPermanentFailure(job);
            } else {
                log.warn("Requeued stale {} job {} (attempt {}/{})",
                        job.getKind(), job.getId(), job.getAttempts(), job.getMaxAttempts());
            }
        }
        if (!reaped.isEmpty()) {
            metrics.recordJobsReaped(reaped.size());
        }
        return reaped.size();
    }
}
