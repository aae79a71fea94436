package com.flagship.member_payments.observability;

import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.document.QueueMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the document generation queue.
 *
 * Depth gauges are cached and refreshed by {@link MetricsScheduler}; counters and
 * timers are recorded by the worker and reaper as jobs finish.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationQueueMetrics {

    private final MeterRegistry meterRegistry;

    private final AtomicLong queued = new AtomicLong(0);
    private final AtomicLong running = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("documents.queue.depth", queued, AtomicLong::get)
                .description("Generation jobs waiting to run")
                .tag("status", "queued")
                .register(meterRegistry);

        Gauge.builder("documents.queue.depth", running, AtomicLong::get)
                .description("Generation jobs currently running")
                .tag("status", "running")
                .register(meterRegistry);

        Gauge.builder("documents.queue.depth", failed, AtomicLong::get)
                .description("Generation jobs that exhausted their attempts")
                .tag("status", "failed")
                .register(meterRegistry);
    }

    public void updateDepth(QueueMetrics snapshot) {
        queued.set(snapshot.getPendingJobs());
        running.set(snapshot.getActiveJobs());
        failed.set(snapshot.getFailedJobs());
    }

    public void recordJobSucceeded(JobKind kind, long durationMs) {
        meterRegistry.counter("documents.jobs.completed",
                "kind", kind.name(),
                "result", "succeeded"
        ).increment();
        meterRegistry.timer("documents.jobs.duration", "kind", kind.name())
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * @param permanent true when the attempt exhausted the job's retries
     */
    public void recordJobFailed(JobKind kind, boolean permanent) {
        meterRegistry.counter("documents.jobs.completed",
                "kind", kind.name(),
                "result", permanent ? "failed" : "retried"
        ).increment();
    }

    public void recordJobTimedOut(JobKind kind) {
        meterRegistry.counter("documents.jobs.timeouts", "kind", kind.name()).increment();
    }

    public void recordJobsReaped(int count) {
        meterRegistry.counter("documents.jobs.reaped").increment(count);
    }
}
