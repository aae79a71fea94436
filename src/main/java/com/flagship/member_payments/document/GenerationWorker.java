package com.flagship.member_payments.document;

import com.flagship.member_payments.observability.CorrelationContext;
import com.flagship.member_payments.observability.GenerationQueueMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs claimed generation jobs on the generation pool.
 *
 * A pass claims no more jobs than there are idle pool threads. A render that
 * overruns its timeout is cancelled and reported as a failed attempt, but its
 * thread only counts as idle again once the render actually returns, so later
 * passes claim less while a render is stuck. The timeout runs from the moment a
 * render starts; a claimed job that never got a thread is released back to the
 * queue without using up an attempt.
 */
@Component
@Slf4j
public class GenerationWorker {

    private final GenerationQueueService queueService;
    private final DocumentGenerators generators;
    private final ExecutorService executor;
    private final GenerationQueueMetrics metrics;
    private final int batchSize;
    private final long renderTimeoutMs;
    private final Semaphore idleThreads;

    public GenerationWorker(GenerationQueueService queueService,
                            DocumentGenerators generators,
                            @Qualifier("generationExecutor") ExecutorService executor,
                            GenerationQueueMetrics metrics,
                            @Value("${documents.worker.batch-size:10}") int batchSize,
                            @Value("${documents.worker.threads:4}") int threads,
                            @Value("${documents.worker.render-timeout-ms:30000}") long renderTimeoutMs) {
        this.queueService = queueService;
        this.generators = generators;
        this.executor = executor;
        this.metrics = metrics;
        this.batchSize = batchSize;
        this.renderTimeoutMs = renderTimeoutMs;
        this.idleThreads = new Semaphore(threads);
    }

    /**
     * Claims one batch of due jobs and waits for all of them to finish, time out,
     * or be released unstarted.
     *
     * @return number of jobs claimed
     */
    public int runOnce() {
        int reserved = idleThreads.drainPermits();
        if (reserved == 0) {
            log.debug("No idle generation threads, skipping claim");
            return 0;
        }
        List<GenerationJob> claimed;
        try {
            claimed = queueService.claimBatch(Math.min(batchSize, reserved));
        } catch (RuntimeException e) {
            idleThreads.release(reserved);
            throw e;
        }
        if (reserved > claimed.size()) {
            idleThreads.release(reserved - claimed.size());
        }
        if (claimed.isEmpty()) {
            return 0;
        }
        log.debug("Claimed {} generation jobs", claimed.size());

        long submittedAt = System.nanoTime();
        List<RenderTask> tasks = new ArrayList<>(claimed.size());
        for (GenerationJob job : claimed) {
            RenderTask task = new RenderTask(job);
            task.future = executor.submit(task::run);
            tasks.add(task);
        }

        for (RenderTask task : tasks) {
            await(task, submittedAt);
        }
        return claimed.size();
    }

    /**
     * Pool threads currently free for claiming.
     */
    int idleThreads() {
        return idleThreads.availablePermits();
    }

    private GenerationResult render(GenerationJob job) {
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, job.getId().toString());
        try {
            log.debug("Generating {} for subject {} (attempt {}/{})",
                    job.getKind(), job.getSubjectId(), job.getAttempts(), job.getMaxAttempts());
            return generators.forKind(job.getKind()).generate(job);
        } finally {
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
        }
    }

    private void await(RenderTask task, long submittedAt) {
        GenerationJob job = task.job;
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(renderTimeoutMs);
        long remaining = submittedAt + timeoutNanos - System.nanoTime();
        try {
            GenerationResult result;
            while (true) {
                try {
                    result = task.future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                    break;
                } catch (TimeoutException e) {
                    if (task.abandon()) {
                        releaseUnstarted(task);
                        return;
                    }
                    remaining = task.startedAt + timeoutNanos - System.nanoTime();
                    if (remaining <= 0) {
                        task.future.cancel(true);
                        metrics.recordJobTimedOut(job.getKind());
                        fail(job, "Render timed out after " + renderTimeoutMs + "ms");
                        return;
                    }
                }
            }
            queueService.markSucceeded(job.getId(), result.getDocumentUrl());
            metrics.recordJobSucceeded(job.getKind(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - task.startedAt));
            log.info("{} job {} succeeded: {}", job.getKind(), job.getId(), result.getDocumentNumber());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(job, describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (task.abandon()) {
                releaseUnstarted(task);
                return;
            }
            task.future.cancel(true);
            fail(job, "Worker interrupted");
        }
    }

    private void releaseUnstarted(RenderTask task) {
        task.future.cancel(false);
        idleThreads.release();
        log.warn("{} job {} did not get a generation thread within {}ms, releasing it",
                task.job.getKind(), task.job.getId(), renderTimeoutMs);
        queueService.release(task.job.getId());
    }

    private void fail(GenerationJob job, String error) {
        GenerationJob updated = queueService.markFailed(job.getId(), error);
        boolean permanent = updated.getStatus() == JobStatus.FAILED;
        metrics.recordJobFailed(job.getKind(), permanent);
        if (permanent) {
            generators.forKind(job.getKind()).onPermanentFailure(updated);
        }
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    /**
     * One claimed job on its way through the pool. Exactly one of the pool thread
     * (starting the render) and the waiting worker (abandoning it) wins {@code started}.
     */
    private final class RenderTask {

        private final GenerationJob job;
        private final AtomicBoolean started = new AtomicBoolean(false);
        private volatile long startedAt;
        private Future<GenerationResult> future;

        private RenderTask(GenerationJob job) {
            this.job = job;
        }

        private GenerationResult run() {
            startedAt = System.nanoTime();
            if (!started.compareAndSet(false, true)) {
                return null;
            }
            try {
                return render(job);
            } finally {
                idleThreads.release();
            }
        }

        private boolean abandon() {
            return started.compareAndSet(false, true);
        }
    }
}
