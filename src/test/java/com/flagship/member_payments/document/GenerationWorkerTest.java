package com.flagship.member_payments.document;

import com.flagship.member_payments.observability.GenerationQueueMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationWorkerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T08:30:00Z");
    private static final long RENDER_TIMEOUT_MS = 200;

    @Mock
    private GenerationQueueService queueService;

    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private final AtomicBoolean unstick = new AtomicBoolean(false);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(1);
    }

    @AfterEach
    void tearDown() {
        unstick.set(true);
        executor.shutdownNow();
    }

    private GenerationWorker worker(Function<GenerationJob, GenerationResult> render) {
        DocumentGenerator generator = new DocumentGenerator() {
            @Override
            public JobKind kind() {
                return JobKind.INVOICE;
            }

            @Override
            public GenerationResult generate(GenerationJob job) {
                return render.apply(job);
            }
        };
        return new GenerationWorker(queueService, new DocumentGenerators(List.of(generator)), executor,
                new GenerationQueueMetrics(meterRegistry), 10, 1, RENDER_TIMEOUT_MS);
    }

    private static GenerationJob runningJob() {
        return GenerationJob.queued(JobKind.INVOICE, UUID.randomUUID(), 3, NOW).claim(NOW);
    }

    private static void awaitIdle(GenerationWorker worker, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (worker.idleThreads() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, worker.idleThreads(), "Idle generation threads");
    }

    @Test
    @DisplayName("A render stuck past its timeout keeps its thread busy, so the next pass claims nothing")
    void stuckRenderBlocksFurtherClaims() throws Exception {
        GenerationJob stuck = runningJob();
        GenerationJob next = runningJob();

        GenerationWorker worker = worker(job -> {
            if (job.getId().equals(stuck.getId())) {
                // Ignores interrupts, like a render blocked in native I/O.
                while (!unstick.get()) {
                    Thread.onSpinWait();
                }
            }
            return new GenerationResult("INV-2026-03-00001", "file:///documents/" + job.getId() + ".pdf");
        });

        when(queueService.claimBatch(1)).thenReturn(List.of(stuck), List.of(next));
        when(queueService.markFailed(eq(stuck.getId()), anyString()))
                .thenAnswer(invocation -> stuck.failAttempt(invocation.getArgument(1), NOW.plusSeconds(30), NOW));

        assertEquals(1, worker.runOnce());
        verify(queueService).markFailed(eq(stuck.getId()), contains("timed out"));
        assertEquals(1.0, meterRegistry.counter("documents.jobs.timeouts", "kind", "INVOICE").count());

        assertEquals(0, worker.idleThreads(), "Cancelled render still occupies its thread");
        assertEquals(0, worker.runOnce());
        assertEquals(0, worker.runOnce());
        verify(queueService, times(1)).claimBatch(anyInt());

        unstick.set(true);
        awaitIdle(worker, 1);

        assertEquals(1, worker.runOnce());
        verify(queueService).markSucceeded(next.getId(), "file:///documents/" + next.getId() + ".pdf");
        verify(queueService, never()).markFailed(eq(next.getId()), anyString());
        verify(queueService, never()).release(next.getId());
    }

    @Test
    @DisplayName("A claimed job that never gets a thread is released without being failed")
    void unstartedJobIsReleasedNotFailed() throws Exception {
        CountDownLatch blockerRelease = new CountDownLatch(1);
        executor.submit(() -> {
            blockerRelease.await();
            return null;
        });

        GenerationJob waiting = runningJob();
        AtomicInteger renders = new AtomicInteger();
        GenerationWorker worker = worker(job -> {
            renders.incrementAndGet();
            return new GenerationResult("INV-2026-03-00002", "file:///documents/" + job.getId() + ".pdf");
        });
        when(queueService.claimBatch(1)).thenReturn(List.of(waiting));

        assertEquals(1, worker.runOnce());

        verify(queueService).release(waiting.getId());
        verify(queueService, never()).markFailed(eq(waiting.getId()), anyString());
        verify(queueService, never()).markSucceeded(eq(waiting.getId()), anyString());
        assertEquals(0.0, meterRegistry.counter("documents.jobs.timeouts", "kind", "INVOICE").count());
        assertEquals(1, worker.idleThreads(), "Released job hands its thread reservation back");

        blockerRelease.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(0, renders.get(), "Abandoned job must not render once a thread frees up");
    }
}
