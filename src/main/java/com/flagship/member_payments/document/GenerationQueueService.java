package com.flagship.member_payments.document;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Table-backed document generation queue.
 *
 * Enqueue joins the caller's transaction, so a job exists exactly when the
 * payment transition (or statement request) that asked for it committed.
 * Worker-side operations (claim, reserve number, complete, fail, reap) each run
 * in their own transaction so a generator failure never undoes queue bookkeeping.
 */
@Service
@Slf4j
public class GenerationQueueService {

    private static final EnumSet<JobStatus> IN_FLIGHT = EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING);

    private final GenerationJobRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final RetryPolicy retryPolicy;
    private final DocumentSequenceAllocator sequenceAllocator;
    private final Clock clock;

    public GenerationQueueService(GenerationJobRepository repository,
                                  JdbcTemplate jdbcTemplate,
                                  RetryPolicy retryPolicy,
                                  DocumentSequenceAllocator sequenceAllocator,
                                  Clock clock) {
        this.repository = repository;
        this.jdbcTemplate = jdbcTemplate;
        this.retryPolicy = retryPolicy;
        this.sequenceAllocator = sequenceAllocator;
        this.clock = clock;
    }

    /**
     * Queues work for (kind, subject), or returns the job already in flight for it.
     *
     * The pre-check covers the common case; the partial unique index plus
     * ON CONFLICT DO NOTHING covers two enqueues racing past the pre-check.
     */
    @Transactional
    public GenerationJob enqueue(JobKind kind, UUID subjectId) {
        Optional<GenerationJob> inFlight = findInFlight(kind, subjectId);
        if (inFlight.isPresent()) {
            log.debug("{} job already in flight for subject {}: {}", kind, subjectId, inFlight.get().getId());
            return inFlight.get();
        }

        GenerationJob job = GenerationJob.queued(kind, subjectId, retryPolicy.getMaxAttempts(), clock.instant());
        Timestamp now = Timestamp.from(job.getCreatedAt());
        int inserted = jdbcTemplate.update(
            "INSERT INTO generation_jobs (id, kind, subject_id, status, attempts, max_attempts, " +
            "next_retry_at, created_at, updated_at) VALUES (?, ?, ?, ?, 0, ?, ?, ?, ?) " +
            "ON CONFLICT (kind, subject_id) WHERE status IN ('QUEUED', 'RUNNING') DO NOTHING",
            job.getId(),
            kind.name(),
            subjectId,
            JobStatus.QUEUED.name(),
            job.getMaxAttempts(),
            now,
            now,
            now
        );

        if (inserted == 0) {
            log.debug("Concurrent enqueue won for {} {}", kind, subjectId);
            return findInFlight(kind, subjectId)
                .orElseThrow(() -> new IllegalStateException(
                    "Enqueue conflicted but no in-flight " + kind + " job found for " + subjectId));
        }

        log.info("Enqueued {} job {} for subject {}", kind, job.getId(), subjectId);
        return job;
    }

    /**
     * Claims up to {@code limit} due jobs, oldest first, and marks them RUNNING.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<GenerationJob> claimBatch(int limit) {
        Instant now = clock.instant();
        List<GenerationJobEntity> due = repository.findDueForUpdate(now, limit);
        for (GenerationJobEntity entity : due) {
            entity.updateFromDomain(entity.toDomain().claim(now));
        }
        repository.saveAllAndFlush(due);
        return due.stream().map(GenerationJobEntity::toDomain).toList();
    }

    /**
     * Returns the document number held by the job, allocating one on first use.
     *
     * Allocation and recording commit together, so a retry always finds the
     * number its earlier attempt reserved.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String reserveDocumentNumber(UUID jobId, String prefix) {
        GenerationJobEntity entity = lock(jobId);
        if (entity.getDocumentNumber() != null) {
            return entity.getDocumentNumber();
        }
        String number = sequenceAllocator.allocate(prefix);
        entity.updateFromDomain(entity.toDomain().withDocumentNumber(number, clock.instant()));
        repository.saveAndFlush(entity);
        log.info("Reserved {} for job {}", number, jobId);
        return number;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public GenerationJob markSucceeded(UUID jobId, String resultReference) {
        GenerationJobEntity entity = lock(jobId);
        if (entity.getStatus() != JobStatus.RUNNING) {
            log.warn("Job {} finished but is {} (reaped?); leaving it for the next run", jobId, entity.getStatus());
            return entity.toDomain();
        }
        entity.updateFromDomain(entity.toDomain().succeed(resultReference, clock.instant()));
        return repository.saveAndFlush(entity).toDomain();
    }

    /**
     * Records a failed attempt. The job goes back to QUEUED with backoff, or to
     * FAILED once it is out of attempts.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public GenerationJob markFailed(UUID jobId, String error) {
        GenerationJobEntity entity = lock(jobId);
        if (entity.getStatus() != JobStatus.RUNNING) {
            log.warn("Ignoring failure report for job {} in {} status", jobId, entity.getStatus());
            return entity.toDomain();
        }
        GenerationJob job = entity.toDomain();
        Instant now = clock.instant();
        GenerationJob failed = job.failAttempt(error, retryPolicy.nextRetryAt(job.getAttempts(), now), now);
        entity.updateFromDomain(failed);
        repository.saveAndFlush(entity);

        if (failed.getStatus() == JobStatus.FAILED) {
            log.error("{} job {} for {} failed permanently after {} attempts: {}",
                    failed.getKind(), jobId, failed.getSubjectId(), failed.getAttempts(), error);
        } else {
            log.warn("{} job {} attempt {}/{} failed, retry at {}: {}",
                    failed.getKind(), jobId, failed.getAttempts(), failed.getMaxAttempts(),
                    failed.getNextRetryAt(), error);
        }
        return failed;
    }

    /**
     * Returns a claimed job that never got a pool thread to the queue without
     * charging an attempt.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public GenerationJob release(UUID jobId) {
        GenerationJobEntity entity = lock(jobId);
        if (entity.getStatus() != JobStatus.RUNNING) {
            log.warn("Ignoring release of job {} in {} status", jobId, entity.getStatus());
            return entity.toDomain();
        }
        GenerationJob released = entity.toDomain().release(clock.instant());
        entity.updateFromDomain(released);
        repository.saveAndFlush(entity);
        log.info("{} job {} released unstarted, attempts back to {}",
                released.getKind(), jobId, released.getAttempts());
        return released;
    }

    /**
     * Requeues (or fails, when out of attempts) RUNNING jobs picked up before the cutoff.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<GenerationJob> reapStale(Instant cutoff) {
        Instant now = clock.instant();
        List<GenerationJobEntity> stale = repository.findStaleForUpdate(cutoff);
        for (GenerationJobEntity entity : stale) {
            GenerationJob job = entity.toDomain();
            entity.updateFromDomain(job.failAttempt(
                "Worker lost the job (picked up at " + job.getPickedUpAt() + ")", now, now));
        }
        repository.saveAllAndFlush(stale);
        return stale.stream().map(GenerationJobEntity::toDomain).toList();
    }

    /**
     * Admin retry for one subject.
     *
     * - a job already in flight is returned unchanged
     * - the latest FAILED job is reset (attempts back to 0, number kept)
     * - otherwise a fresh job is queued
     */
    @Transactional
    public GenerationJob retry(JobKind kind, UUID subjectId) {
        Optional<GenerationJob> inFlight = findInFlight(kind, subjectId);
        if (inFlight.isPresent()) {
            return inFlight.get();
        }

        Optional<GenerationJobEntity> latest =
            repository.findFirstByKindAndSubjectIdOrderByCreatedAtDesc(kind, subjectId);
        if (latest.isPresent() && latest.get().getStatus() == JobStatus.FAILED) {
            GenerationJobEntity entity = lock(latest.get().getId());
            entity.updateFromDomain(entity.toDomain().resetForRetry(clock.instant()));
            log.info("Reset failed {} job {} for subject {}", kind, entity.getId(), subjectId);
            return repository.saveAndFlush(entity).toDomain();
        }

        return enqueue(kind, subjectId);
    }

    @Transactional(readOnly = true)
    public Optional<GenerationJob> findInFlight(JobKind kind, UUID subjectId) {
        return repository.findFirstByKindAndSubjectIdAndStatusIn(kind, subjectId, IN_FLIGHT)
            .map(GenerationJobEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<GenerationJob> findById(UUID jobId) {
        return repository.findById(jobId).map(GenerationJobEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<GenerationJob> findJobs(JobKind kind, UUID subjectId) {
        return repository.findByKindAndSubjectIdOrderByCreatedAtAsc(kind, subjectId).stream()
            .map(GenerationJobEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<GenerationJob> findFailed(JobKind kind) {
        return repository.findByKindAndStatusOrderByUpdatedAtDesc(kind, JobStatus.FAILED).stream()
            .map(GenerationJobEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public QueueMetrics metrics(JobKind kind) {
        return new QueueMetrics(
            repository.countByKindAndStatus(kind, JobStatus.QUEUED),
            repository.countByKindAndStatus(kind, JobStatus.RUNNING),
            repository.countByKindAndStatus(kind, JobStatus.FAILED),
            repository.countByKindAndStatus(kind, JobStatus.SUCCEEDED)
        );
    }

    @Transactional(readOnly = true)
    public QueueMetrics metrics() {
        return new QueueMetrics(
            repository.countByStatus(JobStatus.QUEUED),
            repository.countByStatus(JobStatus.RUNNING),
            repository.countByStatus(JobStatus.FAILED),
            repository.countByStatus(JobStatus.SUCCEEDED)
        );
    }

    /**
     * Deletes SUCCEEDED jobs completed before the cutoff. FAILED jobs are kept for the admin view.
     */
    @Transactional
    public int deleteSucceededBefore(Instant cutoff) {
        return repository.deleteSucceededBefore(cutoff);
    }

    private GenerationJobEntity lock(UUID jobId) {
        return repository.findByIdForUpdate(jobId)
            .orElseThrow(() -> new IllegalArgumentException("Generation job not found: " + jobId));
    }
}
