package com.flagship.member_payments.document;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of deferred document work.
 *
 * Lifecycle:
 * - QUEUED → RUNNING on claim (attempts + 1)
 * - RUNNING → SUCCEEDED, or back to QUEUED with a later nextRetryAt while attempts remain
 * - RUNNING → FAILED once attempts reach maxAttempts
 * - FAILED → QUEUED only through an admin retry, which resets attempts
 *
 * The document number, once reserved, stays on the job across retries.
 */
@Value
@Builder(toBuilder = true)
public class GenerationJob {
    UUID id;
    JobKind kind;
    UUID subjectId;
    JobStatus status;
    int attempts;
    int maxAttempts;
    String lastError;
    Instant nextRetryAt;
    Instant pickedUpAt;
    String documentNumber;
    String resultReference;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    public static GenerationJob queued(JobKind kind, UUID subjectId, int maxAttempts, Instant now) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        return GenerationJob.builder()
            .id(UUID.randomUUID())
            .kind(kind)
            .subjectId(subjectId)
            .status(JobStatus.QUEUED)
            .attempts(0)
            .maxAttempts(maxAttempts)
            .nextRetryAt(now)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Marks the job picked up by a worker.
     */
    public GenerationJob claim(Instant now) {
        requireStatus(JobStatus.QUEUED, "claim");
        return toBuilder()
            .status(JobStatus.RUNNING)
            .attempts(attempts + 1)
            .pickedUpAt(now)
            .updatedAt(now)
            .build();
    }

    public GenerationJob succeed(String resultReference, Instant now) {
        requireStatus(JobStatus.RUNNING, "complete");
        return toBuilder()
            .status(JobStatus.SUCCEEDED)
            .resultReference(resultReference)
            .lastError(null)
            .completedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Records a failed attempt: requeued for {@code retryAt} while attempts remain,
     * FAILED otherwise.
     */
    public GenerationJob failAttempt(String error, Instant retryAt, Instant now) {
        requireStatus(JobStatus.RUNNING, "fail");
        if (hasAttemptsLeft()) {
            return toBuilder()
                .status(JobStatus.QUEUED)
                .lastError(error)
                .nextRetryAt(retryAt)
                .pickedUpAt(null)
                .updatedAt(now)
                .build();
        }
        return toBuilder()
            .status(JobStatus.FAILED)
            .lastError(error)
            .completedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Hands a claimed job back untouched: the worker never started it, so the claim's
     * attempt is returned and the job is due again right away.
     */
    public GenerationJob release(Instant now) {
        requireStatus(JobStatus.RUNNING, "release");
        return toBuilder()
            .status(JobStatus.QUEUED)
            .attempts(Math.max(0, attempts - 1))
            .nextRetryAt(now)
            .pickedUpAt(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Admin retry of a permanently failed job: attempts start over, eligible immediately.
     */
    public GenerationJob resetForRetry(Instant now) {
        requireStatus(JobStatus.FAILED, "reset");
        return toBuilder()
            .status(JobStatus.QUEUED)
            .attempts(0)
            .nextRetryAt(now)
            .pickedUpAt(null)
            .completedAt(null)
            .updatedAt(now)
            .build();
    }

    public GenerationJob withDocumentNumber(String number, Instant now) {
        if (documentNumber != null && !documentNumber.equals(number)) {
            throw new IllegalStateException(
                String.format("Job %s already holds document number %s", id, documentNumber));
        }
        return toBuilder().documentNumber(number).updatedAt(now).build();
    }

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }

    private void requireStatus(JobStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("Cannot %s generation job %s in %s status. Expected %s.",
                    action, id, status, expected));
        }
    }
}
