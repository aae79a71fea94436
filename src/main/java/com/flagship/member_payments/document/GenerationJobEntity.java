package com.flagship.member_payments.document;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for generation_jobs.
 *
 * No setters: state only changes through updateFromDomain(). Inserts normally go
 * through the JDBC enqueue path so the partial unique index can absorb duplicates.
 */
@Entity
@Table(name = "generation_jobs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationJobEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private JobKind kind;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "next_retry_at", nullable = false)
    private Instant nextRetryAt;

    @Column(name = "picked_up_at")
    private Instant pickedUpAt;

    @Column(name = "document_number", length = 32)
    private String documentNumber;

    @Column(name = "result_reference", length = 500)
    private String resultReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public GenerationJob toDomain() {
        return GenerationJob.builder()
            .id(id)
            .kind(kind)
            .subjectId(subjectId)
            .status(status)
            .attempts(attempts)
            .maxAttempts(maxAttempts)
            .lastError(lastError)
            .nextRetryAt(nextRetryAt)
            .pickedUpAt(pickedUpAt)
            .documentNumber(documentNumber)
            .resultReference(resultReference)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .completedAt(completedAt)
            .build();
    }

    void updateFromDomain(GenerationJob job) {
        if (!id.equals(job.getId())) {
            throw new IllegalArgumentException("Job id mismatch: " + id + " vs " + job.getId());
        }
        this.status = job.getStatus();
        this.attempts = job.getAttempts();
        this.lastError = job.getLastError();
        this.nextRetryAt = job.getNextRetryAt();
        this.pickedUpAt = job.getPickedUpAt();
        this.documentNumber = job.getDocumentNumber();
        this.resultReference = job.getResultReference();
        this.updatedAt = job.getUpdatedAt();
        this.completedAt = job.getCompletedAt();
    }
}
