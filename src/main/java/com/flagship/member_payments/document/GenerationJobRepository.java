package com.flagship.member_payments.document;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJobEntity, UUID> {

    /**
     * Due QUEUED jobs, oldest first. Rows held by another worker are skipped.
     */
    @Query(value = """
        SELECT * FROM generation_jobs
        WHERE status = 'QUEUED' AND next_retry_at <= :now
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<GenerationJobEntity> findDueForUpdate(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * RUNNING jobs picked up before the cutoff: the worker that held them is presumed dead.
     */
    @Query(value = """
        SELECT * FROM generation_jobs
        WHERE status = 'RUNNING' AND picked_up_at < :cutoff
        ORDER BY picked_up_at ASC
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<GenerationJobEntity> findStaleForUpdate(@Param("cutoff") Instant cutoff);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM GenerationJobEntity j WHERE j.id = :id")
    Optional<GenerationJobEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<GenerationJobEntity> findFirstByKindAndSubjectIdAndStatusIn(
        JobKind kind, UUID subjectId, Collection<JobStatus> statuses);

    Optional<GenerationJobEntity> findFirstByKindAndSubjectIdOrderByCreatedAtDesc(JobKind kind, UUID subjectId);

    List<GenerationJobEntity> findByKindAndSubjectIdOrderByCreatedAtAsc(JobKind kind, UUID subjectId);

    List<GenerationJobEntity> findByKindAndStatusOrderByUpdatedAtDesc(JobKind kind, JobStatus status);

    long countByKindAndStatus(JobKind kind, JobStatus status);

    long countByStatus(JobStatus status);

    @Modifying
    @Query("""
        DELETE FROM GenerationJobEntity j
        WHERE j.status = com.flagship.member_payments.document.JobStatus.SUCCEEDED
        AND j.completedAt < :before
        """)
    int deleteSucceededBefore(@Param("before") Instant before);
}
