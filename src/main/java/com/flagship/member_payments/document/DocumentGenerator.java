package com.flagship.member_payments.document;

/**
 * Produces the artifact for one kind of generation job.
 *
 * Implementations must be idempotent per subject: a job may run again after a
 * timeout or a reaped worker, and must then return the artifact it already made.
 * Any exception counts as a transient failure and is retried with backoff.
 */
public interface DocumentGenerator {

    JobKind kind();

    GenerationResult generate(GenerationJob job);

    /**
     * Called once a job for this kind has exhausted its attempts.
     */
    default void onPermanentFailure(GenerationJob job) {
    }
}
