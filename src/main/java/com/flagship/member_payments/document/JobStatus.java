package com.flagship.member_payments.document;

public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    /**
     * QUEUED and RUNNING jobs are in flight; at most one per (kind, subject).
     */
    public boolean isInFlight() {
        return this == QUEUED || this == RUNNING;
    }
}
