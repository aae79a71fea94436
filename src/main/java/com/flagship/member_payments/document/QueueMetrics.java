package com.flagship.member_payments.document;

import lombok.Value;

/**
 * Job counts by status, as shown on the admin dashboard.
 */
@Value
public class QueueMetrics {
    long pendingJobs;
    long activeJobs;
    long failedJobs;
    long completedJobs;
}
