package com.flagship.member_payments.invoice.dto;

import com.flagship.member_payments.document.GenerationJob;
import lombok.Value;

import java.util.UUID;

@Value
public class RetryResponse {
    UUID jobId;
    UUID paymentId;
    String status;
    int attempts;
    int maxAttempts;

    public static RetryResponse from(GenerationJob job) {
        return new RetryResponse(job.getId(), job.getSubjectId(), job.getStatus().name(),
                job.getAttempts(), job.getMaxAttempts());
    }
}
