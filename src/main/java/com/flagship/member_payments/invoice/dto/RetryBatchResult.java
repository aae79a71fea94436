package com.flagship.member_payments.invoice.dto;

import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class RetryBatchResult {
    List<UUID> succeeded;
    List<Failure> failed;

    @Value
    public static class Failure {
        UUID paymentId;
        String error;
    }
}
