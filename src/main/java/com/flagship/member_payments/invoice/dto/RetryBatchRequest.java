package com.flagship.member_payments.invoice.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetryBatchRequest {

    @NotEmpty(message = "paymentIds must not be empty")
    @Size(max = 50, message = "At most 50 payments can be retried at once")
    private List<UUID> paymentIds;
}
