package com.flagship.member_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class RefundRequest {

    @NotNull(message = "paymentId is required")
    @JsonProperty("paymentId")
    UUID paymentId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Refund amount must be positive")
    @JsonProperty("amount")
    Long amount;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
