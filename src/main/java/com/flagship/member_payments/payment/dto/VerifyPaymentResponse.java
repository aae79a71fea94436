package com.flagship.member_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_payments.payment.PaymentStatus;
import com.flagship.member_payments.webhook.VerificationOutcome;
import com.flagship.member_payments.webhook.VerificationResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class VerifyPaymentResponse {

    @JsonProperty("outcome")
    VerificationOutcome outcome;

    @JsonProperty("paymentId")
    UUID paymentId;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("message")
    String message;

    public static VerifyPaymentResponse from(VerificationResult result) {
        return VerifyPaymentResponse.builder()
            .outcome(result.getOutcome())
            .paymentId(result.getPayment() != null ? result.getPayment().getId() : null)
            .status(result.getPayment() != null ? result.getPayment().getStatus() : null)
            .message(result.getMessage())
            .build();
    }
}
