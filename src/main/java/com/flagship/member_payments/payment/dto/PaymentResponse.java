package com.flagship.member_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentStatus;
import com.flagship.member_payments.payment.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Payment as returned by the API. Amounts are minor units of {@code currency}.
 */
@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("userId")
    UUID userId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("type")
    PaymentType type;

    @JsonProperty("gateway")
    PaymentGateway gateway;

    @JsonProperty("gatewayOrderId")
    String gatewayOrderId;

    @JsonProperty("gatewayPaymentId")
    String gatewayPaymentId;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("description")
    String description;

    @JsonProperty("failureReason")
    String failureReason;

    @JsonProperty("refundAmount")
    Long refundAmount;

    @JsonProperty("refundReason")
    String refundReason;

    @JsonProperty("createdAt")
    Instant createdAt;

    @JsonProperty("completedAt")
    Instant completedAt;

    @JsonProperty("refundedAt")
    Instant refundedAt;

    @JsonProperty("updatedAt")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .userId(payment.getUserId())
            .amount(payment.getAmount())
            .currency(payment.getCurrency().name())
            .type(payment.getType())
            .gateway(payment.getGateway())
            .gatewayOrderId(payment.getGatewayOrderId())
            .gatewayPaymentId(payment.getGatewayPaymentId())
            .status(payment.getStatus())
            .description(payment.getDescription())
            .failureReason(payment.getFailureReason())
            .refundAmount(payment.getRefundAmount())
            .refundReason(payment.getRefundReason())
            .createdAt(payment.getCreatedAt())
            .completedAt(payment.getCompletedAt())
            .refundedAt(payment.getRefundedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
