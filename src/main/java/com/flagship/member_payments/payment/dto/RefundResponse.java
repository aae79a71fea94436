package com.flagship.member_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_payments.payment.PaymentRefund;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The refund record returned by the refund endpoint.
 */
@Value
@Builder
public class RefundResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("paymentId")
    UUID paymentId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("gatewayRefundId")
    String gatewayRefundId;

    @JsonProperty("processedBy")
    String processedBy;

    @JsonProperty("processedAt")
    Instant processedAt;

    public static RefundResponse from(PaymentRefund refund) {
        return RefundResponse.builder()
            .id(refund.getId())
            .paymentId(refund.getPaymentId())
            .amount(refund.getAmount())
            .reason(refund.getReason())
            .gatewayRefundId(refund.getGatewayRefundId())
            .processedBy(refund.getProcessedBy())
            .processedAt(refund.getProcessedAt())
            .build();
    }
}
