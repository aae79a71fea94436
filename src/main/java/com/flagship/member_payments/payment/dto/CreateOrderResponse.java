package com.flagship.member_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_payments.payment.CreatedOrder;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * What the checkout needs to open the gateway's payment page.
 */
@Value
@Builder
public class CreateOrderResponse {

    @JsonProperty("paymentId")
    UUID paymentId;

    @JsonProperty("orderId")
    String orderId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("gateway")
    PaymentGateway gateway;

    @JsonProperty("keyId")
    String keyId;

    @JsonProperty("status")
    PaymentStatus status;

    public static CreateOrderResponse from(CreatedOrder order) {
        Payment payment = order.getPayment();
        return CreateOrderResponse.builder()
            .paymentId(payment.getId())
            .orderId(payment.getGatewayOrderId())
            .amount(payment.getAmount())
            .currency(payment.getCurrency().name())
            .gateway(payment.getGateway())
            .keyId(order.getGatewayKeyId())
            .status(payment.getStatus())
            .build();
    }
}
