package com.flagship.member_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_payments.payment.PaymentGateway;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Checkout callback fields as the gateway hands them to the browser.
 */
@Value
public class VerifyPaymentRequest {

    @NotBlank(message = "orderId is required")
    @JsonProperty("orderId")
    String orderId;

    @NotBlank(message = "paymentId is required")
    @JsonProperty("paymentId")
    String paymentId;

    @NotBlank(message = "signature is required")
    @JsonProperty("signature")
    String signature;

    @JsonProperty("gateway")
    PaymentGateway gateway;

    public PaymentGateway gatewayOrDefault() {
        return gateway != null ? gateway : PaymentGateway.RAZORPAY;
    }
}
