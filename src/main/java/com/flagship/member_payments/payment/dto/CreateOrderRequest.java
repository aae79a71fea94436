package com.flagship.member_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request body for creating a gateway order. Amount is in minor units (paise for INR).
 */
@Value
public class CreateOrderRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Currency is required")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Payment type is required")
    @JsonProperty("type")
    PaymentType type;

    /**
     * Defaults to RAZORPAY.
     */
    @JsonProperty("gateway")
    PaymentGateway gateway;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    public PaymentGateway gatewayOrDefault() {
        return gateway != null ? gateway : PaymentGateway.RAZORPAY;
    }
}
