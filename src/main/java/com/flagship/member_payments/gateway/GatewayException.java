package com.flagship.member_payments.gateway;

import com.flagship.member_payments.payment.PaymentGateway;

/**
 * A gateway call failed: timeout, transport error or a rejected request.
 */
public class GatewayException extends RuntimeException {

    private final PaymentGateway gateway;

    public GatewayException(PaymentGateway gateway, String message, Throwable cause) {
        super(message, cause);
        this.gateway = gateway;
    }

    public GatewayException(PaymentGateway gateway, String message) {
        this(gateway, message, null);
    }

    public PaymentGateway getGateway() {
        return gateway;
    }
}
