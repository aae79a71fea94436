package com.flagship.member_payments.gateway;

import com.flagship.member_payments.payment.CurrencyCode;
import com.flagship.member_payments.payment.PaymentGateway;

/**
 * Thin adapter over one payment processor.
 *
 * Implementations must bound every network call with a timeout and report
 * transport or processor errors as {@link GatewayException}. Signature checks
 * never throw: a mismatch is simply {@code false}.
 */
public interface GatewayClient {

    PaymentGateway gateway();

    /**
     * Public key the checkout page needs to open the gateway widget.
     */
    String publicKeyId();

    GatewayOrder createOrder(long amount, CurrencyCode currency, String receipt);

    /**
     * Checks the signature the checkout returned for an order/payment pair.
     */
    boolean verifyPaymentSignature(String orderId, String paymentId, String signature);

    /**
     * Checks the signature header of a server-to-server webhook call against its raw body.
     */
    boolean verifyWebhookSignature(String rawBody, String signature);

    GatewayRefund refund(String gatewayPaymentId, long amount, String reason);
}
