package com.flagship.member_payments.payment;

/**
 * Payment processors a payment can be routed through.
 *
 * Only gateways with a registered client can take orders; the rest are kept
 * so historical rows and requests naming them still parse.
 */
public enum PaymentGateway {
    RAZORPAY,
    STRIPE,
    PAYU,
    PAYTM,
    CCAVENUE,
    INSTAMOJO,
    PAYPAL
}
