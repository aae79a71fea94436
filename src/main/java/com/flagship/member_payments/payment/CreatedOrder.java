package com.flagship.member_payments.payment;

import lombok.Value;

/**
 * Result of CreateOrder. {@code replayed} is true when an earlier order was
 * returned for the same idempotency key.
 */
@Value
public class CreatedOrder {
    Payment payment;
    String gatewayKeyId;
    boolean replayed;
}
