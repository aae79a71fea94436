package com.flagship.member_payments.gateway;

import lombok.Value;

/**
 * Order created at the gateway.
 */
@Value
public class GatewayOrder {
    String orderId;
    long amount;
    String currency;
    String receipt;
}
