package com.flagship.member_payments.gateway;

import lombok.Value;

@Value
public class GatewayRefund {
    String refundId;
    String status;
}
