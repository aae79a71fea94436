package com.flagship.member_payments.gateway;

import com.flagship.member_payments.payment.PaymentGateway;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the client for a gateway identifier.
 */
@Component
public class GatewayRegistry {

    private final Map<PaymentGateway, GatewayClient> clients = new EnumMap<>(PaymentGateway.class);

    public GatewayRegistry(List<GatewayClient> gatewayClients) {
        for (GatewayClient client : gatewayClients) {
            clients.put(client.gateway(), client);
        }
    }

    /**
     * @throws IllegalArgumentException if no client is registered for the gateway
     */
    public GatewayClient forGateway(PaymentGateway gateway) {
        GatewayClient client = clients.get(gateway);
        if (client == null) {
            throw new IllegalArgumentException("Payment gateway " + gateway + " is not supported");
        }
        return client;
    }

    public boolean supports(PaymentGateway gateway) {
        return clients.containsKey(gateway);
    }
}
