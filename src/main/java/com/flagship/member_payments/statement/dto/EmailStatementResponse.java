package com.flagship.member_payments.statement.dto;

import com.flagship.member_payments.notification.DispatchResult;
import com.flagship.member_payments.statement.StatementEmailOutcome;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class EmailStatementResponse {

    StatementResponse statement;
    Map<String, Delivery> deliveries;

    @Value
    public static class Delivery {
        DispatchResult.Status status;
        String error;
    }

    public static EmailStatementResponse from(StatementEmailOutcome outcome) {
        Map<String, Delivery> deliveries = new LinkedHashMap<>();
        outcome.getResults().forEach((recipient, result) ->
            deliveries.put(recipient, new Delivery(result.getStatus(), result.getError())));
        return new EmailStatementResponse(StatementResponse.from(outcome.getStatement()), deliveries);
    }
}
