package com.flagship.member_payments.statement;

import com.flagship.member_payments.notification.DispatchResult;
import lombok.Value;

import java.util.Map;

/**
 * The statement after an email request, with the dispatch outcome per address.
 */
@Value
public class StatementEmailOutcome {
    FinancialStatement statement;
    Map<String, DispatchResult> results;
}
