package com.flagship.member_payments.notification;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * A templated email for one recipient.
 *
 * userId is the member the mail is about; their preferences gate it unless
 * explicitlyRequested is set (an operator asked for this exact send).
 */
@Value
@Builder
public class EmailMessage {
    UUID userId;
    String recipient;
    EmailTemplate template;
    @Singular("put")
    Map<String, Object> model;
    boolean explicitlyRequested;
}
