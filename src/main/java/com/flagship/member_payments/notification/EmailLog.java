package com.flagship.member_payments.notification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One email dispatch attempt. Written PENDING before the provider is called,
 * then resolved to SENT or FAILED.
 */
@Value
@Builder(toBuilder = true)
public class EmailLog {
    UUID id;
    UUID userId;
    String recipient;
    String subject;
    String templateName;
    String provider;
    String providerMessageId;
    EmailStatus status;
    String error;
    Instant createdAt;
    Instant updatedAt;

    public static EmailLog pending(UUID userId, String recipient, String subject,
                                   String templateName, String provider, Instant now) {
        return EmailLog.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .recipient(recipient)
            .subject(subject)
            .templateName(templateName)
            .provider(provider)
            .status(EmailStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public EmailLog sent(String providerMessageId, Instant now) {
        requirePending();
        return toBuilder()
            .status(EmailStatus.SENT)
            .providerMessageId(providerMessageId)
            .updatedAt(now)
            .build();
    }

    public EmailLog failed(String error, Instant now) {
        requirePending();
        return toBuilder()
            .status(EmailStatus.FAILED)
            .error(error)
            .updatedAt(now)
            .build();
    }

    private void requirePending() {
        if (status != EmailStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Email log %s is already %s", id, status));
        }
    }
}
