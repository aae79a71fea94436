package com.flagship.member_payments.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "email_logs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EmailLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false, length = 320)
    private String recipient;

    @Column(nullable = false, updatable = false, length = 500)
    private String subject;

    @Column(name = "template_name", nullable = false, updatable = false, length = 64)
    private String templateName;

    @Column(nullable = false, updatable = false, length = 32)
    private String provider;

    @Column(name = "provider_message_id")
    private String providerMessageId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EmailStatus status;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static EmailLogEntity fromDomain(EmailLog log) {
        return new EmailLogEntity(
            log.getId(),
            log.getUserId(),
            log.getRecipient(),
            log.getSubject(),
            log.getTemplateName(),
            log.getProvider(),
            log.getProviderMessageId(),
            log.getStatus(),
            log.getError(),
            log.getCreatedAt(),
            log.getUpdatedAt()
        );
    }

    public EmailLog toDomain() {
        return EmailLog.builder()
            .id(id)
            .userId(userId)
            .recipient(recipient)
            .subject(subject)
            .templateName(templateName)
            .provider(provider)
            .providerMessageId(providerMessageId)
            .status(status)
            .error(error)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(EmailLog log) {
        this.status = log.getStatus();
        this.providerMessageId = log.getProviderMessageId();
        this.error = log.getError();
        this.updatedAt = log.getUpdatedAt();
    }
}
