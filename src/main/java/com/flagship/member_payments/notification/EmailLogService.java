package com.flagship.member_payments.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * EmailLog persistence. Every write commits on its own, so the log survives
 * whatever happens to the caller's transaction or to the provider call.
 */
@Service
@RequiredArgsConstructor
public class EmailLogService {

    private final EmailLogRepository repository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EmailLog createPending(UUID userId, String recipient, String subject, String templateName, String provider) {
        EmailLog log = EmailLog.pending(userId, recipient, subject, templateName, provider, clock.instant());
        return repository.save(EmailLogEntity.fromDomain(log)).toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EmailLog markSent(UUID emailLogId, String providerMessageId) {
        EmailLogEntity entity = find(emailLogId);
        entity.updateFromDomain(entity.toDomain().sent(providerMessageId, clock.instant()));
        return repository.save(entity).toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EmailLog markFailed(UUID emailLogId, String error) {
        EmailLogEntity entity = find(emailLogId);
        entity.updateFromDomain(entity.toDomain().failed(error, clock.instant()));
        return repository.save(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public List<EmailLog> findForUser(UUID userId, String templateName) {
        return repository.findByUserIdAndTemplateNameOrderByCreatedAtAsc(userId, templateName).stream()
            .map(EmailLogEntity::toDomain)
            .toList();
    }

    private EmailLogEntity find(UUID emailLogId) {
        return repository.findById(emailLogId)
            .orElseThrow(() -> new IllegalArgumentException("Email log not found: " + emailLogId));
    }
}
