package com.flagship.member_payments.notification;

import com.flagship.member_payments.member.MemberDirectory;
import com.flagship.member_payments.member.NotificationPreferences;
import com.flagship.member_payments.observability.NotificationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renders and sends templated emails, logging every attempt.
 *
 * Flow:
 * 1. preference gate: a member who opted out gets nothing, and no EmailLog row
 * 2. EmailLog PENDING with the rendered subject, committed on its own
 * 3. render the body and call the provider, then SENT with the provider's message id
 *    or FAILED with the error (a missing template fails the row like a send error)
 *
 * Never throws: callers sit on event-handling paths that must not be undone by
 * a mail problem.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final MemberDirectory memberDirectory;
    private final TemplateRenderer templateRenderer;
    private final EmailProvider emailProvider;
    private final EmailLogService emailLogService;
    private final NotificationMetrics metrics;

    public DispatchResult dispatch(EmailMessage message) {
        String templateName = message.getTemplate().getTemplateName();
        try {
            if (!message.isExplicitlyRequested() && message.getUserId() != null) {
                NotificationPreferences preferences = memberDirectory.preferencesFor(message.getUserId());
                if (!message.getTemplate().getCategory().isAllowedBy(preferences)) {
                    log.info("Suppressed {} email for member {}: {} notifications disabled",
                            templateName, message.getUserId(), message.getTemplate().getCategory());
                    metrics.recordSuppressed(templateName);
                    return DispatchResult.suppressed(
                        message.getTemplate().getCategory() + " notifications disabled by member");
                }
            }

            String subject = templateRenderer.subject(message.getTemplate(), message.getModel());
            EmailLog pending = emailLogService.createPending(message.getUserId(), message.getRecipient(),
                    subject, templateName, emailProvider.name());

            try {
                RenderedEmail email = templateRenderer.render(message.getTemplate(), message.getModel());
                String providerMessageId = emailProvider.send(
                    message.getRecipient(), email.getSubject(), email.getHtml(), email.getText());
                emailLogService.markSent(pending.getId(), providerMessageId);
                metrics.recordSent(templateName);
                log.info("Sent {} email to {} (log {})", templateName, message.getRecipient(), pending.getId());
                return DispatchResult.sent(pending.getId());

            } catch (RuntimeException e) {
                emailLogService.markFailed(pending.getId(), e.getMessage());
                metrics.recordFailed(templateName);
                log.warn("Failed to send {} email to {} (log {}): {}",
                        templateName, message.getRecipient(), pending.getId(), e.getMessage());
                return DispatchResult.failed(pending.getId(), e.getMessage());
            }

        } catch (RuntimeException e) {
            metrics.recordFailed(templateName);
            log.error("Could not dispatch {} email to {}: {}", templateName, message.getRecipient(), e.getMessage(), e);
            return DispatchResult.failed(null, e.getMessage());
        }
    }
}
