package com.flagship.member_payments.notification;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Sends through Spring's {@link JavaMailSender}. Without {@code spring.mail.host}
 * no sender bean exists and every send fails with "Email provider not configured".
 */
@Component
@Slf4j
public class SmtpEmailProvider implements EmailProvider {

    static final String NOT_CONFIGURED = "Email provider not configured";

    private final ObjectProvider<JavaMailSender> mailSender;
    private final String from;

    public SmtpEmailProvider(ObjectProvider<JavaMailSender> mailSender,
                             @Value("${notifications.from:noreply@indiaangelforum.org}") String from) {
        this.mailSender = mailSender;
        this.from = from;
    }

    @Override
    public String name() {
        return "smtp";
    }

    @Override
    public String send(String to, String subject, String html, String text) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new EmailSendException(NOT_CONFIGURED);
        }
        try {
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(from);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(text, html);
            sender.send(message);
            return message.getMessageID();
        } catch (MessagingException | MailException e) {
            throw new EmailSendException("SMTP send to " + to + " failed: " + e.getMessage(), e);
        }
    }
}
