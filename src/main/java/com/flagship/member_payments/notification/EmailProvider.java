package com.flagship.member_payments.notification;

/**
 * Outbound email transport.
 */
public interface EmailProvider {

    /**
     * Name recorded on EmailLog rows.
     */
    String name();

    /**
     * Sends one message.
     *
     * @return the provider's message id, may be null
     * @throws EmailSendException if the provider is not configured or rejects the message
     */
    String send(String to, String subject, String html, String text);
}
