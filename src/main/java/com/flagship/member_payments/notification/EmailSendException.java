package com.flagship.member_payments.notification;

/**
 * The email provider rejected or could not accept a message.
 */
public class EmailSendException extends RuntimeException {

    public EmailSendException(String message) {
        super(message);
    }

    public EmailSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
