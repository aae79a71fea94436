package com.flagship.member_payments.notification;

import lombok.Value;

@Value
public class RenderedEmail {
    String subject;
    String html;
    String text;
}
