package com.flagship.member_payments.notification;

public enum EmailStatus {
    PENDING,
    SENT,
    FAILED
}
