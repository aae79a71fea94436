package com.flagship.member_payments.statement;

public enum StatementStatus {
    GENERATING,
    READY
}
