package com.flagship.member_payments.notification;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of one dispatch. SUPPRESSED results carry no EmailLog id.
 */
@Value
public class DispatchResult {

    public enum Status {
        SENT,
        FAILED,
        SUPPRESSED
    }

    Status status;
    UUID emailLogId;
    String error;

    public static DispatchResult sent(UUID emailLogId) {
        return new DispatchResult(Status.SENT, emailLogId, null);
    }

    public static DispatchResult failed(UUID emailLogId, String error) {
        return new DispatchResult(Status.FAILED, emailLogId, error);
    }

    public static DispatchResult suppressed(String reason) {
        return new DispatchResult(Status.SUPPRESSED, null, reason);
    }
}
