package com.flagship.member_payments.member;

import lombok.Value;

/**
 * Email switches a member controls. {@code emailEnabled} is the master switch.
 */
@Value
public class NotificationPreferences {
    boolean emailEnabled;
    boolean emailPayments;
    boolean emailStatements;

    /**
     * Members who never saved preferences receive everything.
     */
    public static NotificationPreferences defaults() {
        return new NotificationPreferences(true, true, true);
    }
}
