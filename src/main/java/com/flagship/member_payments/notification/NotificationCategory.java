package com.flagship.member_payments.notification;

import com.flagship.member_payments.member.NotificationPreferences;

/**
 * Preference bucket a template belongs to. SYSTEM mail (operator digests) is not
 * sent to members and ignores preferences.
 */
public enum NotificationCategory {
    PAYMENTS,
    STATEMENTS,
    SYSTEM;

    public boolean isAllowedBy(NotificationPreferences preferences) {
        return switch (this) {
            case PAYMENTS -> preferences.isEmailEnabled() && preferences.isEmailPayments();
            case STATEMENTS -> preferences.isEmailEnabled() && preferences.isEmailStatements();
            case SYSTEM -> true;
        };
    }
}
