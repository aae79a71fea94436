package com.flagship.member_payments.member;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to member identity and notification preferences.
 */
public interface MemberDirectory {

    Optional<MemberProfile> findMember(UUID userId);

    /**
     * Never empty: members without a stored record get {@link NotificationPreferences#defaults()}.
     */
    NotificationPreferences preferencesFor(UUID userId);
}
