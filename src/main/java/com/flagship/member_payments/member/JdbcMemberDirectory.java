package com.flagship.member_payments.member;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link MemberDirectory} over the members and notification_preferences tables.
 */
@Component
@RequiredArgsConstructor
public class JdbcMemberDirectory implements MemberDirectory {

    private static final RowMapper<MemberProfile> MEMBER_MAPPER = (rs, rowNum) -> new MemberProfile(
        rs.getObject("id", UUID.class),
        rs.getString("full_name"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("pan"),
        rs.getString("address"),
        rs.getString("state_code")
    );

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<MemberProfile> findMember(UUID userId) {
        List<MemberProfile> rows = jdbcTemplate.query(
            "SELECT id, full_name, email, phone, pan, address, state_code FROM members WHERE id = ?",
            MEMBER_MAPPER, userId);
        return rows.stream().findFirst();
    }

    @Override
    public NotificationPreferences preferencesFor(UUID userId) {
        List<NotificationPreferences> rows = jdbcTemplate.query(
            "SELECT email_enabled, email_payments, email_statements FROM notification_preferences WHERE user_id = ?",
            (rs, rowNum) -> new NotificationPreferences(
                rs.getBoolean("email_enabled"),
                rs.getBoolean("email_payments"),
                rs.getBoolean("email_statements")),
            userId);
        return rows.stream().findFirst().orElseGet(NotificationPreferences::defaults);
    }
}
