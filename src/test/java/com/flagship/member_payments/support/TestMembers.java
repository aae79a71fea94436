package com.flagship.member_payments.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.UUID;

/**
 * Seeds the members and notification_preferences tables, which the identity
 * service owns in production.
 */
public final class TestMembers {

    public static final String INTRASTATE = "27";
    public static final String INTERSTATE = "29";

    private TestMembers() {
    }

    public static UUID insert(JdbcTemplate jdbcTemplate, String fullName, String stateCode) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO members (id, full_name, email, phone, pan, address, state_code) VALUES (?, ?, ?, ?, ?, ?, ?)",
            id, fullName, id.toString().substring(0, 8) + "@members.example.org", "+91 98200 00000",
            "ABCDE1234F", "12 Marine Drive, Mumbai", stateCode);
        return id;
    }

    public static UUID insert(JdbcTemplate jdbcTemplate) {
        return insert(jdbcTemplate, "Asha Rao", INTRASTATE);
    }

    public static void preferences(JdbcTemplate jdbcTemplate, UUID userId,
                                   boolean emailEnabled, boolean emailPayments, boolean emailStatements) {
        jdbcTemplate.update(
            "INSERT INTO notification_preferences (user_id, email_enabled, email_payments, email_statements) " +
            "VALUES (?, ?, ?, ?) ON CONFLICT (user_id) DO UPDATE SET email_enabled = EXCLUDED.email_enabled, " +
            "email_payments = EXCLUDED.email_payments, email_statements = EXCLUDED.email_statements",
            userId, emailEnabled, emailPayments, emailStatements);
    }

    public static String emailOf(JdbcTemplate jdbcTemplate, UUID userId) {
        return jdbcTemplate.queryForObject("SELECT email FROM members WHERE id = ?", String.class, userId);
    }
}
