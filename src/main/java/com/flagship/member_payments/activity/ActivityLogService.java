package com.flagship.member_payments.activity;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only member activity timeline.
 *
 * Entries are written in the caller's transaction, so an activity row exists
 * exactly when the change it describes committed.
 */
@Service
public class ActivityLogService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ActivityLogService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Transactional
    public UUID record(UUID userId, ActivityType type, String entityType, UUID entityId, String description) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO activity_logs (id, user_id, activity_type, entity_type, entity_id, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            id,
            userId,
            type.name(),
            entityType,
            entityId,
            description,
            Timestamp.from(clock.instant())
        );
        return id;
    }

    /**
     * Timeline for a member, newest first, optionally narrowed by type and [from, to).
     */
    @Transactional(readOnly = true)
    public List<ActivityLog> findForUser(UUID userId, ActivityType type, Instant from, Instant to) {
        StringBuilder sql = new StringBuilder(
            "SELECT id, user_id, activity_type, entity_type, entity_id, description, created_at " +
            "FROM activity_logs WHERE user_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(userId);
        if (type != null) {
            sql.append(" AND activity_type = ?");
            args.add(type.name());
        }
        if (from != null) {
            sql.append(" AND created_at >= ?");
            args.add(Timestamp.from(from));
        }
        if (to != null) {
            sql.append(" AND created_at < ?");
            args.add(Timestamp.from(to));
        }
        sql.append(" ORDER BY created_at DESC");
        return jdbcTemplate.query(sql.toString(), activityRowMapper(), args.toArray());
    }

    @Transactional(readOnly = true)
    public List<ActivityLog> findForEntity(UUID entityId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, activity_type, entity_type, entity_id, description, created_at " +
            "FROM activity_logs WHERE entity_id = ? ORDER BY created_at",
            activityRowMapper(),
            entityId
        );
    }

    private RowMapper<ActivityLog> activityRowMapper() {
        return (rs, rowNum) -> new ActivityLog(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            ActivityType.valueOf(rs.getString("activity_type")),
            rs.getString("entity_type"),
            rs.getObject("entity_id", UUID.class),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
