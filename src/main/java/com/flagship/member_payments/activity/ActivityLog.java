package com.flagship.member_payments.activity;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a member's activity timeline.
 */
@Value
public class ActivityLog {
    UUID id;
    UUID userId;
    ActivityType activityType;
    String entityType;
    UUID entityId;
    String description;
    Instant createdAt;
}
