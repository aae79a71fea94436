package com.flagship.member_payments.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("Backoff doubles per attempt from the base delay")
    void doubles() {
        RetryPolicy policy = new RetryPolicy(5, 60_000, 3_600_000);

        assertEquals(Duration.ofMinutes(1), policy.backoff(1));
        assertEquals(Duration.ofMinutes(2), policy.backoff(2));
        assertEquals(Duration.ofMinutes(4), policy.backoff(3));
        assertEquals(Duration.ofMinutes(8), policy.backoff(4));
    }

    @Test
    @DisplayName("Backoff is capped and never overflows")
    void capped() {
        RetryPolicy policy = new RetryPolicy(5, 60_000, 3_600_000);

        assertEquals(Duration.ofHours(1), policy.backoff(7));
        assertEquals(Duration.ofHours(1), policy.backoff(100));
        assertEquals(Duration.ofHours(1), policy.backoff(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Zero base delay retries immediately")
    void zeroBase() {
        RetryPolicy policy = new RetryPolicy(3, 0, 0);
        Instant now = Instant.parse("2026-03-10T08:30:00Z");

        assertEquals(Duration.ZERO, policy.backoff(2));
        assertEquals(now, policy.nextRetryAt(2, now));
    }

    @Test
    @DisplayName("At least one attempt is required")
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1000, 1000));
    }
}
