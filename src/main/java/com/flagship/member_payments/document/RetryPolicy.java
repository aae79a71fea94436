package com.flagship.member_payments.document;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff for failed generation attempts:
 * delay = min(base × 2^(attempts − 1), cap).
 */
@Component
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryPolicy(@Value("${documents.retry.max-attempts:5}") int maxAttempts,
                       @Value("${documents.retry.base-delay-ms:60000}") long baseDelayMs,
                       @Value("${documents.retry.max-delay-ms:3600000}") long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("documents.retry.max-attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attempts attempts made so far, including the one that just failed
     */
    public Duration backoff(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        if (baseDelayMs <= 0) {
            return Duration.ZERO;
        }
        // 2^exponent overflows long past 62; anything near that is far beyond the cap anyway
        if (exponent >= 62 || baseDelayMs > (maxDelayMs >> exponent)) {
            return Duration.ofMillis(maxDelayMs);
        }
        return Duration.ofMillis(Math.min(baseDelayMs << exponent, maxDelayMs));
    }

    public Instant nextRetryAt(int attempts, Instant now) {
        return now.plus(backoff(attempts));
    }
}
