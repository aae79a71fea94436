package com.flagship.member_payments.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency-Key lookups for order creation.
 *
 * Redis answers repeated keys quickly; the unique idempotency_key column on
 * payments is the source of truth, so a Redis outage only costs a database read.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String REDIS_KEY_PREFIX = "member-payments:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the payment created earlier with this key, if any
     */
    public Optional<UUID> lookup(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key {} found in Redis", idempotencyKey);
            return cached;
        }

        Optional<UUID> stored = paymentRepository.findByIdempotencyKey(idempotencyKey).map(PaymentEntity::getId);
        stored.ifPresent(paymentId -> {
            log.debug("Idempotency key {} found in database", idempotencyKey);
            writeCache(idempotencyKey, paymentId);
        });
        return stored;
    }

    /**
     * Caches a key after its payment committed. The database row already holds it.
     */
    public void remember(String idempotencyKey, UUID paymentId) {
        writeCache(idempotencyKey, paymentId);
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }
}
