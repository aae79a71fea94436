package com.flagship.member_payments.document;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * Allocates document numbers of the form PREFIX-YYYY-MM-NNNNN.
 *
 * One counter row per (prefix, month). The upsert increments it atomically and
 * holds the row lock until the surrounding transaction ends, so concurrent
 * allocations in the same month are serialized and a rolled-back allocation
 * does not burn a number.
 */
@Component
@Slf4j
public class DocumentSequenceAllocator {

    public static final String INVOICE_PREFIX = "INV";
    public static final String STATEMENT_PREFIX = "FS";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final ZoneId zone;

    public DocumentSequenceAllocator(JdbcTemplate jdbcTemplate, Clock clock,
                                     @Value("${documents.numbering.zone:Asia/Kolkata}") String zone) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    @Transactional
    public String allocate(String prefix) {
        YearMonth period = YearMonth.now(clock.withZone(zone));
        Long value = jdbcTemplate.queryForObject(
            "INSERT INTO document_sequences (prefix, period, last_value, updated_at) " +
            "VALUES (?, ?, 1, now()) " +
            "ON CONFLICT (prefix, period) DO UPDATE " +
            "SET last_value = document_sequences.last_value + 1, updated_at = now() " +
            "RETURNING last_value",
            Long.class,
            prefix,
            period.toString()
        );
        if (value == null) {
            throw new IllegalStateException("Sequence upsert returned no value for " + prefix + " " + period);
        }
        String number = format(prefix, period, value);
        log.debug("Allocated document number {}", number);
        return number;
    }

    public static String format(String prefix, YearMonth period, long value) {
        if (value < 1) {
            throw new IllegalStateException(
                String.format("Sequence %s %s out of range: %d", prefix, period, value));
        }
        return String.format("%s-%s-%05d", prefix, period, value);
    }
}
