package com.flagship.member_payments.activity;

import com.flagship.member_payments.common.CsvWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/activity")
@RequiredArgsConstructor
public class ActivityController {

    private static final String USER_ID_HEADER = "X-User-Id";
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final ActivityLogService activityLogService;
    private final Clock clock;

    @Value("${documents.numbering.zone:Asia/Kolkata}")
    private String zone;

    @GetMapping
    public ResponseEntity<List<ActivityLog>> list(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(value = "type", required = false) ActivityType type,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(activityLogService.findForUser(userId, type, startOf(from), startOfNext(to)));
    }

    /**
     * Timeline as CSV: Date,Type,Description,Time,Entity Type,Entity ID.
     */
    @GetMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> export(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(value = "type", required = false) ActivityType type,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        ZoneId zoneId = ZoneId.of(zone);
        CsvWriter csv = CsvWriter.withHeader("Date", "Type", "Description", "Time", "Entity Type", "Entity ID");
        for (ActivityLog entry : activityLogService.findForUser(userId, type, startOf(from), startOfNext(to))) {
            ZonedDateTime at = entry.getCreatedAt().atZone(zoneId);
            csv.row(at.toLocalDate(), entry.getActivityType(), entry.getDescription(),
                    at.format(TIME), entry.getEntityType(), entry.getEntityId());
        }

        String filename = "activity-" + LocalDate.now(clock.withZone(zoneId)) + ".csv";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv.toString());
    }

    private Instant startOf(LocalDate date) {
        return date == null ? null : date.atStartOfDay(ZoneId.of(zone)).toInstant();
    }

    private Instant startOfNext(LocalDate date) {
        return date == null ? null : date.plusDays(1).atStartOfDay(ZoneId.of(zone)).toInstant();
    }
}
