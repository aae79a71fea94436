package com.flagship.member_payments.health;

import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.QueueMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain health endpoint for liveness/readiness probes: database connectivity
 * plus a summary of the document generation queue.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final GenerationQueueService queueService;
    private final Clock clock;

    public HealthController(DataSource dataSource, GenerationQueueService queueService, Clock clock) {
        this.dataSource = dataSource;
        this.queueService = queueService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        QueueMetrics queue = queueService.metrics();
        Map<String, Object> queueSummary = new LinkedHashMap<>();
        queueSummary.put("pendingJobs", queue.getPendingJobs());
        queueSummary.put("activeJobs", queue.getActiveJobs());
        queueSummary.put("failedJobs", queue.getFailedJobs());
        queueSummary.put("completedJobs", queue.getCompletedJobs());
        response.put("generationQueue", queueSummary);

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
