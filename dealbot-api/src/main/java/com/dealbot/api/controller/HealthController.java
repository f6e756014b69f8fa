package com.dealbot.api.controller;

import com.dealbot.core.mutex.JobMutexService;
import com.dealbot.core.scheduler.ChainState;
import com.dealbot.core.scheduler.DbAnchoredScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Liveness for load balancers, plus a detailed view with database connectivity and the scheduler
 * chains armed on this replica.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final Instant STARTED_AT = Instant.now();
    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;
    private final DbAnchoredScheduler scheduler;
    private final JobMutexService jobMutexService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(baseStatus());
    }

    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> response = baseStatus();
        response.put("uptime", formatUptime(Duration.between(STARTED_AT, Instant.now())));
        response.put("hostname", jobMutexService.getHostname());

        Set<String> jobNames = scheduler.getJobNames();
        Map<ChainState, Integer> chainStates = new EnumMap<>(ChainState.class);
        for (String jobName : jobNames) {
            chainStates.merge(scheduler.getState(jobName), 1, Integer::sum);
        }
        response.put("scheduledChains", jobNames.size());
        response.put("chainStates", chainStates);

        Map<String, Object> database = probeDatabase();
        response.put("database", database);
        if (!"UP".equals(database.get("status"))) {
            response.put("status", "DEGRADED");
        }
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> baseStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("service", "dealbot");
        status.put("timestamp", Instant.now().toString());
        return status;
    }

    private Map<String, Object> probeDatabase() {
        Map<String, Object> database = new LinkedHashMap<>();
        long startNanos = System.nanoTime();
        try (Connection connection = dataSource.getConnection()) {
            database.put("status", connection.isValid(DB_VALIDATION_TIMEOUT_SECONDS) ? "UP" : "DOWN");
            database.put("database", connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            log.warn("[HEALTH] Database check failed | error={}", e.getMessage());
            database.put("status", "DOWN");
            database.put("error", e.getMessage());
        }
        database.put("responseTimeMs", Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
        return database;
    }

    static String formatUptime(Duration uptime) {
        StringBuilder out = new StringBuilder();
        if (uptime.toDays() > 0) {
            out.append(uptime.toDays()).append("d ");
        }
        if (out.length() > 0 || uptime.toHoursPart() > 0) {
            out.append(uptime.toHoursPart()).append("h ");
        }
        if (out.length() > 0 || uptime.toMinutesPart() > 0) {
            out.append(uptime.toMinutesPart()).append("m ");
        }
        return out.append(uptime.toSecondsPart()).append('s').toString();
    }
}
