package com.flagship.contractor_ledger.health;

import com.flagship.contractor_ledger.persistence.IntegrityChecker;
import com.flagship.contractor_ledger.persistence.IntegrityReport;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Reports the database connection and whether the stored ledger passes its integrity scans.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final IntegrityChecker integrityChecker;

    public HealthController(DataSource dataSource, IntegrityChecker integrityChecker) {
        this.dataSource = dataSource;
        this.integrityChecker = integrityChecker;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        IntegrityReport report = integrityChecker.checkAll();
        response.put("integrity", report.isHealthy() ? "OK" : report.totalViolations() + " violation(s)");

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
