package com.flagship.contractor_ledger.observability;

import com.flagship.contractor_ledger.persistence.IntegrityChecker;
import com.flagship.contractor_ledger.persistence.IntegrityReport;
import com.flagship.contractor_ledger.persistence.IntegrityViolation;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ledger health indicators exposed through the actuator health endpoint.
 */
public class HealthIndicators {

    /**
     * Runs the diagnostic integrity and foreign key scans.
     * Down if any stored row breaks a ledger invariant.
     */
    @Component("ledgerIntegrity")
    public static class LedgerIntegrityHealthIndicator implements HealthIndicator {

        private final IntegrityChecker integrityChecker;

        public LedgerIntegrityHealthIndicator(IntegrityChecker integrityChecker) {
            this.integrityChecker = integrityChecker;
        }

        @Override
        public Health health() {
            try {
                IntegrityReport report = integrityChecker.checkAll();
                List<IntegrityViolation> integrity = report.getIntegrityViolations();
                List<IntegrityViolation> foreignKeys = report.getDanglingReferences();

                Map<String, Integer> byCheck = new TreeMap<>();
                integrity.forEach(violation -> byCheck.merge(violation.getCheck(), 1, Integer::sum));
                foreignKeys.forEach(violation -> byCheck.merge(violation.getCheck(), 1, Integer::sum));

                Health.Builder builder = byCheck.isEmpty() ? Health.up() : Health.down();
                return builder
                        .withDetail("integrityViolations", integrity.size())
                        .withDetail("danglingReferences", foreignKeys.size())
                        .withDetail("violationsByCheck", byCheck)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Reports whether changes are waiting for the next backup. Always up.
     */
    @Component("ledgerBackup")
    public static class BackupHealthIndicator implements HealthIndicator {

        private final LedgerTransactionBoundary boundary;

        public BackupHealthIndicator(LedgerTransactionBoundary boundary) {
            this.boundary = boundary;
        }

        @Override
        public Health health() {
            return Health.up()
                    .withDetail("pendingChanges", boundary.isDirty())
                    .withDetail("state", boundary.getState().name())
                    .build();
        }
    }
}
