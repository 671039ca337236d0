package com.flagship.contractor_ledger.persistence;

import lombok.Value;

import java.util.List;

/**
 * Both diagnostic scans, taken in one read transaction.
 */
@Value
public class IntegrityReport {
    List<IntegrityViolation> integrityViolations;
    List<IntegrityViolation> danglingReferences;

    public boolean isHealthy() {
        return integrityViolations.isEmpty() && danglingReferences.isEmpty();
    }

    public int totalViolations() {
        return integrityViolations.size() + danglingReferences.size();
    }
}
