package com.flagship.contractor_ledger.exception;

import com.flagship.contractor_ledger.persistence.IntegrityViolation;

import java.util.List;

/**
 * Raised by the diagnostic scans when stored data violates the ledger invariants.
 * Normal writes never raise it; they fail earlier with {@link ConstraintViolationException}.
 */
public class IntegrityException extends LedgerException {

    private final List<IntegrityViolation> violations;

    public IntegrityException(String message, List<IntegrityViolation> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<IntegrityViolation> getViolations() {
        return violations;
    }
}
