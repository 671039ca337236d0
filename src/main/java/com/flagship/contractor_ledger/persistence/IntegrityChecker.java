package com.flagship.contractor_ledger.persistence;

import com.flagship.contractor_ledger.exception.IntegrityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read-only diagnostic scans over the stored ledger. Findings are reported, never repaired.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntegrityChecker {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTransactionBoundary boundary;

    /**
     * Checks the ledger invariants: positive amounts, allocation limits on both sides,
     * allocation types, scope references, base amounts, project ownership and category groups.
     */
    public List<IntegrityViolation> checkIntegrity() {
        return boundary.withReadTransaction(this::scanIntegrity);
    }

    /**
     * Checks that every reference points at an existing row.
     */
    public List<IntegrityViolation> checkForeignKeys() {
        return boundary.withReadTransaction(this::scanForeignKeys);
    }

    /**
     * Runs both scans against the same committed state.
     */
    public IntegrityReport checkAll() {
        return boundary.withReadTransaction(() -> new IntegrityReport(scanIntegrity(), scanForeignKeys()));
    }

    /**
     * @throws IntegrityException listing every violation, if there are any
     */
    public void assertHealthy() {
        List<IntegrityViolation> violations = boundary.withReadTransaction(this::scanAll);
        if (!violations.isEmpty()) {
            throw new IntegrityException(
                String.format("Ledger integrity check found %d violation(s)", violations.size()), violations);
        }
    }

    List<IntegrityViolation> scanAll() {
        List<IntegrityViolation> violations = new ArrayList<>(scanForeignKeys());
        violations.addAll(scanIntegrity());
        return violations;
    }

    List<IntegrityViolation> scanIntegrity() {
        List<IntegrityViolation> violations = new ArrayList<>();

        find(violations, "non_positive_amount", "transactions",
            "SELECT id, 'amount ' || amount || ', base ' || amount_in_base AS detail FROM transactions "
                + "WHERE amount <= 0 OR amount_in_base <= 0");
        find(violations, "non_positive_amount", "payment_allocations",
            "SELECT id, 'amount ' || amount AS detail FROM payment_allocations WHERE amount <= 0");

        find(violations, "invoice_over_allocated", "transactions",
            "SELECT t.id, 'allocated ' || SUM(pa.amount) || ' of ' || t.amount_in_base AS detail "
                + "FROM transactions t JOIN payment_allocations pa ON pa.invoice_id = t.id "
                + "GROUP BY t.id, t.amount_in_base HAVING SUM(pa.amount) > t.amount_in_base");
        find(violations, "payment_over_allocated", "transactions",
            "SELECT t.id, 'allocated ' || SUM(pa.amount) || ' of ' || t.amount_in_base AS detail "
                + "FROM transactions t JOIN payment_allocations pa ON pa.payment_id = t.id "
                + "GROUP BY t.id, t.amount_in_base HAVING SUM(pa.amount) > t.amount_in_base");

        find(violations, "allocation_type_mismatch", "payment_allocations",
            "SELECT pa.id, p.type || ' -> ' || i.type AS detail FROM payment_allocations pa "
                + "JOIN transactions p ON p.id = pa.payment_id "
                + "JOIN transactions i ON i.id = pa.invoice_id "
                + "WHERE NOT ((p.type = 'payment_in' AND i.type = 'invoice_out') "
                + "OR (p.type = 'payment_out' AND i.type = 'invoice_in'))");

        find(violations, "scope_reference", "transactions",
            "SELECT id, 'scope ' || scope AS detail FROM transactions "
                + "WHERE (scope = 'project' AND project_id IS NULL) "
                + "OR (scope = 'cari' AND company_id IS NULL) "
                + "OR (scope = 'company' AND project_id IS NOT NULL)");

        find(violations, "base_amount_mismatch", "transactions",
            "SELECT id, amount || ' x ' || exchange_rate || ' <> ' || amount_in_base AS detail FROM transactions "
                + "WHERE ROUND(amount * exchange_rate, 2) <> amount_in_base "
                + "OR (currency = 'TRY' AND exchange_rate <> 1)");

        find(violations, "project_client_mismatch", "projects",
            "SELECT id, 'ownership ' || ownership AS detail FROM projects "
                + "WHERE (ownership = 'client' AND client_company_id IS NULL) "
                + "OR (ownership = 'own' AND client_company_id IS NOT NULL)");

        find(violations, "category_type_mismatch", "transactions",
            "SELECT t.id, t.type || ' in ' || c.type AS detail FROM transactions t "
                + "JOIN categories c ON c.id = t.category_id "
                + "WHERE NOT ((t.type = 'invoice_out' AND c.type = 'invoice_out') "
                + "OR (t.type = 'invoice_in' AND c.type = 'invoice_in') "
                + "OR (t.type IN ('payment_in', 'payment_out') AND c.type = 'payment'))");

        if (!violations.isEmpty()) {
            log.warn("Integrity scan found {} violation(s)", violations.size());
        }
        return violations;
    }

    List<IntegrityViolation> scanForeignKeys() {
        List<IntegrityViolation> violations = new ArrayList<>();

        find(violations, "missing_company", "transactions",
            "SELECT t.id, 'company_id' AS detail FROM transactions t "
                + "WHERE t.company_id IS NOT NULL AND NOT EXISTS (SELECT 1 FROM companies c WHERE c.id = t.company_id)");
        find(violations, "missing_project", "transactions",
            "SELECT t.id, 'project_id' AS detail FROM transactions t "
                + "WHERE t.project_id IS NOT NULL AND NOT EXISTS (SELECT 1 FROM projects p WHERE p.id = t.project_id)");
        find(violations, "missing_category", "transactions",
            "SELECT t.id, 'category_id' AS detail FROM transactions t "
                + "WHERE t.category_id IS NOT NULL AND NOT EXISTS (SELECT 1 FROM categories c WHERE c.id = t.category_id)");
        find(violations, "missing_linked_invoice", "transactions",
            "SELECT t.id, 'linked_invoice_id' AS detail FROM transactions t "
                + "WHERE t.linked_invoice_id IS NOT NULL "
                + "AND NOT EXISTS (SELECT 1 FROM transactions i WHERE i.id = t.linked_invoice_id)");
        find(violations, "missing_payment", "payment_allocations",
            "SELECT pa.id, 'payment_id' AS detail FROM payment_allocations pa "
                + "WHERE NOT EXISTS (SELECT 1 FROM transactions t WHERE t.id = pa.payment_id)");
        find(violations, "missing_invoice", "payment_allocations",
            "SELECT pa.id, 'invoice_id' AS detail FROM payment_allocations pa "
                + "WHERE NOT EXISTS (SELECT 1 FROM transactions t WHERE t.id = pa.invoice_id)");
        find(violations, "missing_client_company", "projects",
            "SELECT p.id, 'client_company_id' AS detail FROM projects p "
                + "WHERE p.client_company_id IS NOT NULL "
                + "AND NOT EXISTS (SELECT 1 FROM companies c WHERE c.id = p.client_company_id)");

        if (!violations.isEmpty()) {
            log.warn("Foreign key scan found {} dangling reference(s)", violations.size());
        }
        return violations;
    }

    private void find(List<IntegrityViolation> violations, String check, String table, String sql) {
        violations.addAll(jdbcTemplate.query(sql, (rs, rowNum) -> new IntegrityViolation(
            check, table, rs.getObject("id", UUID.class), rs.getString("detail"))));
    }
}
