package com.flagship.contractor_ledger.persistence;

import com.flagship.contractor_ledger.LedgerFixtures;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.exception.IntegrityException;
import com.flagship.contractor_ledger.exception.TransactionStateException;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.observability.HealthIndicators;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integrity scan tests. Corruption is written with raw SQL, bypassing the stores.
 */
@SpringBootTest
@ActiveProfiles("test")
class IntegrityCheckerTest {

    @Autowired
    private IntegrityChecker integrityChecker;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private HealthIndicators.LedgerIntegrityHealthIndicator integrityHealth;

    @Autowired
    private LedgerTransactionBoundary boundary;

    private LedgerFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(ledgerService, jdbcTemplate);
        fixtures.reset();
    }

    @AfterEach
    void tearDown() {
        fixtures.reset();
    }

    private void insertAllocation(UUID paymentId, UUID invoiceId, String amount) {
        jdbcTemplate.update(
            "INSERT INTO payment_allocations (id, payment_id, invoice_id, amount, created_at) VALUES (?, ?, ?, ?, ?)",
            UUID.randomUUID(), paymentId, invoiceId, new BigDecimal(amount), Timestamp.from(Instant.now()));
    }

    @Test
    @DisplayName("A ledger built through the stores is healthy")
    void testHealthyLedger() {
        Company client = fixtures.customer("Saglam");
        fixtures.cari(client.getId(), TransactionType.INVOICE_OUT, "100", LocalDate.of(2024, 1, 1));

        assertTrue(integrityChecker.checkIntegrity().isEmpty());
        assertTrue(integrityChecker.checkForeignKeys().isEmpty());
        assertDoesNotThrow(() -> integrityChecker.assertHealthy());
        assertEquals(Status.UP, integrityHealth.health().getStatus());
    }

    @Test
    @DisplayName("Over-allocated invoices and mismatched allocation types are reported")
    void testOverAllocationIsReported() {
        Company client = fixtures.customer("Bozuk");
        TransactionDetails invoice = fixtures.cari(client.getId(), TransactionType.INVOICE_OUT, "100",
            LocalDate.of(2024, 1, 1));
        TransactionDetails payment = fixtures.cari(client.getId(), TransactionType.PAYMENT_IN, "100",
            LocalDate.of(2024, 1, 2));
        TransactionDetails wrongSide = fixtures.cari(client.getId(), TransactionType.INVOICE_IN, "100",
            LocalDate.of(2024, 1, 3));

        insertAllocation(payment.getTransaction().getId(), invoice.getTransaction().getId(), "150");
        insertAllocation(invoice.getTransaction().getId(), wrongSide.getTransaction().getId(), "10");

        List<IntegrityViolation> violations = integrityChecker.checkIntegrity();

        assertTrue(violations.stream().anyMatch(v -> v.getCheck().equals("invoice_over_allocated")
            && v.getRowId().equals(invoice.getTransaction().getId())));
        assertTrue(violations.stream().anyMatch(v -> v.getCheck().equals("payment_over_allocated")));
        assertTrue(violations.stream().anyMatch(v -> v.getCheck().equals("allocation_type_mismatch")));

        IntegrityException e = assertThrows(IntegrityException.class, () -> integrityChecker.assertHealthy());
        assertEquals(violations.size(), e.getViolations().size());

        Health health = integrityHealth.health();
        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(violations.size(), health.getDetails().get("integrityViolations"));
    }

    @Test
    @DisplayName("Allocations pointing at missing transactions are reported as dangling")
    void testDanglingReferencesAreReported() {
        UUID missingPayment = UUID.randomUUID();
        UUID missingInvoice = UUID.randomUUID();

        jdbcTemplate.execute("SET REFERENTIAL_INTEGRITY FALSE");
        try {
            insertAllocation(missingPayment, missingInvoice, "10");
        } finally {
            jdbcTemplate.execute("SET REFERENTIAL_INTEGRITY TRUE");
        }

        try {
            List<IntegrityViolation> violations = integrityChecker.checkForeignKeys();

            assertEquals(2, violations.size());
            assertTrue(violations.stream().anyMatch(v -> v.getCheck().equals("missing_payment")));
            assertTrue(violations.stream().anyMatch(v -> v.getCheck().equals("missing_invoice")));
            assertTrue(violations.stream().allMatch(v -> v.getTable().equals("payment_allocations")));

            IntegrityReport report = integrityChecker.checkAll();
            assertFalse(report.isHealthy());
            assertTrue(report.getIntegrityViolations().isEmpty());
            assertEquals(2, report.getDanglingReferences().size());
        } finally {
            jdbcTemplate.update("DELETE FROM payment_allocations WHERE payment_id = ?", missingPayment);
        }
    }

    @Test
    @DisplayName("The combined scan waits for an open write and reports only committed state")
    void testCombinedScanWaitsForOpenWrite() throws Exception {
        Company client = fixtures.customer("Yarim Kalan");
        TransactionDetails invoice = fixtures.cari(client.getId(), TransactionType.INVOICE_OUT, "100",
            LocalDate.of(2024, 1, 1));
        TransactionDetails payment = fixtures.cari(client.getId(), TransactionType.PAYMENT_IN, "200",
            LocalDate.of(2024, 1, 2));

        CountDownLatch written = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = executor.submit(() -> boundary.inTransaction(() -> {
                insertAllocation(payment.getTransaction().getId(), invoice.getTransaction().getId(), "150");
                written.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(written.await(5, TimeUnit.SECONDS));

            Future<IntegrityReport> scan = executor.submit(() -> integrityChecker.checkAll());
            assertThrows(TimeoutException.class, () -> scan.get(200, TimeUnit.MILLISECONDS),
                "The scan must not run while a write is open");

            release.countDown();
            writer.get(5, TimeUnit.SECONDS);
            IntegrityReport report = scan.get(5, TimeUnit.SECONDS);

            assertTrue(report.getIntegrityViolations().stream()
                .anyMatch(v -> v.getCheck().equals("invoice_over_allocated")));
            assertTrue(report.getDanglingReferences().isEmpty());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("The combined scan cannot be nested inside an open transaction")
    void testCombinedScanRejectsNesting() {
        assertThrows(TransactionStateException.class,
            () -> boundary.inTransaction(() -> integrityChecker.checkAll()));
    }
}
