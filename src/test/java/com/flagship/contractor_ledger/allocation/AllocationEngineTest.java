package com.flagship.contractor_ledger.allocation;

import com.flagship.contractor_ledger.LedgerFixtures;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionScope;
import com.flagship.contractor_ledger.transaction.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation tests: try to over-settle invoices and payments.
 *
 * These tests verify:
 * - FIFO auto-allocation settles the oldest invoice first and never skips one
 * - A rejected allocation batch leaves the previous allocations untouched
 * - Payments only settle counterpart invoices of their own project or company
 */
@SpringBootTest
@ActiveProfiles("test")
class AllocationEngineTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private LedgerFixtures fixtures;
    private Company customer;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(ledgerService, jdbcTemplate);
        fixtures.reset();
        customer = fixtures.customer("Kuzey Yapi");
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private TransactionDetails autoPayment(TransactionType type, String amount, LocalDate date) {
        return ledgerService.createPaymentWithAutoAllocation(
            LedgerFixtures.request(TransactionScope.CARI, customer.getId(), null, type, amount, date));
    }

    private BigDecimal allocatedTo(UUID invoiceId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM payment_allocations WHERE invoice_id = ?",
            BigDecimal.class, invoiceId);
    }

    @Test
    @DisplayName("Two payments auto-allocate over one invoice and leave the excess unallocated")
    void testAutoAllocationSettlesInvoiceAndLeavesRemainder() {
        printTestHeader("Auto Allocation Over One Invoice");

        // Given: An outgoing invoice of 10000
        TransactionDetails invoice = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "10000",
            LocalDate.of(2024, 1, 10));
        printInput("Invoice", invoice.getAmountInBase());

        // When: A payment of 6000 is recorded with auto-allocation
        TransactionDetails first = autoPayment(TransactionType.PAYMENT_IN, "6000", LocalDate.of(2024, 2, 1));
        printOutput("First payment allocated", first.getAllocatedAmount());

        // Then: All of it goes to the invoice, leaving 4000 open
        assertEquals(0, first.getAllocatedAmount().compareTo(new BigDecimal("6000.00")));
        List<OpenInvoice> open = ledgerService.getOpenInvoices(customer.getId(), EntityKind.COMPANY,
            TransactionType.INVOICE_OUT);
        assertEquals(1, open.size());
        assertEquals(0, open.get(0).getRemaining().compareTo(new BigDecimal("4000.00")));

        // When: A second payment of 5000 is recorded
        TransactionDetails second = autoPayment(TransactionType.PAYMENT_IN, "5000", LocalDate.of(2024, 3, 1));
        printOutput("Second payment allocated", second.getAllocatedAmount());
        printOutput("Second payment unallocated", second.getUnallocatedAmount());

        // Then: Only the remaining 4000 is allocated and the invoice is closed
        assertEquals(0, second.getAllocatedAmount().compareTo(new BigDecimal("4000.00")));
        assertEquals(0, second.getUnallocatedAmount().compareTo(new BigDecimal("1000.00")));
        assertEquals(0, allocatedTo(invoice.getTransaction().getId()).compareTo(new BigDecimal("10000.00")));
        assertTrue(ledgerService.getOpenInvoices(customer.getId(), EntityKind.COMPANY,
            TransactionType.INVOICE_OUT).isEmpty(), "Fully settled invoice should not be open");
        printSuccess("Invoice settled by two payments, 1000 left unallocated");
    }

    @Test
    @DisplayName("FIFO never skips an older invoice to reach a newer one")
    void testFifoDoesNotSkipOlderInvoices() {
        printTestHeader("FIFO Without Skipping");

        // Given: Three invoices recorded out of date order
        TransactionDetails newest = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "2000",
            LocalDate.of(2024, 1, 3));
        TransactionDetails oldest = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "1000",
            LocalDate.of(2024, 1, 1));
        TransactionDetails middle = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "500",
            LocalDate.of(2024, 1, 2));

        // When: A payment of 1200 is auto-allocated
        TransactionDetails payment = autoPayment(TransactionType.PAYMENT_IN, "1200", LocalDate.of(2024, 1, 5));
        List<AllocationDetails> allocations = ledgerService.getAllocationsForPayment(payment.getTransaction().getId());
        printOutput("Allocations", allocations.size());

        // Then: The oldest is fully covered, the middle gets the rest, the newest nothing
        assertEquals(2, allocations.size());
        assertEquals(0, allocatedTo(oldest.getTransaction().getId()).compareTo(new BigDecimal("1000.00")));
        assertEquals(0, allocatedTo(middle.getTransaction().getId()).compareTo(new BigDecimal("200.00")));
        assertEquals(0, allocatedTo(newest.getTransaction().getId()).compareTo(BigDecimal.ZERO));
        printSuccess("Oldest invoice covered before any newer one");
    }

    @Test
    @DisplayName("Invoices dated the same day are settled in the order they were recorded")
    void testSameDayInvoicesFollowRecordingOrder() {
        printTestHeader("Same-Day Tie Break");

        LocalDate day = LocalDate.of(2024, 4, 1);
        TransactionDetails firstRecorded = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "300", day);
        TransactionDetails secondRecorded = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "300", day);

        autoPayment(TransactionType.PAYMENT_IN, "300", day);

        assertEquals(0, allocatedTo(firstRecorded.getTransaction().getId()).compareTo(new BigDecimal("300.00")));
        assertEquals(0, allocatedTo(secondRecorded.getTransaction().getId()).compareTo(BigDecimal.ZERO));
        printSuccess("First recorded invoice settled first");
    }

    @Test
    @DisplayName("Suggesting allocations for an auto-allocated payment reproduces its current set")
    void testSuggestionIsStableForAllocatedPayment() {
        printTestHeader("Stable Suggestion");

        fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "1000", LocalDate.of(2024, 1, 1));
        fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "1000", LocalDate.of(2024, 1, 2));
        TransactionDetails payment = autoPayment(TransactionType.PAYMENT_IN, "1500", LocalDate.of(2024, 1, 3));
        UUID paymentId = payment.getTransaction().getId();

        List<AllocationRequest> suggestion = ledgerService.suggestAllocations(paymentId);
        printOutput("Suggestion", suggestion);

        List<PaymentAllocation> replaced = ledgerService.setAllocationsForPayment(paymentId, suggestion);
        assertEquals(2, replaced.size());
        assertEquals(0, ledgerService.getTransaction(paymentId).getAllocatedAmount()
            .compareTo(new BigDecimal("1500.00")));
        printSuccess("Applying the suggestion keeps the allocation unchanged");
    }

    @Test
    @DisplayName("A batch over-allocating one invoice is rejected and prior allocations survive")
    void testOverAllocatingBatchIsRejected() {
        printTestHeader("Over-Allocating Batch");

        // Given: An invoice of 1000 with 600 already settled by another payment
        TransactionDetails invoice = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "1000",
            LocalDate.of(2024, 1, 1));
        UUID invoiceId = invoice.getTransaction().getId();
        TransactionDetails firstPayment = fixtures.cari(customer.getId(), TransactionType.PAYMENT_IN, "600",
            LocalDate.of(2024, 1, 2));
        ledgerService.setAllocationsForPayment(firstPayment.getTransaction().getId(),
            List.of(AllocationRequest.of(invoiceId, new BigDecimal("600"))));

        TransactionDetails secondPayment = fixtures.cari(customer.getId(), TransactionType.PAYMENT_IN, "800",
            LocalDate.of(2024, 1, 3));

        // When: Two lines of 300 each target the same invoice (600 against 400 remaining)
        List<AllocationRequest> batch = List.of(
            AllocationRequest.of(invoiceId, new BigDecimal("300")),
            AllocationRequest.of(invoiceId, new BigDecimal("300")));
        printInput("Batch", batch);

        ConstraintViolationException e = assertThrows(ConstraintViolationException.class,
            () -> ledgerService.setAllocationsForPayment(secondPayment.getTransaction().getId(), batch));
        printExpectedException("ConstraintViolationException", e.getMessage());

        // Then: The invoice still carries only the first payment's 600
        assertEquals(0, allocatedTo(invoiceId).compareTo(new BigDecimal("600.00")));
        List<AllocationDetails> onInvoice = ledgerService.getAllocationsForInvoice(invoiceId);
        assertEquals(1, onInvoice.size());
        assertEquals(firstPayment.getTransaction().getId(), onInvoice.get(0).getPaymentId());
        printSuccess("Rejected batch left previous allocations unchanged");
    }

    @Test
    @DisplayName("Allocations larger than the payment itself are rejected")
    void testAllocationsExceedingPaymentAreRejected() {
        printTestHeader("Payment Over-Allocation");

        TransactionDetails invoice = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "1000",
            LocalDate.of(2024, 1, 1));
        TransactionDetails payment = fixtures.cari(customer.getId(), TransactionType.PAYMENT_IN, "500",
            LocalDate.of(2024, 1, 2));

        ConstraintViolationException e = assertThrows(ConstraintViolationException.class,
            () -> ledgerService.setAllocationsForPayment(payment.getTransaction().getId(),
                List.of(AllocationRequest.of(invoice.getTransaction().getId(), new BigDecimal("600")))));
        printExpectedException("ConstraintViolationException", e.getMessage());
        assertEquals("Allocations exceed the payment amount", e.getMessage());
    }

    @Test
    @DisplayName("A payment cannot settle an invoice of the wrong direction")
    void testWrongInvoiceTypeIsRejected() {
        printTestHeader("Wrong Invoice Type");

        TransactionDetails incomingInvoice = fixtures.cari(customer.getId(), TransactionType.INVOICE_IN, "1000",
            LocalDate.of(2024, 1, 1));
        TransactionDetails payment = fixtures.cari(customer.getId(), TransactionType.PAYMENT_IN, "500",
            LocalDate.of(2024, 1, 2));

        ValidationException e = assertThrows(ValidationException.class,
            () -> ledgerService.setAllocationsForPayment(payment.getTransaction().getId(),
                List.of(AllocationRequest.of(incomingInvoice.getTransaction().getId(), new BigDecimal("100")))));
        printExpectedException("ValidationException", e.getMessage());
    }

    @Test
    @DisplayName("Invoices cannot carry an allocation set of their own")
    void testInvoiceCannotBeAllocated() {
        printTestHeader("Allocation On Invoice");

        TransactionDetails invoice = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "1000",
            LocalDate.of(2024, 1, 1));

        assertThrows(ValidationException.class,
            () -> ledgerService.setAllocationsForPayment(invoice.getTransaction().getId(), List.of()));
    }

    @Test
    @DisplayName("A project payment cannot settle an invoice of another project")
    void testCrossProjectAllocationIsRejected() {
        printTestHeader("Cross-Project Allocation");

        // Given: Two own projects, an incoming invoice on the first
        Company supplier = fixtures.supplier("Demir Celik");
        Project first = fixtures.ownProject("Blok A");
        Project second = fixtures.ownProject("Blok B");
        TransactionDetails invoice = fixtures.onProject(first.getId(), supplier.getId(), TransactionType.INVOICE_IN,
            "1000", LocalDate.of(2024, 1, 1));
        TransactionDetails payment = fixtures.onProject(second.getId(), supplier.getId(), TransactionType.PAYMENT_OUT,
            "400", LocalDate.of(2024, 1, 2));

        // When/Then: Allocating the second project's payment to it fails
        ConstraintViolationException e = assertThrows(ConstraintViolationException.class,
            () -> ledgerService.setAllocationsForPayment(payment.getTransaction().getId(),
                List.of(AllocationRequest.of(invoice.getTransaction().getId(), new BigDecimal("400")))));
        printExpectedException("ConstraintViolationException", e.getMessage());
        assertEquals(0, allocatedTo(invoice.getTransaction().getId()).compareTo(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("A cari payment tagged with a project settles the company's cari invoices")
    void testCariPaymentWithProjectSettlesCompanyInvoices() {
        printTestHeader("Cari Payment Tagged With A Project");

        // Given: A cari invoice without a project, and an own project the payment is tagged with
        Project site = fixtures.ownProject("Santiye");
        TransactionDetails invoice = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "1000",
            LocalDate.of(2024, 1, 1));

        // When: A cari payment carrying the project is auto-allocated
        TransactionDetails auto = ledgerService.createPaymentWithAutoAllocation(
            LedgerFixtures.request(TransactionScope.CARI, customer.getId(), site.getId(), TransactionType.PAYMENT_IN,
                "400", LocalDate.of(2024, 1, 2)));
        printOutput("Auto allocated", auto.getAllocatedAmount());

        // And: A second one is recorded with an explicit line against the same invoice
        TransactionDetails manual = ledgerService.createPayment(
            LedgerFixtures.request(TransactionScope.CARI, customer.getId(), site.getId(), TransactionType.PAYMENT_IN,
                "400", LocalDate.of(2024, 1, 3)),
            List.of(AllocationRequest.of(invoice.getTransaction().getId(), new BigDecimal("400"))));
        printOutput("Manually allocated", manual.getAllocatedAmount());

        // Then: Both settle the company's invoice
        assertEquals(0, auto.getAllocatedAmount().compareTo(new BigDecimal("400.00")));
        assertEquals(0, manual.getAllocatedAmount().compareTo(new BigDecimal("400.00")));
        assertEquals(0, allocatedTo(invoice.getTransaction().getId()).compareTo(new BigDecimal("800.00")));
        printSuccess("Project tag on a cari payment does not restrict its invoices");
    }

    @Test
    @DisplayName("Recording a payment with rejected allocations records nothing")
    void testPaymentAndAllocationsAreAtomic() {
        printTestHeader("Atomic Payment With Allocations");

        TransactionDetails invoice = fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "100",
            LocalDate.of(2024, 1, 1));
        Integer before = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class);

        assertThrows(ConstraintViolationException.class, () -> ledgerService.createPayment(
            LedgerFixtures.request(TransactionScope.CARI, customer.getId(), null, TransactionType.PAYMENT_IN,
                "500", LocalDate.of(2024, 1, 2)),
            List.of(AllocationRequest.of(invoice.getTransaction().getId(), new BigDecimal("500")))));

        Integer after = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class);
        printOutput("Transactions before/after", before + "/" + after);
        assertEquals(before, after, "The payment must not be recorded when its allocations fail");
        printSuccess("Payment rolled back with its allocations");
    }

    @Test
    @DisplayName("Open invoices are only listed for invoice types")
    void testOpenInvoicesRequireInvoiceType() {
        assertThrows(ValidationException.class, () -> ledgerService.getOpenInvoices(customer.getId(),
            EntityKind.COMPANY, TransactionType.PAYMENT_IN));
    }

    @Test
    @DisplayName("Preview proposes the same FIFO split without writing anything")
    void testPreviewWritesNothing() {
        printTestHeader("Preview Auto Allocation");

        fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "700", LocalDate.of(2024, 1, 1));
        fixtures.cari(customer.getId(), TransactionType.INVOICE_OUT, "700", LocalDate.of(2024, 1, 2));

        List<AllocationRequest> preview = ledgerService.previewAutoAllocation(customer.getId(), EntityKind.COMPANY,
            TransactionType.INVOICE_OUT, new BigDecimal("1000"));
        printOutput("Preview", preview);

        assertEquals(2, preview.size());
        assertEquals(0, preview.get(0).getAmount().compareTo(new BigDecimal("700.00")));
        assertEquals(0, preview.get(1).getAmount().compareTo(new BigDecimal("300.00")));
        Integer allocations = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM payment_allocations", Integer.class);
        assertEquals(0, allocations);
    }
}
