package com.flagship.contractor_ledger.transaction;

import com.flagship.contractor_ledger.LedgerFixtures;
import com.flagship.contractor_ledger.allocation.AllocationRequest;
import com.flagship.contractor_ledger.category.Category;
import com.flagship.contractor_ledger.category.CategoryType;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyUpdate;
import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.project.Project;
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
 * Transaction tests: try to record or edit rows that would corrupt balances.
 *
 * These tests verify:
 * - The exchange rate is fixed at creation and cannot be edited
 * - Inactive counterparties and mismatched categories are rejected
 * - Amounts and references cannot drift out from under existing allocations
 */
@SpringBootTest
@ActiveProfiles("test")
class TransactionStoreTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private LedgerFixtures fixtures;
    private Company supplier;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(ledgerService, jdbcTemplate);
        fixtures.reset();
        supplier = fixtures.supplier("Anadolu Hirdavat");
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private TransactionRequest.TransactionRequestBuilder invoiceIn(String amount) {
        return TransactionRequest.builder()
            .scope(TransactionScope.CARI)
            .type(TransactionType.INVOICE_IN)
            .companyId(supplier.getId())
            .date(LocalDate.of(2024, 6, 1))
            .description("Rebar delivery")
            .amount(new BigDecimal(amount));
    }

    @Test
    @DisplayName("Foreign currency amounts are converted to base at the recorded rate")
    void testForeignCurrencyConversion() {
        TransactionDetails created = ledgerService.createTransaction(invoiceIn("100")
            .currency(CurrencyCode.USD)
            .exchangeRate(new BigDecimal("32.5"))
            .build());

        assertEquals(0, created.getAmountInBase().compareTo(new BigDecimal("3250.00")));
        assertEquals(0, created.getTransaction().getExchangeRate().compareTo(new BigDecimal("32.5")));
    }

    @Test
    @DisplayName("Base currency ignores a supplied exchange rate")
    void testBaseCurrencyRateIsOne() {
        TransactionDetails created = ledgerService.createTransaction(invoiceIn("100")
            .exchangeRate(new BigDecimal("5"))
            .build());

        assertEquals(CurrencyCode.TRY, created.getTransaction().getCurrency());
        assertEquals(0, created.getAmountInBase().compareTo(new BigDecimal("100.00")));
    }

    @Test
    @DisplayName("Foreign currency without a rate is rejected")
    void testForeignCurrencyRequiresRate() {
        assertThrows(ValidationException.class,
            () -> ledgerService.createTransaction(invoiceIn("100").currency(CurrencyCode.EUR).build()));
    }

    @Test
    @DisplayName("Changing the exchange rate after creation is rejected")
    void testExchangeRateIsLocked() {
        printTestHeader("Exchange Rate Lock");

        TransactionDetails created = ledgerService.createTransaction(invoiceIn("100")
            .currency(CurrencyCode.USD)
            .exchangeRate(new BigDecimal("30"))
            .build());
        UUID id = created.getTransaction().getId();

        ValidationException e = assertThrows(ValidationException.class,
            () -> ledgerService.updateTransaction(id, TransactionUpdate.builder()
                .exchangeRate(new BigDecimal("35"))
                .build()));
        printExpectedException("ValidationException", e.getMessage());

        // Repeating the stored rate is allowed and the amount recomputes at that rate
        TransactionDetails updated = ledgerService.updateTransaction(id, TransactionUpdate.builder()
            .exchangeRate(new BigDecimal("30.0000"))
            .amount(new BigDecimal("200"))
            .build());
        assertEquals(0, updated.getAmountInBase().compareTo(new BigDecimal("6000.00")));
    }

    @Test
    @DisplayName("Inactive companies cannot receive new transactions")
    void testInactiveCompanyIsRejected() {
        printTestHeader("Inactive Company");

        ledgerService.updateCompany(supplier.getId(), CompanyUpdate.builder().active(false).build());

        ConstraintViolationException e = assertThrows(ConstraintViolationException.class,
            () -> ledgerService.createTransaction(invoiceIn("100").build()));
        printExpectedException("ConstraintViolationException", e.getMessage());
    }

    @Test
    @DisplayName("A category must belong to the transaction's group")
    void testCategoryGroupMismatch() {
        Category paymentCategory = ledgerService.createCategory("Cek", CategoryType.PAYMENT, null);

        assertThrows(ValidationException.class,
            () -> ledgerService.createTransaction(invoiceIn("100").categoryId(paymentCategory.getId()).build()));

        Category invoiceCategory = ledgerService.createCategory("Demir", CategoryType.INVOICE_IN, "#112233");
        TransactionDetails created = ledgerService.createTransaction(
            invoiceIn("100").categoryId(invoiceCategory.getId()).build());
        assertEquals("Demir", created.getCategoryName());
        assertEquals("#112233", created.getCategoryColor());
    }

    @Test
    @DisplayName("Scope rules require the matching references")
    void testScopeReferences() {
        assertThrows(ValidationException.class, () -> ledgerService.createTransaction(invoiceIn("100")
            .companyId(null)
            .build()));
        assertThrows(ValidationException.class, () -> ledgerService.createTransaction(invoiceIn("100")
            .scope(TransactionScope.PROJECT)
            .build()));

        Project project = fixtures.ownProject("Depo");
        assertThrows(ValidationException.class, () -> ledgerService.createTransaction(invoiceIn("100")
            .scope(TransactionScope.COMPANY)
            .projectId(project.getId())
            .build()));

        TransactionDetails overhead = ledgerService.createTransaction(invoiceIn("100")
            .scope(TransactionScope.COMPANY)
            .companyId(null)
            .build());
        assertNull(overhead.getTransaction().getCompanyId());
    }

    @Test
    @DisplayName("Unknown references are not found")
    void testUnknownCompany() {
        assertThrows(NotFoundException.class, () -> ledgerService.createTransaction(invoiceIn("100")
            .companyId(UUID.randomUUID())
            .build()));
    }

    @Test
    @DisplayName("Amounts below one cent or not positive are rejected")
    void testInvalidAmounts() {
        assertThrows(ValidationException.class, () -> ledgerService.createTransaction(invoiceIn("0").build()));
        assertThrows(ValidationException.class, () -> ledgerService.createTransaction(invoiceIn("-5").build()));
        assertThrows(ValidationException.class, () -> ledgerService.createTransaction(invoiceIn("0.004").build()));
    }

    @Test
    @DisplayName("An allocated transaction keeps its amount above the allocated total")
    void testAmountCannotDropBelowAllocations() {
        printTestHeader("Amount Below Allocations");

        TransactionDetails invoice = ledgerService.createTransaction(invoiceIn("1000").build());
        TransactionDetails payment = fixtures.cari(supplier.getId(), TransactionType.PAYMENT_OUT, "800",
            LocalDate.of(2024, 6, 2));
        ledgerService.setAllocationsForPayment(payment.getTransaction().getId(),
            List.of(AllocationRequest.of(invoice.getTransaction().getId(), new BigDecimal("800"))));

        ConstraintViolationException e = assertThrows(ConstraintViolationException.class,
            () -> ledgerService.updateTransaction(invoice.getTransaction().getId(),
                TransactionUpdate.builder().amount(new BigDecimal("500")).build()));
        printExpectedException("ConstraintViolationException", e.getMessage());

        assertThrows(ConstraintViolationException.class,
            () -> ledgerService.updateTransaction(payment.getTransaction().getId(),
                TransactionUpdate.builder().type(TransactionType.PAYMENT_IN).build()));

        Company other = fixtures.supplier("Baska Tedarikci");
        assertThrows(ConstraintViolationException.class,
            () -> ledgerService.updateTransaction(payment.getTransaction().getId(),
                TransactionUpdate.builder().companyId(other.getId()).build()));
    }

    @Test
    @DisplayName("Listing is newest first and honours search and limit")
    void testListingOrderAndFilters() {
        ledgerService.createTransaction(invoiceIn("10").date(LocalDate.of(2024, 1, 1)).description("Cimento").build());
        ledgerService.createTransaction(invoiceIn("20").date(LocalDate.of(2024, 2, 1)).description("Kum").build());
        ledgerService.createTransaction(invoiceIn("30").date(LocalDate.of(2024, 2, 1)).description("Cakil").build());

        List<TransactionDetails> all = ledgerService.listTransactions(TransactionFilter.ALL);
        assertEquals(3, all.size());
        assertEquals("Cakil", all.get(0).getTransaction().getDescription());
        assertEquals("Cimento", all.get(2).getTransaction().getDescription());

        List<TransactionDetails> searched = ledgerService.listTransactions(
            TransactionFilter.builder().search("kUm").build());
        assertEquals(1, searched.size());

        List<TransactionDetails> limited = ledgerService.listTransactions(
            TransactionFilter.builder().limit(2).build());
        assertEquals(2, limited.size());
    }
}
