package com.flagship.contractor_ledger.balance;

import com.flagship.contractor_ledger.LedgerFixtures;
import com.flagship.contractor_ledger.allocation.AllocationRequest;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionFilter;
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
 * Summary tests: the same stored transactions read through the company, project and
 * firm-wide views.
 */
@SpringBootTest
@ActiveProfiles("test")
class LedgerSummaryServiceTest {

    @Autowired
    private LedgerSummaryService summaryService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private LedgerFixtures fixtures;
    private Company client;
    private Project project;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(ledgerService, jdbcTemplate);
        fixtures.reset();
        client = fixtures.customer("Marmara Konut");
        project = fixtures.clientProject("Marmara Sitesi", client.getId(), new BigDecimal("50000"));
    }

    @Test
    @DisplayName("Company and project views disagree on an unallocated payment")
    void testViewsOnUnallocatedPayment() {
        fixtures.onProject(project.getId(), client.getId(), TransactionType.INVOICE_OUT, "10000",
            LocalDate.of(2024, 1, 1));
        fixtures.onProject(project.getId(), client.getId(), TransactionType.PAYMENT_IN, "6000",
            LocalDate.of(2024, 1, 15));

        CompanyLedger companyLedger = summaryService.companyLedger(client.getId());
        ProjectLedger projectLedger = summaryService.projectLedger(project.getId());

        assertEquals(0, companyLedger.getReceivable().compareTo(new BigDecimal("4000.00")));
        assertEquals(0, projectLedger.getIndependentPaymentIn().compareTo(new BigDecimal("6000.00")));
        assertEquals(0, projectLedger.getTotalIncome().compareTo(new BigDecimal("16000.00")));
        assertEquals(0, projectLedger.getClientReceivable().compareTo(new BigDecimal("10000.00")));
    }

    @Test
    @DisplayName("Allocating the payment moves it from independent income to settled receivable")
    void testViewsOnAllocatedPayment() {
        TransactionDetails invoice = fixtures.onProject(project.getId(), client.getId(), TransactionType.INVOICE_OUT,
            "10000", LocalDate.of(2024, 1, 1));
        TransactionDetails payment = fixtures.onProject(project.getId(), client.getId(), TransactionType.PAYMENT_IN,
            "6000", LocalDate.of(2024, 1, 15));
        ledgerService.setAllocationsForPayment(payment.getTransaction().getId(),
            List.of(AllocationRequest.of(invoice.getTransaction().getId(), new BigDecimal("6000"))));

        ProjectLedger projectLedger = summaryService.projectLedger(project.getId());
        CompanyLedger companyLedger = summaryService.companyLedger(client.getId());

        assertEquals(0, projectLedger.getClientReceivable().compareTo(new BigDecimal("4000.00")));
        assertEquals(0, projectLedger.getIndependentPaymentIn().compareTo(BigDecimal.ZERO));
        assertEquals(0, projectLedger.getTotalIncome().compareTo(new BigDecimal("10000.00")));
        assertEquals(0, companyLedger.getReceivable().compareTo(new BigDecimal("4000.00")));
    }

    @Test
    @DisplayName("Dashboard receivables only sum companies that owe money")
    void testDashboardStatsReceivables() {
        Company prepaid = fixtures.customer("On Odemeli");
        Company supplier = fixtures.supplier("Beton AS");
        fixtures.cari(client.getId(), TransactionType.INVOICE_OUT, "1000", LocalDate.of(2024, 1, 1));
        fixtures.cari(prepaid.getId(), TransactionType.PAYMENT_IN, "300", LocalDate.of(2024, 1, 1));
        fixtures.cari(supplier.getId(), TransactionType.INVOICE_IN, "800", LocalDate.of(2024, 1, 1));
        fixtures.cari(supplier.getId(), TransactionType.PAYMENT_OUT, "200", LocalDate.of(2024, 1, 2));

        DashboardStats stats = summaryService.dashboardStats();

        assertEquals(0, stats.getTotalReceivables().compareTo(new BigDecimal("1000.00")));
        assertEquals(0, stats.getTotalPayables().compareTo(new BigDecimal("600.00")));
        assertEquals(3, stats.getActiveCompanies());
        assertEquals(1, stats.getTotalProjects());
        assertEquals(0, stats.getTotals().getNetCash().compareTo(new BigDecimal("100.00")));
    }

    @Test
    @DisplayName("Companies without transactions are listed with a zero balance")
    void testCompaniesWithBalance() {
        fixtures.cari(client.getId(), TransactionType.INVOICE_OUT, "250", LocalDate.of(2024, 1, 1));
        Company idle = fixtures.supplier("Bos Firma");

        List<CompanyBalance> balances = summaryService.companiesWithBalance();

        assertEquals(2, balances.size());
        CompanyBalance idleBalance = balances.stream()
            .filter(balance -> balance.getCompany().getId().equals(idle.getId()))
            .findFirst()
            .orElseThrow();
        assertEquals(0, idleBalance.getLedger().getBalance().compareTo(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Transaction totals follow the listing filter")
    void testTransactionTotalsWithFilter() {
        fixtures.cari(client.getId(), TransactionType.INVOICE_OUT, "100", LocalDate.of(2024, 1, 1));
        fixtures.cari(client.getId(), TransactionType.INVOICE_OUT, "200", LocalDate.of(2024, 3, 1));

        TransactionTotals totals = summaryService.transactionTotals(TransactionFilter.builder()
            .startDate(LocalDate.of(2024, 2, 1))
            .build());

        assertEquals(1, totals.getCount());
        assertEquals(0, totals.getTotalIncome().compareTo(new BigDecimal("200.00")));
    }

    @Test
    @DisplayName("Ledgers of unknown entities are not found")
    void testUnknownEntity() {
        assertThrows(NotFoundException.class, () -> summaryService.companyLedger(UUID.randomUUID()));
        assertThrows(NotFoundException.class, () -> summaryService.projectLedger(UUID.randomUUID()));
    }
}
