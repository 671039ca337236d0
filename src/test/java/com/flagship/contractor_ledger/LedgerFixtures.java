package com.flagship.contractor_ledger;

import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyKind;
import com.flagship.contractor_ledger.company.CompanyRequest;
import com.flagship.contractor_ledger.company.CompanyRole;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.project.OwnershipType;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.project.ProjectRequest;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionRequest;
import com.flagship.contractor_ledger.transaction.TransactionScope;
import com.flagship.contractor_ledger.transaction.TransactionType;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Test data helpers shared by the integration tests.
 */
public class LedgerFixtures {

    private final LedgerService ledgerService;
    private final JdbcTemplate jdbcTemplate;

    public LedgerFixtures(LedgerService ledgerService, JdbcTemplate jdbcTemplate) {
        this.ledgerService = ledgerService;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Deletes everything but the default categories.
     */
    public void reset() {
        jdbcTemplate.update("DELETE FROM payment_allocations");
        jdbcTemplate.update("DELETE FROM trash");
        jdbcTemplate.update("UPDATE transactions SET linked_invoice_id = NULL");
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM projects");
        jdbcTemplate.update("DELETE FROM companies");
        jdbcTemplate.update("DELETE FROM categories WHERE is_default = FALSE");
    }

    public Company customer(String name) {
        return company(name, CompanyRole.CUSTOMER);
    }

    public Company supplier(String name) {
        return company(name, CompanyRole.SUPPLIER);
    }

    public Company company(String name, CompanyRole role) {
        return ledgerService.createCompany(CompanyRequest.builder()
            .kind(CompanyKind.ORGANIZATION)
            .role(role)
            .name(name)
            .build());
    }

    public Project ownProject(String name) {
        return ledgerService.createProject(ProjectRequest.builder()
            .name(name)
            .ownership(OwnershipType.OWN)
            .build());
    }

    public Project clientProject(String name, UUID clientId, BigDecimal budget) {
        return ledgerService.createProject(ProjectRequest.builder()
            .name(name)
            .ownership(OwnershipType.CLIENT)
            .clientCompanyId(clientId)
            .estimatedBudget(budget)
            .build());
    }

    public TransactionDetails cari(UUID companyId, TransactionType type, String amount, LocalDate date) {
        return ledgerService.createTransaction(request(TransactionScope.CARI, companyId, null, type, amount, date));
    }

    public TransactionDetails onProject(UUID projectId, UUID companyId, TransactionType type, String amount,
                                        LocalDate date) {
        return ledgerService.createTransaction(request(TransactionScope.PROJECT, companyId, projectId, type, amount, date));
    }

    public static TransactionRequest request(TransactionScope scope, UUID companyId, UUID projectId,
                                             TransactionType type, String amount, LocalDate date) {
        return TransactionRequest.builder()
            .scope(scope)
            .type(type)
            .companyId(companyId)
            .projectId(projectId)
            .date(date)
            .description(type.code() + " " + amount)
            .amount(new BigDecimal(amount))
            .build();
    }
}
