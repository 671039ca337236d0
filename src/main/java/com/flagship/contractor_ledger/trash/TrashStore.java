package com.flagship.contractor_ledger.trash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.contractor_ledger.allocation.AllocationStore;
import com.flagship.contractor_ledger.allocation.PaymentAllocation;
import com.flagship.contractor_ledger.category.CategoryStore;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyStore;
import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.project.ProjectStore;
import com.flagship.contractor_ledger.transaction.LedgerTransaction;
import com.flagship.contractor_ledger.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Deletes entities together with everything that depends on them and keeps the removed rows as
 * one restorable trash entry.
 *
 * Cascade rules:
 * - company: its client projects, every transaction referencing the company or one of those
 *   projects, and every allocation touching those transactions
 * - project: its transactions and their allocations
 * - transaction: its allocations, on either side
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class TrashStore {

    private static final String COLUMNS = "id, entry_type, label, data, deleted_at";

    private final JdbcTemplate jdbcTemplate;
    private final CompanyStore companyStore;
    private final ProjectStore projectStore;
    private final CategoryStore categoryStore;
    private final TransactionStore transactionStore;
    private final AllocationStore allocationStore;
    private final LedgerTransactionBoundary boundary;
    private final ObjectMapper objectMapper;

    public TrashEntry moveCompanyToTrash(UUID companyId) {
        Company company = companyStore.getById(companyId);
        List<Project> projects = projectStore.findByClientCompany(companyId);
        List<UUID> projectIds = new ArrayList<>();
        projects.forEach(project -> projectIds.add(project.getId()));
        List<LedgerTransaction> transactions = transactionStore.findReferencing(companyId, projectIds);

        TrashBundle bundle = TrashBundle.builder()
            .company(company)
            .projects(projects)
            .transactions(transactions)
            .allocations(allocationStore.findTouching(idsOf(transactions)))
            .build();

        TrashEntry entry = moveToTrash(TrashType.COMPANY, company.getName(), bundle);
        log.info("Company moved to trash with {} project(s) and {} transaction(s)",
            projects.size(), transactions.size());
        return entry;
    }

    public TrashEntry moveProjectToTrash(UUID projectId) {
        Project project = projectStore.getById(projectId);
        List<LedgerTransaction> transactions = transactionStore.findByProject(projectId);

        TrashBundle bundle = TrashBundle.builder()
            .project(project)
            .transactions(transactions)
            .allocations(allocationStore.findTouching(idsOf(transactions)))
            .build();

        return moveToTrash(TrashType.PROJECT, project.getCode() + " " + project.getName(), bundle);
    }

    public TrashEntry moveTransactionToTrash(UUID transactionId) {
        LedgerTransaction transaction = transactionStore.getById(transactionId);

        TrashBundle bundle = TrashBundle.builder()
            .transaction(transaction)
            .allocations(allocationStore.findTouching(List.of(transactionId)))
            .build();

        return moveToTrash(TrashType.TRANSACTION, transaction.getDescription(), bundle);
    }

    /**
     * Puts every row of the entry back with its original id and removes the entry.
     *
     * @throws ConstraintViolationException if a row already exists again, a parent is gone, or
     *         restoring an allocation would over-allocate an invoice or payment
     */
    public TrashBundle restore(UUID trashId) {
        TrashEntry entry = getById(trashId);
        TrashBundle bundle = readBundle(entry);

        Set<UUID> restoredCompanies = new HashSet<>();
        for (Company company : bundle.getCompanies()) {
            if (companyStore.exists(company.getId())) {
                throw new ConstraintViolationException("Company in the trash entry already exists");
            }
            companyStore.insert(company);
            restoredCompanies.add(company.getId());
        }

        for (Project project : bundle.getProjects()) {
            if (projectStore.findById(project.getId()).isPresent()) {
                throw new ConstraintViolationException("Project in the trash entry already exists");
            }
            if (projectStore.findByCode(project.getCode()).isPresent()) {
                throw new ConstraintViolationException("Project code is already in use: " + project.getCode());
            }
            if (project.getClientCompanyId() != null
                && !restoredCompanies.contains(project.getClientCompanyId())
                && !companyStore.exists(project.getClientCompanyId())) {
                throw new ConstraintViolationException("Client company of the project no longer exists");
            }
            projectStore.insert(project);
        }

        for (LedgerTransaction transaction : bundle.getTransactions()) {
            if (transactionStore.findById(transaction.getId()).isPresent()) {
                throw new ConstraintViolationException("Transaction in the trash entry already exists");
            }
            if (transaction.getCompanyId() != null && !companyStore.exists(transaction.getCompanyId())) {
                throw new ConstraintViolationException("Company of the transaction no longer exists");
            }
            if (transaction.getProjectId() != null && projectStore.findById(transaction.getProjectId()).isEmpty()) {
                throw new ConstraintViolationException("Project of the transaction no longer exists");
            }
            transactionStore.insert(withLiveReferences(transaction));
        }

        restoreAllocations(bundle.getAllocations());
        purge(trashId);
        log.info("Restored {} trash entry", entry.getType().code());
        return bundle;
    }

    public void purge(UUID trashId) {
        boundary.recordMutation();
        int deleted = jdbcTemplate.update("DELETE FROM trash WHERE id = ?", trashId);
        if (deleted == 0) {
            throw NotFoundException.of("Trash entry", trashId);
        }
    }

    public int empty() {
        boundary.recordMutation();
        int deleted = jdbcTemplate.update("DELETE FROM trash");
        log.info("Emptied trash: {} entr(ies) purged", deleted);
        return deleted;
    }

    public void insert(TrashEntry entry) {
        boundary.recordMutation();
        jdbcTemplate.update(
            "INSERT INTO trash (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getType().code(),
            entry.getLabel(),
            entry.getData(),
            Timestamp.from(entry.getDeletedAt())
        );
    }

    public Optional<TrashEntry> findById(UUID id) {
        List<TrashEntry> entries = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM trash WHERE id = ?", trashRowMapper(), id);
        return entries.stream().findFirst();
    }

    public TrashEntry getById(UUID id) {
        return findById(id).orElseThrow(() -> NotFoundException.of("Trash entry", id));
    }

    /**
     * Trash entries, most recently deleted first.
     */
    public List<TrashEntry> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM trash ORDER BY deleted_at DESC, id", trashRowMapper());
    }

    public List<TrashEntry> findAllOrderedById() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM trash ORDER BY id", trashRowMapper());
    }

    public TrashBundle readBundle(TrashEntry entry) {
        try {
            return objectMapper.readValue(entry.getData(), TrashBundle.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Trash entry holds an unreadable bundle", e);
        }
    }

    private TrashEntry moveToTrash(TrashType type, String label, TrashBundle bundle) {
        TrashEntry entry = TrashEntry.builder()
            .id(UUID.randomUUID())
            .type(type)
            .label(label)
            .data(writeBundle(bundle))
            .deletedAt(Instant.now())
            .build();

        boundary.recordMutation();
        for (LedgerTransaction transaction : bundle.getTransactions()) {
            jdbcTemplate.update("DELETE FROM payment_allocations WHERE payment_id = ? OR invoice_id = ?",
                transaction.getId(), transaction.getId());
        }
        for (LedgerTransaction transaction : bundle.getTransactions()) {
            jdbcTemplate.update("DELETE FROM transactions WHERE id = ?", transaction.getId());
        }
        for (Project project : bundle.getProjects()) {
            jdbcTemplate.update("DELETE FROM projects WHERE id = ?", project.getId());
        }
        for (Company company : bundle.getCompanies()) {
            jdbcTemplate.update("DELETE FROM companies WHERE id = ?", company.getId());
        }

        insert(entry);
        return entry;
    }

    private void restoreAllocations(List<PaymentAllocation> allocations) {
        int restored = 0;
        for (PaymentAllocation allocation : allocations) {
            Optional<LedgerTransaction> payment = transactionStore.findById(allocation.getPaymentId());
            Optional<LedgerTransaction> invoice = transactionStore.findById(allocation.getInvoiceId());
            if (payment.isEmpty() || invoice.isEmpty()) {
                // Counterpart deleted separately and not part of this entry
                continue;
            }

            BigDecimal invoiceTotal = allocationStore.sumForInvoice(allocation.getInvoiceId())
                .add(allocation.getAmount());
            BigDecimal paymentTotal = allocationStore.sumForPayment(allocation.getPaymentId())
                .add(allocation.getAmount());
            if (invoiceTotal.compareTo(invoice.get().getAmountInBase()) > 0) {
                throw new ConstraintViolationException("Restoring would over-allocate an invoice");
            }
            if (paymentTotal.compareTo(payment.get().getAmountInBase()) > 0) {
                throw new ConstraintViolationException("Restoring would over-allocate a payment");
            }

            allocationStore.insert(allocation);
            restored++;
        }
        log.debug("Restored {} of {} allocation(s)", restored, allocations.size());
    }

    /**
     * Drops references to a category or legacy invoice that no longer exist.
     */
    private LedgerTransaction withLiveReferences(LedgerTransaction transaction) {
        LedgerTransaction.LedgerTransactionBuilder builder = transaction.toBuilder();
        if (transaction.getCategoryId() != null && categoryStore.findById(transaction.getCategoryId()).isEmpty()) {
            builder.categoryId(null);
        }
        if (transaction.getLinkedInvoiceId() != null
            && transactionStore.findById(transaction.getLinkedInvoiceId()).isEmpty()) {
            builder.linkedInvoiceId(null);
        }
        return builder.build();
    }

    private String writeBundle(TrashBundle bundle) {
        try {
            return objectMapper.writeValueAsString(bundle);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize trash bundle", e);
        }
    }

    private static List<UUID> idsOf(List<LedgerTransaction> transactions) {
        List<UUID> ids = new ArrayList<>();
        transactions.forEach(transaction -> ids.add(transaction.getId()));
        return ids;
    }

    private RowMapper<TrashEntry> trashRowMapper() {
        return (rs, rowNum) -> TrashEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .type(TrashType.fromCode(rs.getString("entry_type")))
            .label(rs.getString("label"))
            .data(rs.getString("data"))
            .deletedAt(rs.getTimestamp("deleted_at").toInstant())
            .build();
    }
}
