package com.flagship.contractor_ledger.ledger;

import com.flagship.contractor_ledger.allocation.AllocationDetails;
import com.flagship.contractor_ledger.allocation.AllocationEngine;
import com.flagship.contractor_ledger.allocation.AllocationRequest;
import com.flagship.contractor_ledger.allocation.EntityKind;
import com.flagship.contractor_ledger.allocation.OpenInvoice;
import com.flagship.contractor_ledger.allocation.PaymentAllocation;
import com.flagship.contractor_ledger.category.Category;
import com.flagship.contractor_ledger.category.CategoryStore;
import com.flagship.contractor_ledger.category.CategoryType;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyRequest;
import com.flagship.contractor_ledger.company.CompanyRole;
import com.flagship.contractor_ledger.company.CompanyStore;
import com.flagship.contractor_ledger.company.CompanyUpdate;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.project.ProjectRequest;
import com.flagship.contractor_ledger.project.ProjectStatus;
import com.flagship.contractor_ledger.project.ProjectStore;
import com.flagship.contractor_ledger.project.ProjectUpdate;
import com.flagship.contractor_ledger.transaction.LedgerTransaction;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionFilter;
import com.flagship.contractor_ledger.transaction.TransactionRequest;
import com.flagship.contractor_ledger.transaction.TransactionStore;
import com.flagship.contractor_ledger.transaction.TransactionType;
import com.flagship.contractor_ledger.transaction.TransactionUpdate;
import com.flagship.contractor_ledger.trash.TrashBundle;
import com.flagship.contractor_ledger.trash.TrashEntry;
import com.flagship.contractor_ledger.trash.TrashStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for the presentation layer.
 *
 * Every write runs as one ledger transaction, including multi-step writes such as recording a
 * payment together with its allocations: either every step lands or none does. Reads run through
 * the read boundary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerTransactionBoundary boundary;
    private final CompanyStore companyStore;
    private final ProjectStore projectStore;
    private final CategoryStore categoryStore;
    private final TransactionStore transactionStore;
    private final AllocationEngine allocationEngine;
    private final TrashStore trashStore;

    // ==================== Companies ====================

    public Company createCompany(CompanyRequest request) {
        return boundary.withTransaction(() -> companyStore.create(request));
    }

    public Company updateCompany(UUID id, CompanyUpdate update) {
        return boundary.withTransaction(() -> companyStore.update(id, update));
    }

    /**
     * Moves the company, its client projects and all their transactions to the trash as one entry.
     */
    public TrashEntry deleteCompany(UUID id) {
        return boundary.withTransaction(() -> trashStore.moveCompanyToTrash(id));
    }

    public Company getCompany(UUID id) {
        return boundary.withReadTransaction(() -> companyStore.getById(id));
    }

    public List<Company> listCompanies(CompanyRole role, boolean includeInactive) {
        return boundary.withReadTransaction(() -> companyStore.findAll(role, includeInactive));
    }

    // ==================== Projects ====================

    public Project createProject(ProjectRequest request) {
        return boundary.withTransaction(() -> projectStore.create(request));
    }

    public Project updateProject(UUID id, ProjectUpdate update) {
        return boundary.withTransaction(() -> projectStore.update(id, update));
    }

    public TrashEntry deleteProject(UUID id) {
        return boundary.withTransaction(() -> trashStore.moveProjectToTrash(id));
    }

    public Project getProject(UUID id) {
        return boundary.withReadTransaction(() -> projectStore.getById(id));
    }

    public List<Project> listProjects(ProjectStatus status, boolean includeInactive) {
        return boundary.withReadTransaction(() -> projectStore.findAll(status, includeInactive));
    }

    // ==================== Categories ====================

    public Category createCategory(String name, CategoryType type, String color) {
        return boundary.withTransaction(() -> categoryStore.create(name, type, color));
    }

    public Category updateCategory(UUID id, String name, String color) {
        return boundary.withTransaction(() -> categoryStore.update(id, name, color));
    }

    public void deleteCategory(UUID id) {
        boundary.inTransaction(() -> categoryStore.delete(id));
    }

    public List<Category> listCategories(CategoryType type) {
        return boundary.withReadTransaction(() -> categoryStore.findAll(type));
    }

    // ==================== Transactions ====================

    public TransactionDetails createTransaction(TransactionRequest request) {
        return boundary.withTransaction(() -> {
            LedgerTransaction created = transactionStore.create(request);
            return transactionStore.getDetails(created.getId());
        });
    }

    /**
     * Records a payment and sets its allocations in the same transaction. If the allocations are
     * rejected the payment is not recorded either.
     */
    public TransactionDetails createPayment(TransactionRequest request, List<AllocationRequest> allocations) {
        requirePaymentType(request);
        return boundary.withTransaction(() -> {
            LedgerTransaction payment = transactionStore.create(request);
            allocationEngine.setAllocationsForPayment(payment.getId(), allocations);
            return transactionStore.getDetails(payment.getId());
        });
    }

    /**
     * Records a payment and allocates it oldest invoice first over the open counterpart invoices
     * of its project (project scope) or company. Whatever the invoices cannot absorb stays
     * unallocated.
     */
    public TransactionDetails createPaymentWithAutoAllocation(TransactionRequest request) {
        requirePaymentType(request);
        return boundary.withTransaction(() -> {
            LedgerTransaction payment = transactionStore.create(request);
            List<AllocationRequest> allocations = allocationEngine.suggestAllocations(payment.getId());
            allocationEngine.setAllocationsForPayment(payment.getId(), allocations);
            log.info("Auto-allocated {} {} over {} invoice(s)",
                payment.getType().code(), payment.getAmountInBase(), allocations.size());
            return transactionStore.getDetails(payment.getId());
        });
    }

    public TransactionDetails updateTransaction(UUID id, TransactionUpdate update) {
        return boundary.withTransaction(() -> {
            transactionStore.update(id, update);
            return transactionStore.getDetails(id);
        });
    }

    /**
     * Moves the transaction and its allocations to the trash.
     */
    public TrashEntry deleteTransaction(UUID id) {
        return boundary.withTransaction(() -> trashStore.moveTransactionToTrash(id));
    }

    public TransactionDetails getTransaction(UUID id) {
        return boundary.withReadTransaction(() -> transactionStore.getDetails(id));
    }

    public List<TransactionDetails> listTransactions(TransactionFilter filter) {
        return boundary.withReadTransaction(() -> transactionStore.findDetails(filter));
    }

    // ==================== Allocations ====================

    public List<OpenInvoice> getOpenInvoices(UUID entityId, EntityKind entityKind,
                                             TransactionType invoiceType) {
        return boundary.withReadTransaction(() -> allocationEngine.getOpenInvoices(entityId, entityKind, invoiceType));
    }

    /**
     * FIFO proposal for a payment amount over an entity's open invoices. Nothing is written.
     */
    public List<AllocationRequest> previewAutoAllocation(UUID entityId, EntityKind entityKind,
                                                         TransactionType invoiceType,
                                                         BigDecimal paymentAmount) {
        List<OpenInvoice> open = getOpenInvoices(entityId, entityKind, invoiceType);
        return AllocationEngine.autoAllocateFifo(open, paymentAmount);
    }

    public List<AllocationRequest> suggestAllocations(UUID paymentId) {
        return boundary.withReadTransaction(() -> allocationEngine.suggestAllocations(paymentId));
    }

    public List<PaymentAllocation> setAllocationsForPayment(UUID paymentId, List<AllocationRequest> allocations) {
        return boundary.withTransaction(() -> allocationEngine.setAllocationsForPayment(paymentId, allocations));
    }

    public List<AllocationDetails> getAllocationsForPayment(UUID paymentId) {
        return boundary.withReadTransaction(() -> allocationEngine.getAllocationsForPayment(paymentId));
    }

    public List<AllocationDetails> getAllocationsForInvoice(UUID invoiceId) {
        return boundary.withReadTransaction(() -> allocationEngine.getAllocationsForInvoice(invoiceId));
    }

    // ==================== Trash ====================

    public List<TrashEntry> listTrash() {
        return boundary.withReadTransaction(trashStore::findAll);
    }

    public TrashBundle restoreFromTrash(UUID trashId) {
        return boundary.withTransaction(() -> trashStore.restore(trashId));
    }

    public void purgeFromTrash(UUID trashId) {
        boundary.inTransaction(() -> trashStore.purge(trashId));
    }

    public int emptyTrash() {
        return boundary.withTransaction(trashStore::empty);
    }

    private static void requirePaymentType(TransactionRequest request) {
        if (request.getType() == null || !request.getType().isPayment()) {
            throw new ValidationException("Only payments can carry allocations");
        }
    }
}
