package com.flagship.contractor_ledger.allocation;

import com.flagship.contractor_ledger.common.Money;
import com.flagship.contractor_ledger.company.CompanyStore;
import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.observability.LedgerMetrics;
import com.flagship.contractor_ledger.project.ProjectStore;
import com.flagship.contractor_ledger.transaction.LedgerTransaction;
import com.flagship.contractor_ledger.transaction.TransactionScope;
import com.flagship.contractor_ledger.transaction.TransactionStore;
import com.flagship.contractor_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Matches payments to the invoices they settle.
 *
 * A payment's allocation set is always replaced as a whole. The engine validates the complete
 * new set against the stored state before touching any row, so a rejected batch leaves the
 * previous allocations exactly as they were.
 *
 * Invariants protected here:
 * 1. Every allocation amount is positive
 * 2. No invoice is allocated beyond its base amount across all payments
 * 3. No payment allocates more than its own base amount
 * 4. A payment only settles invoices of its counterpart type
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationEngine {

    /** Oldest invoice first; invoices dated the same day in the order they were recorded. */
    static final Comparator<OpenInvoice> FIFO_ORDER = Comparator
        .comparing(OpenInvoice::getDate)
        .thenComparingLong(OpenInvoice::getSequenceNumber);

    private final AllocationStore allocationStore;
    private final TransactionStore transactionStore;
    private final CompanyStore companyStore;
    private final ProjectStore projectStore;
    private final LedgerMetrics metrics;

    /**
     * Invoices of the given type on a company account or a project that still have a remainder,
     * oldest first.
     *
     * @throws ValidationException if {@code invoiceType} is not an invoice type
     */
    public List<OpenInvoice> getOpenInvoices(UUID entityId, EntityKind entityKind, TransactionType invoiceType) {
        if (invoiceType == null || !invoiceType.isInvoice()) {
            throw new ValidationException("Open invoices can only be listed for invoice types");
        }
        if (entityKind == EntityKind.PROJECT) {
            projectStore.getById(entityId);
        } else {
            companyStore.getById(entityId);
        }
        return allocationStore.findOpenInvoices(entityId, entityKind, invoiceType);
    }

    /**
     * Proposes allocations for a payment amount, walking the invoices oldest first and giving
     * each as much as the payment has left. Pure: nothing is read or written.
     *
     * An invoice is only reached once every older invoice is fully covered.
     *
     * @throws ValidationException if the payment amount is not positive
     */
    public static List<AllocationRequest> autoAllocateFifo(List<OpenInvoice> openInvoices, BigDecimal paymentAmount) {
        if (paymentAmount == null || paymentAmount.signum() <= 0) {
            throw new ValidationException("Payment amount must be greater than zero");
        }

        List<OpenInvoice> ordered = new ArrayList<>(openInvoices);
        ordered.sort(FIFO_ORDER);

        BigDecimal remainingPayment = Money.round(paymentAmount);
        List<AllocationRequest> allocations = new ArrayList<>();
        for (OpenInvoice invoice : ordered) {
            if (remainingPayment.signum() <= 0) {
                break;
            }
            if (invoice.getRemaining() == null || invoice.getRemaining().signum() <= 0) {
                continue;
            }
            BigDecimal share = Money.round(remainingPayment.min(invoice.getRemaining()));
            if (share.signum() > 0) {
                allocations.add(AllocationRequest.of(invoice.getInvoiceId(), share));
                remainingPayment = remainingPayment.subtract(share);
            }
        }
        return List.copyOf(allocations);
    }

    /**
     * FIFO proposal for a recorded payment over its own open counterpart invoices: the project's
     * for a project payment, the company's otherwise. Amounts already allocated by this payment
     * are treated as free again, so the proposal can replace the current set directly.
     */
    public List<AllocationRequest> suggestAllocations(UUID paymentId) {
        LedgerTransaction payment = requirePayment(paymentId);

        UUID entityId;
        EntityKind entityKind;
        if (payment.getScope() == TransactionScope.PROJECT && payment.getProjectId() != null) {
            entityId = payment.getProjectId();
            entityKind = EntityKind.PROJECT;
        } else if (payment.getCompanyId() != null) {
            entityId = payment.getCompanyId();
            entityKind = EntityKind.COMPANY;
        } else {
            return List.of();
        }

        Map<UUID, BigDecimal> ownShares = new LinkedHashMap<>();
        for (PaymentAllocation allocation : allocationStore.findByPayment(paymentId)) {
            ownShares.put(allocation.getInvoiceId(), allocation.getAmount());
        }

        List<OpenInvoice> candidates = new ArrayList<>();
        for (OpenInvoice invoice : allocationStore.findOpenInvoices(entityId, entityKind, payment.getType().settledInvoiceType())) {
            BigDecimal ownShare = ownShares.remove(invoice.getInvoiceId());
            candidates.add(ownShare == null ? invoice : invoice.toBuilder().remaining(invoice.getRemaining().add(ownShare)).build());
        }
        // Invoices this payment fully settled are no longer "open" but are still candidates
        for (Map.Entry<UUID, BigDecimal> entry : ownShares.entrySet()) {
            LedgerTransaction invoice = transactionStore.getById(entry.getKey());
            if (isCandidate(invoice, payment, entityKind)) {
                candidates.add(OpenInvoice.builder()
                    .invoiceId(invoice.getId())
                    .type(invoice.getType())
                    .date(invoice.getDate())
                    .sequenceNumber(invoice.getSequenceNumber())
                    .description(invoice.getDescription())
                    .documentNo(invoice.getDocumentNo())
                    .amountInBase(invoice.getAmountInBase())
                    .remaining(entry.getValue())
                    .build());
            }
        }
        return autoAllocateFifo(candidates, payment.getAmountInBase());
    }

    /**
     * Replaces the payment's whole allocation set. Must run inside the ledger transaction.
     * Lines for the same invoice are merged into one allocation.
     *
     * @throws ValidationException if an amount is not positive or an invoice has the wrong type
     * @throws ConstraintViolationException if an invoice or the payment would be over-allocated,
     *         or an invoice belongs to a different project or company than the payment
     */
    public List<PaymentAllocation> setAllocationsForPayment(UUID paymentId, List<AllocationRequest> allocations) {
        MDC.put("paymentId", paymentId.toString());
        try {
            LedgerTransaction payment = requirePayment(paymentId);
            Map<UUID, BigDecimal> merged = validate(payment, allocations);

            allocationStore.deleteForPayment(paymentId);
            Instant now = Instant.now();
            List<PaymentAllocation> written = new ArrayList<>();
            for (Map.Entry<UUID, BigDecimal> entry : merged.entrySet()) {
                PaymentAllocation allocation = PaymentAllocation.builder()
                    .id(UUID.randomUUID())
                    .paymentId(paymentId)
                    .invoiceId(entry.getKey())
                    .amount(entry.getValue())
                    .createdAt(now)
                    .build();
                allocationStore.insert(allocation);
                written.add(allocation);
            }

            metrics.recordAllocationsReplaced(written.size());
            log.info("Payment allocations replaced: {} invoice(s)", written.size());
            return written;
        } finally {
            MDC.remove("paymentId");
        }
    }

    public List<AllocationDetails> getAllocationsForPayment(UUID paymentId) {
        requirePayment(paymentId);
        return allocationStore.findDetailsForPayment(paymentId);
    }

    public List<AllocationDetails> getAllocationsForInvoice(UUID invoiceId) {
        LedgerTransaction invoice = transactionStore.getById(invoiceId);
        if (!invoice.getType().isInvoice()) {
            throw new ValidationException("Transaction is not an invoice");
        }
        return allocationStore.findDetailsForInvoice(invoiceId);
    }

    private LedgerTransaction requirePayment(UUID paymentId) {
        LedgerTransaction payment = transactionStore.getById(paymentId);
        if (!payment.getType().allowsAllocation()) {
            throw new ValidationException("Allocations can only be set on payments");
        }
        return payment;
    }

    private Map<UUID, BigDecimal> validate(LedgerTransaction payment, List<AllocationRequest> allocations) {
        Map<UUID, BigDecimal> merged = new LinkedHashMap<>();
        for (AllocationRequest allocation : allocations) {
            if (allocation.getInvoiceId() == null) {
                throw new ValidationException("Allocation invoice is required");
            }
            if (allocation.getAmount() == null || allocation.getAmount().signum() <= 0) {
                throw new ValidationException("Allocation amount must be greater than zero");
            }
            BigDecimal amount = Money.round(allocation.getAmount());
            if (amount.signum() <= 0) {
                throw new ValidationException("Allocation amount must be at least 0.01");
            }
            merged.merge(allocation.getInvoiceId(), amount, BigDecimal::add);
        }

        TransactionType expectedInvoiceType = payment.getType().settledInvoiceType();
        BigDecimal total = Money.ZERO;
        for (Map.Entry<UUID, BigDecimal> entry : merged.entrySet()) {
            LedgerTransaction invoice = transactionStore.getById(entry.getKey());
            if (invoice.getType() != expectedInvoiceType) {
                throw new ValidationException(String.format(
                    "A %s payment can only settle %s invoices", payment.getType().code(), expectedInvoiceType.code()));
            }
            if (payment.getScope() == TransactionScope.PROJECT
                && !Objects.equals(payment.getProjectId(), invoice.getProjectId())) {
                throw new ConstraintViolationException("A project payment can only settle invoices of the same project");
            }
            if (payment.getScope() == TransactionScope.CARI
                && !Objects.equals(payment.getCompanyId(), invoice.getCompanyId())) {
                throw new ConstraintViolationException("A cari payment can only settle invoices of the same company");
            }

            BigDecimal available = invoice.getAmountInBase()
                .subtract(allocationStore.sumForInvoiceExcludingPayment(invoice.getId(), payment.getId()));
            if (entry.getValue().compareTo(available) > 0) {
                throw new ConstraintViolationException("Allocation exceeds invoice remaining balance");
            }
            total = total.add(entry.getValue());
        }

        if (total.compareTo(payment.getAmountInBase()) > 0) {
            throw new ConstraintViolationException("Allocations exceed the payment amount");
        }
        return merged;
    }

    private static boolean isCandidate(LedgerTransaction invoice, LedgerTransaction payment, EntityKind entityKind) {
        if (invoice.getType() != payment.getType().settledInvoiceType()) {
            return false;
        }
        return entityKind == EntityKind.PROJECT
            ? Objects.equals(invoice.getProjectId(), payment.getProjectId())
            : Objects.equals(invoice.getCompanyId(), payment.getCompanyId());
    }
}
