package com.flagship.contractor_ledger.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.contractor_ledger.allocation.AllocationStore;
import com.flagship.contractor_ledger.allocation.PaymentAllocation;
import com.flagship.contractor_ledger.category.Category;
import com.flagship.contractor_ledger.category.CategoryStore;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyStore;
import com.flagship.contractor_ledger.exception.IntegrityException;
import com.flagship.contractor_ledger.exception.TransactionStateException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.project.ProjectStore;
import com.flagship.contractor_ledger.transaction.LedgerTransaction;
import com.flagship.contractor_ledger.transaction.TransactionStore;
import com.flagship.contractor_ledger.trash.TrashEntry;
import com.flagship.contractor_ledger.trash.TrashStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exports the ledger as a snapshot and replaces it from one.
 *
 * Export rows are ordered by id and carry no export timestamp, so equal ledger state always
 * produces equal bytes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotService {

    private final LedgerTransactionBoundary boundary;
    private final SchemaMigrator schemaMigrator;
    private final IntegrityChecker integrityChecker;
    private final CompanyStore companyStore;
    private final ProjectStore projectStore;
    private final CategoryStore categoryStore;
    private final TransactionStore transactionStore;
    private final AllocationStore allocationStore;
    private final TrashStore trashStore;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public byte[] exportSnapshot() {
        return boundary.withReadTransaction(this::exportSnapshotInTransaction);
    }

    /**
     * Replaces the whole ledger with the snapshot's content, then replays any data migration the
     * snapshot's log does not list. All in one transaction.
     *
     * @throws ValidationException if the bytes are not a readable snapshot of a supported version
     * @throws IntegrityException if the loaded ledger breaks an invariant; nothing is kept
     */
    public void loadFromSnapshot(byte[] bytes) {
        LedgerSnapshot snapshot = parse(bytes);
        boundary.inTransaction(() -> replaceAll(snapshot));
        log.info("Loaded snapshot: {} companies, {} projects, {} transactions, {} allocations",
            snapshot.getCompanies().size(), snapshot.getProjects().size(),
            snapshot.getTransactions().size(), snapshot.getAllocations().size());
    }

    /**
     * Serializes the ledger as seen by the caller's already open transaction.
     */
    public byte[] exportSnapshotInTransaction() {
        if (!boundary.isInTransaction()) {
            throw new TransactionStateException("Snapshot export requires an open ledger transaction");
        }
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
            .format(LedgerSnapshot.FORMAT)
            .schemaVersion(schemaMigrator.currentVersion())
            .migrations(schemaMigrator.appliedMigrations())
            .companies(companyStore.findAllOrderedById())
            .categories(categoryStore.findAllOrderedById())
            .projects(projectStore.findAllOrderedById())
            .transactions(transactionStore.findAllOrderedById())
            .allocations(allocationStore.findAllOrderedById())
            .trash(trashStore.findAllOrderedById())
            .build();
        try {
            return objectMapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ledger snapshot", e);
        }
    }

    private LedgerSnapshot parse(byte[] bytes) {
        LedgerSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(bytes, LedgerSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Snapshot is not a readable ledger document: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot bytes", e);
        }
        if (!LedgerSnapshot.FORMAT.equals(snapshot.getFormat())) {
            throw new ValidationException("Unrecognized snapshot format: " + snapshot.getFormat());
        }
        if (snapshot.getSchemaVersion() > schemaMigrator.currentVersion()) {
            throw new ValidationException(String.format(
                "Snapshot schema version %d is newer than supported version %d",
                snapshot.getSchemaVersion(), schemaMigrator.currentVersion()));
        }
        return snapshot;
    }

    private void replaceAll(LedgerSnapshot snapshot) {
        boundary.recordMutation();
        jdbcTemplate.update("DELETE FROM payment_allocations");
        jdbcTemplate.update("DELETE FROM trash");
        jdbcTemplate.update("UPDATE transactions SET linked_invoice_id = NULL");
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM projects");
        jdbcTemplate.update("DELETE FROM categories");
        jdbcTemplate.update("DELETE FROM companies");

        try {
            snapshot.getCompanies().forEach(companyStore::insert);
            snapshot.getCategories().forEach(categoryStore::insert);
            snapshot.getProjects().forEach(projectStore::insert);

            List<LedgerTransaction> linked = new ArrayList<>();
            for (LedgerTransaction transaction : withSequenceNumbers(snapshot.getTransactions())) {
                transactionStore.insert(transaction.toBuilder().linkedInvoiceId(null).build());
                if (transaction.getLinkedInvoiceId() != null) {
                    linked.add(transaction);
                }
            }
            for (LedgerTransaction transaction : linked) {
                transactionStore.updateLinkedInvoice(transaction.getId(), transaction.getLinkedInvoiceId());
            }

            for (PaymentAllocation allocation : snapshot.getAllocations()) {
                allocationStore.insert(allocation);
            }
            for (TrashEntry entry : snapshot.getTrash()) {
                trashStore.insert(entry);
            }
        } catch (DataIntegrityViolationException e) {
            throw new ValidationException("Snapshot rows violate the ledger schema: "
                + e.getMostSpecificCause().getMessage());
        }

        schemaMigrator.replaceLog(snapshot.getMigrations());
        schemaMigrator.applyPendingDataMigrations();

        List<IntegrityViolation> violations = integrityChecker.scanAll();
        if (!violations.isEmpty()) {
            throw new IntegrityException(
                String.format("Snapshot breaks %d ledger invariant(s)", violations.size()), violations);
        }
    }

    /**
     * Snapshots written before sequence numbers existed carry zeros; number those rows by date
     * and creation time after the highest existing number.
     */
    private static List<LedgerTransaction> withSequenceNumbers(List<LedgerTransaction> transactions) {
        long next = transactions.stream().mapToLong(LedgerTransaction::getSequenceNumber).max().orElse(0L) + 1;

        List<LedgerTransaction> unnumbered = new ArrayList<>();
        List<LedgerTransaction> result = new ArrayList<>();
        for (LedgerTransaction transaction : transactions) {
            if (transaction.getSequenceNumber() > 0) {
                result.add(transaction);
            } else {
                unnumbered.add(transaction);
            }
        }
        unnumbered.sort(Comparator.comparing(LedgerTransaction::getDate)
            .thenComparing(LedgerTransaction::getCreatedAt));
        for (LedgerTransaction transaction : unnumbered) {
            result.add(transaction.toBuilder().sequenceNumber(next++).build());
        }
        return result;
    }
}
