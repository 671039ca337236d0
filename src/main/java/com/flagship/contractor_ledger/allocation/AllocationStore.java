package com.flagship.contractor_ledger.allocation;

import com.flagship.contractor_ledger.common.Money;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import com.flagship.contractor_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * JDBC access to payment allocations. Holds no rules; {@link AllocationEngine} validates
 * before anything is written here.
 */
@Repository
@RequiredArgsConstructor
public class AllocationStore {

    private static final String COLUMNS = "id, payment_id, invoice_id, amount, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTransactionBoundary boundary;

    public BigDecimal sumForInvoice(UUID invoiceId) {
        return sum("SELECT COALESCE(SUM(amount), 0) FROM payment_allocations WHERE invoice_id = ?", invoiceId);
    }

    public BigDecimal sumForPayment(UUID paymentId) {
        return sum("SELECT COALESCE(SUM(amount), 0) FROM payment_allocations WHERE payment_id = ?", paymentId);
    }

    /**
     * What other payments have already settled on the invoice.
     */
    public BigDecimal sumForInvoiceExcludingPayment(UUID invoiceId, UUID paymentId) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM payment_allocations WHERE invoice_id = ? AND payment_id <> ?",
            BigDecimal.class, invoiceId, paymentId);
        return Money.round(total != null ? total : BigDecimal.ZERO);
    }

    public List<PaymentAllocation> findByPayment(UUID paymentId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM payment_allocations WHERE payment_id = ? ORDER BY created_at, id",
            allocationRowMapper(), paymentId);
    }

    /**
     * All allocations where either side is one of the given transactions.
     */
    public List<PaymentAllocation> findTouching(Collection<UUID> transactionIds) {
        Set<UUID> seen = new LinkedHashSet<>();
        List<PaymentAllocation> result = new ArrayList<>();
        for (UUID transactionId : transactionIds) {
            for (PaymentAllocation allocation : jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM payment_allocations WHERE payment_id = ? OR invoice_id = ? ORDER BY id",
                allocationRowMapper(), transactionId, transactionId)) {
                if (seen.add(allocation.getId())) {
                    result.add(allocation);
                }
            }
        }
        return result;
    }

    public List<PaymentAllocation> findAllOrderedById() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM payment_allocations ORDER BY id", allocationRowMapper());
    }

    public List<AllocationDetails> findDetailsForPayment(UUID paymentId) {
        return jdbcTemplate.query(
            "SELECT pa.id, pa.payment_id, pa.invoice_id, pa.amount, pa.created_at, "
                + "t.type, t.transaction_date, t.description, t.document_no, t.amount_in_base "
                + "FROM payment_allocations pa JOIN transactions t ON t.id = pa.invoice_id "
                + "WHERE pa.payment_id = ? ORDER BY t.transaction_date, t.sequence_number",
            detailsRowMapper(), paymentId);
    }

    public List<AllocationDetails> findDetailsForInvoice(UUID invoiceId) {
        return jdbcTemplate.query(
            "SELECT pa.id, pa.payment_id, pa.invoice_id, pa.amount, pa.created_at, "
                + "t.type, t.transaction_date, t.description, t.document_no, t.amount_in_base "
                + "FROM payment_allocations pa JOIN transactions t ON t.id = pa.payment_id "
                + "WHERE pa.invoice_id = ? ORDER BY t.transaction_date, t.sequence_number",
            detailsRowMapper(), invoiceId);
    }

    /**
     * Invoices of the given type on a company's account or a project with something left to settle,
     * oldest first.
     */
    public List<OpenInvoice> findOpenInvoices(UUID entityId, EntityKind entityKind, TransactionType invoiceType) {
        String entityColumn = entityKind == EntityKind.PROJECT ? "t.project_id" : "t.company_id";
        return jdbcTemplate.query(
            "SELECT t.id, t.type, t.transaction_date, t.sequence_number, t.description, t.document_no, "
                + "t.amount_in_base, c.name AS company_name, COALESCE(inv.total, 0) AS allocated_total "
                + "FROM transactions t "
                + "LEFT JOIN companies c ON c.id = t.company_id "
                + "LEFT JOIN (SELECT invoice_id, SUM(amount) AS total FROM payment_allocations GROUP BY invoice_id) inv "
                + "ON inv.invoice_id = t.id "
                + "WHERE " + entityColumn + " = ? AND t.type = ? "
                + "AND t.amount_in_base - COALESCE(inv.total, 0) > 0 "
                + "ORDER BY t.transaction_date ASC, t.sequence_number ASC, t.id ASC",
            (rs, rowNum) -> {
                BigDecimal amountInBase = rs.getBigDecimal("amount_in_base");
                BigDecimal allocated = Money.round(rs.getBigDecimal("allocated_total"));
                return OpenInvoice.builder()
                    .invoiceId(rs.getObject("id", UUID.class))
                    .type(TransactionType.fromCode(rs.getString("type")))
                    .date(rs.getDate("transaction_date").toLocalDate())
                    .sequenceNumber(rs.getLong("sequence_number"))
                    .description(rs.getString("description"))
                    .documentNo(rs.getString("document_no"))
                    .companyName(rs.getString("company_name"))
                    .amountInBase(amountInBase)
                    .allocatedTotal(allocated)
                    .remaining(Money.round(amountInBase.subtract(allocated)))
                    .build();
            },
            entityId, invoiceType.code());
    }

    public void deleteForPayment(UUID paymentId) {
        boundary.recordMutation();
        jdbcTemplate.update("DELETE FROM payment_allocations WHERE payment_id = ?", paymentId);
    }

    public void insert(PaymentAllocation allocation) {
        boundary.recordMutation();
        jdbcTemplate.update(
            "INSERT INTO payment_allocations (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?)",
            allocation.getId(),
            allocation.getPaymentId(),
            allocation.getInvoiceId(),
            allocation.getAmount(),
            Timestamp.from(allocation.getCreatedAt())
        );
    }

    private BigDecimal sum(String sql, UUID id) {
        BigDecimal total = jdbcTemplate.queryForObject(sql, BigDecimal.class, id);
        return Money.round(total != null ? total : BigDecimal.ZERO);
    }

    private RowMapper<PaymentAllocation> allocationRowMapper() {
        return (rs, rowNum) -> PaymentAllocation.builder()
            .id(rs.getObject("id", UUID.class))
            .paymentId(rs.getObject("payment_id", UUID.class))
            .invoiceId(rs.getObject("invoice_id", UUID.class))
            .amount(rs.getBigDecimal("amount"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();
    }

    private RowMapper<AllocationDetails> detailsRowMapper() {
        return (rs, rowNum) -> AllocationDetails.builder()
            .allocationId(rs.getObject("id", UUID.class))
            .paymentId(rs.getObject("payment_id", UUID.class))
            .invoiceId(rs.getObject("invoice_id", UUID.class))
            .amount(rs.getBigDecimal("amount"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .counterpartType(TransactionType.fromCode(rs.getString("type")))
            .counterpartDate(rs.getDate("transaction_date").toLocalDate())
            .counterpartDescription(rs.getString("description"))
            .counterpartDocumentNo(rs.getString("document_no"))
            .counterpartAmountInBase(rs.getBigDecimal("amount_in_base"))
            .build();
    }
}
