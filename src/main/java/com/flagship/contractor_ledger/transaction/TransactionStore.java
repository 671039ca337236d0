package com.flagship.contractor_ledger.transaction;

import com.flagship.contractor_ledger.allocation.AllocationStore;
import com.flagship.contractor_ledger.category.Category;
import com.flagship.contractor_ledger.category.CategoryStore;
import com.flagship.contractor_ledger.common.Money;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyStore;
import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.project.ProjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC store for invoices and payments.
 *
 * Every write re-asserts the cross-entity rules the caller cannot check alone:
 * scope references, active counterparties, category group, the locked exchange rate and
 * amounts that stay above what is already allocated.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class TransactionStore {

    private static final int RATE_SCALE = 4;

    static final String COLUMNS =
        "t.id, t.sequence_number, t.scope, t.company_id, t.project_id, t.type, t.category_id, t.transaction_date, "
            + "t.description, t.amount, t.currency, t.exchange_rate, t.amount_in_base, t.document_no, t.notes, "
            + "t.linked_invoice_id, t.created_at, t.updated_at";

    private static final String DETAILS_SELECT =
        "SELECT " + COLUMNS + ", c.name AS company_name, p.name AS project_name, "
            + "cat.name AS category_name, cat.color AS category_color, "
            + "COALESCE(pay.total, 0) AS payment_allocated, COALESCE(inv.total, 0) AS invoice_allocated "
            + "FROM transactions t "
            + "LEFT JOIN companies c ON c.id = t.company_id "
            + "LEFT JOIN projects p ON p.id = t.project_id "
            + "LEFT JOIN categories cat ON cat.id = t.category_id "
            + "LEFT JOIN (SELECT payment_id, SUM(amount) AS total FROM payment_allocations GROUP BY payment_id) pay "
            + "ON pay.payment_id = t.id "
            + "LEFT JOIN (SELECT invoice_id, SUM(amount) AS total FROM payment_allocations GROUP BY invoice_id) inv "
            + "ON inv.invoice_id = t.id";

    private final JdbcTemplate jdbcTemplate;
    private final CompanyStore companyStore;
    private final ProjectStore projectStore;
    private final CategoryStore categoryStore;
    private final AllocationStore allocationStore;
    private final LedgerTransactionBoundary boundary;

    /**
     * Records a new invoice or payment.
     *
     * @throws ValidationException for malformed input or a mismatched category
     * @throws NotFoundException if a referenced company, project or category does not exist
     * @throws ConstraintViolationException if a referenced company or project is inactive
     */
    public LedgerTransaction create(TransactionRequest request) {
        if (request.getType() == null || request.getScope() == null) {
            throw new ValidationException("Transaction type and scope are required");
        }
        if (request.getDate() == null) {
            throw new ValidationException("Transaction date is required");
        }
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            throw new ValidationException("Transaction description is required");
        }
        validateReferences(request.getScope(), request.getType(),
            request.getCompanyId(), request.getProjectId(), request.getCategoryId());

        CurrencyCode currency = request.getCurrency() != null ? request.getCurrency() : CurrencyCode.BASE;
        BigDecimal exchangeRate = resolveExchangeRate(currency, request.getExchangeRate());
        BigDecimal amount = validAmount(request.getAmount());
        BigDecimal amountInBase = toBase(amount, exchangeRate);

        Instant now = Instant.now();
        LedgerTransaction transaction = LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .sequenceNumber(nextSequenceNumber())
            .scope(request.getScope())
            .companyId(request.getCompanyId())
            .projectId(request.getProjectId())
            .type(request.getType())
            .categoryId(request.getCategoryId())
            .date(request.getDate())
            .description(request.getDescription().trim())
            .amount(amount)
            .currency(currency)
            .exchangeRate(exchangeRate)
            .amountInBase(amountInBase)
            .documentNo(request.getDocumentNo())
            .notes(request.getNotes())
            .createdAt(now)
            .updatedAt(now)
            .build();

        insert(transaction);
        log.info("Recorded {} {} {} (base {})",
            transaction.getType().code(), transaction.getAmount(), transaction.getCurrency(), transaction.getAmountInBase());
        return transaction;
    }

    /**
     * Applies a partial update.
     *
     * @throws ValidationException if the update tries to change the currency or exchange rate
     * @throws ConstraintViolationException if the new amount drops below the allocated total, or the
     *         type or references change while allocations exist
     */
    public LedgerTransaction update(UUID id, TransactionUpdate update) {
        LedgerTransaction current = getById(id);

        if (update.getCurrency() != null && update.getCurrency() != current.getCurrency()) {
            throw new ValidationException("Currency is locked once a transaction is recorded");
        }
        if (update.getExchangeRate() != null
            && update.getExchangeRate().compareTo(current.getExchangeRate()) != 0) {
            throw new ValidationException("Exchange rate is locked once a transaction is recorded");
        }
        if (update.getDescription() != null && update.getDescription().isBlank()) {
            throw new ValidationException("Transaction description cannot be blank");
        }

        TransactionScope scope = update.getScope() != null ? update.getScope() : current.getScope();
        TransactionType type = update.getType() != null ? update.getType() : current.getType();
        UUID companyId = update.getCompanyId() != null ? update.getCompanyId() : current.getCompanyId();
        UUID projectId = update.getProjectId() != null ? update.getProjectId() : current.getProjectId();
        UUID categoryId = update.getCategoryId() != null ? update.getCategoryId() : current.getCategoryId();
        if (scope == TransactionScope.COMPANY) {
            projectId = null;
        }
        if (type.categoryGroup() != current.getType().categoryGroup() && update.getCategoryId() == null) {
            categoryId = null;
        }

        BigDecimal allocated = allocatedTotal(current);
        boolean moved = scope != current.getScope()
            || !Objects.equals(companyId, current.getCompanyId())
            || !Objects.equals(projectId, current.getProjectId());
        if (allocated.signum() > 0 && type != current.getType()) {
            throw new ConstraintViolationException("Cannot change the type of a transaction that has allocations");
        }
        if (allocated.signum() > 0 && moved) {
            throw new ConstraintViolationException("Cannot move a transaction that has allocations to another account");
        }
        validateReferences(scope, type, companyId, projectId, categoryId);

        BigDecimal amount = current.getAmount();
        BigDecimal amountInBase = current.getAmountInBase();
        if (update.getAmount() != null) {
            amount = validAmount(update.getAmount());
            amountInBase = toBase(amount, current.getExchangeRate());
            if (amountInBase.compareTo(allocated) < 0) {
                throw new ConstraintViolationException("Amount cannot be lower than the allocated total");
            }
        }

        LedgerTransaction updated = current.toBuilder()
            .scope(scope)
            .type(type)
            .companyId(companyId)
            .projectId(projectId)
            .categoryId(categoryId)
            .date(update.getDate() != null ? update.getDate() : current.getDate())
            .description(update.getDescription() != null ? update.getDescription().trim() : current.getDescription())
            .amount(amount)
            .amountInBase(amountInBase)
            .documentNo(update.getDocumentNo() != null ? update.getDocumentNo() : current.getDocumentNo())
            .notes(update.getNotes() != null ? update.getNotes() : current.getNotes())
            .updatedAt(Instant.now())
            .build();

        boundary.recordMutation();
        jdbcTemplate.update(
            "UPDATE transactions SET scope = ?, type = ?, company_id = ?, project_id = ?, category_id = ?, "
                + "transaction_date = ?, description = ?, amount = ?, amount_in_base = ?, document_no = ?, notes = ?, "
                + "updated_at = ? WHERE id = ?",
            updated.getScope().code(),
            updated.getType().code(),
            updated.getCompanyId(),
            updated.getProjectId(),
            updated.getCategoryId(),
            Date.valueOf(updated.getDate()),
            updated.getDescription(),
            updated.getAmount(),
            updated.getAmountInBase(),
            updated.getDocumentNo(),
            updated.getNotes(),
            Timestamp.from(updated.getUpdatedAt()),
            id
        );
        return updated;
    }

    /**
     * Writes a transaction row as-is, keeping id and sequence number.
     */
    public void insert(LedgerTransaction transaction) {
        boundary.recordMutation();
        jdbcTemplate.update(
            "INSERT INTO transactions (id, sequence_number, scope, company_id, project_id, type, category_id, "
                + "transaction_date, description, amount, currency, exchange_rate, amount_in_base, document_no, notes, "
                + "linked_invoice_id, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            transaction.getId(),
            transaction.getSequenceNumber(),
            transaction.getScope().code(),
            transaction.getCompanyId(),
            transaction.getProjectId(),
            transaction.getType().code(),
            transaction.getCategoryId(),
            Date.valueOf(transaction.getDate()),
            transaction.getDescription(),
            transaction.getAmount(),
            transaction.getCurrency().name(),
            transaction.getExchangeRate(),
            transaction.getAmountInBase(),
            transaction.getDocumentNo(),
            transaction.getNotes(),
            transaction.getLinkedInvoiceId(),
            Timestamp.from(transaction.getCreatedAt()),
            Timestamp.from(transaction.getUpdatedAt())
        );
    }

    /**
     * Sets the legacy invoice link. Only snapshot load writes this column, after all rows exist.
     */
    public void updateLinkedInvoice(UUID id, UUID linkedInvoiceId) {
        boundary.recordMutation();
        jdbcTemplate.update("UPDATE transactions SET linked_invoice_id = ? WHERE id = ?", linkedInvoiceId, id);
    }

    public long nextSequenceNumber() {
        Long max = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(sequence_number), 0) FROM transactions", Long.class);
        return (max != null ? max : 0L) + 1;
    }

    public Optional<LedgerTransaction> findById(UUID id) {
        List<LedgerTransaction> transactions = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM transactions t WHERE t.id = ?", transactionRowMapper(), id);
        return transactions.stream().findFirst();
    }

    public LedgerTransaction getById(UUID id) {
        return findById(id).orElseThrow(() -> NotFoundException.of("Transaction", id));
    }

    public TransactionDetails getDetails(UUID id) {
        List<TransactionDetails> details = jdbcTemplate.query(
            DETAILS_SELECT + " WHERE t.id = ?", detailsRowMapper(), id);
        return details.stream().findFirst().orElseThrow(() -> NotFoundException.of("Transaction", id));
    }

    /**
     * Lists transactions matching the filter, newest first.
     */
    public List<TransactionDetails> findDetails(TransactionFilter filter) {
        StringBuilder sql = new StringBuilder(DETAILS_SELECT).append(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (filter.getScope() != null) {
            sql.append(" AND t.scope = ?");
            params.add(filter.getScope().code());
        }
        if (filter.getType() != null) {
            sql.append(" AND t.type = ?");
            params.add(filter.getType().code());
        }
        if (filter.getCompanyId() != null) {
            sql.append(" AND t.company_id = ?");
            params.add(filter.getCompanyId());
        }
        if (filter.getProjectId() != null) {
            sql.append(" AND t.project_id = ?");
            params.add(filter.getProjectId());
        }
        if (filter.getStartDate() != null) {
            sql.append(" AND t.transaction_date >= ?");
            params.add(Date.valueOf(filter.getStartDate()));
        }
        if (filter.getEndDate() != null) {
            sql.append(" AND t.transaction_date <= ?");
            params.add(Date.valueOf(filter.getEndDate()));
        }
        if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
            String pattern = "%" + filter.getSearch().trim().toLowerCase() + "%";
            sql.append(" AND (LOWER(t.description) LIKE ? OR LOWER(t.document_no) LIKE ? OR LOWER(c.name) LIKE ?)");
            params.add(pattern);
            params.add(pattern);
            params.add(pattern);
        }
        sql.append(" ORDER BY t.transaction_date DESC, t.sequence_number DESC, t.id");
        if (filter.getLimit() != null && filter.getLimit() > 0) {
            sql.append(" LIMIT ?");
            params.add(filter.getLimit());
        }

        return jdbcTemplate.query(sql.toString(), detailsRowMapper(), params.toArray());
    }

    /**
     * Every transaction that references the company directly or belongs to one of the projects.
     */
    public List<LedgerTransaction> findReferencing(UUID companyId, Collection<UUID> projectIds) {
        List<LedgerTransaction> result = new ArrayList<>(jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM transactions t WHERE t.company_id = ? ORDER BY t.sequence_number",
            transactionRowMapper(), companyId));
        for (UUID projectId : projectIds) {
            for (LedgerTransaction transaction : findByProject(projectId)) {
                if (!Objects.equals(transaction.getCompanyId(), companyId)) {
                    result.add(transaction);
                }
            }
        }
        return result;
    }

    public List<LedgerTransaction> findByProject(UUID projectId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM transactions t WHERE t.project_id = ? ORDER BY t.sequence_number",
            transactionRowMapper(), projectId);
    }

    public List<LedgerTransaction> findAllOrderedById() {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM transactions t ORDER BY t.id", transactionRowMapper());
    }

    private BigDecimal allocatedTotal(LedgerTransaction transaction) {
        return transaction.getType().isPayment()
            ? allocationStore.sumForPayment(transaction.getId())
            : allocationStore.sumForInvoice(transaction.getId());
    }

    private void validateReferences(TransactionScope scope, TransactionType type,
                                    UUID companyId, UUID projectId, UUID categoryId) {
        if (scope == TransactionScope.PROJECT && projectId == null) {
            throw new ValidationException("Project transactions require a project");
        }
        if (scope == TransactionScope.CARI && companyId == null) {
            throw new ValidationException("Cari transactions require a company");
        }
        if (scope == TransactionScope.COMPANY && projectId != null) {
            throw new ValidationException("Company-level transactions cannot reference a project");
        }

        if (companyId != null) {
            Company company = companyStore.getById(companyId);
            if (!company.isActive()) {
                throw new ConstraintViolationException("Transactions cannot reference an inactive company");
            }
        }
        if (projectId != null) {
            Project project = projectStore.getById(projectId);
            if (!project.isActive()) {
                throw new ConstraintViolationException("Transactions cannot reference an inactive project");
            }
        }
        if (categoryId != null) {
            Category category = categoryStore.getById(categoryId);
            if (category.getType() != type.categoryGroup()) {
                throw new ValidationException(String.format(
                    "Category group %s does not match transaction type %s",
                    category.getType().code(), type.code()));
            }
        }
    }

    private static BigDecimal validAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be greater than zero");
        }
        BigDecimal rounded = Money.round(amount);
        if (rounded.signum() <= 0) {
            throw new ValidationException("Amount must be at least 0.01");
        }
        return rounded;
    }

    static BigDecimal resolveExchangeRate(CurrencyCode currency, BigDecimal exchangeRate) {
        if (currency.isBase()) {
            return BigDecimal.ONE.setScale(RATE_SCALE);
        }
        if (exchangeRate == null || exchangeRate.signum() <= 0) {
            throw new ValidationException("Foreign currency transactions require a positive exchange rate");
        }
        return exchangeRate.setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal toBase(BigDecimal amount, BigDecimal exchangeRate) {
        BigDecimal amountInBase = Money.round(amount.multiply(exchangeRate));
        if (amountInBase.signum() <= 0) {
            throw new ValidationException("Amount in base currency must be greater than zero");
        }
        return amountInBase;
    }

    private static LedgerTransaction mapTransaction(ResultSet rs) throws SQLException {
        return LedgerTransaction.builder()
            .id(rs.getObject("id", UUID.class))
            .sequenceNumber(rs.getLong("sequence_number"))
            .scope(TransactionScope.fromCode(rs.getString("scope")))
            .companyId(rs.getObject("company_id", UUID.class))
            .projectId(rs.getObject("project_id", UUID.class))
            .type(TransactionType.fromCode(rs.getString("type")))
            .categoryId(rs.getObject("category_id", UUID.class))
            .date(rs.getDate("transaction_date").toLocalDate())
            .description(rs.getString("description"))
            .amount(rs.getBigDecimal("amount"))
            .currency(CurrencyCode.valueOf(rs.getString("currency")))
            .exchangeRate(rs.getBigDecimal("exchange_rate"))
            .amountInBase(rs.getBigDecimal("amount_in_base"))
            .documentNo(rs.getString("document_no"))
            .notes(rs.getString("notes"))
            .linkedInvoiceId(rs.getObject("linked_invoice_id", UUID.class))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> mapTransaction(rs);
    }

    private RowMapper<TransactionDetails> detailsRowMapper() {
        return (rs, rowNum) -> {
            LedgerTransaction transaction = mapTransaction(rs);
            BigDecimal allocated = transaction.getType().isPayment()
                ? rs.getBigDecimal("payment_allocated")
                : rs.getBigDecimal("invoice_allocated");
            return TransactionDetails.builder()
                .transaction(transaction)
                .companyName(rs.getString("company_name"))
                .projectName(rs.getString("project_name"))
                .categoryName(rs.getString("category_name"))
                .categoryColor(rs.getString("category_color"))
                .allocatedAmount(Money.round(allocated))
                .build();
        };
    }
}
