package com.flagship.contractor_ledger.persistence;

import com.flagship.contractor_ledger.category.DefaultCategories;
import com.flagship.contractor_ledger.common.Money;
import com.flagship.contractor_ledger.transaction.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The ledger's migrations, in version order.
 */
@Slf4j
final class LedgerMigrations {

    private LedgerMigrations() {
    }

    static List<Migration> all() {
        return List.of(new BaseTables(), new PaymentAllocations(), new DefaultCategorySeed());
    }

    static final class BaseTables implements Migration {

        @Override
        public int version() {
            return 1;
        }

        @Override
        public String name() {
            return "base_tables";
        }

        @Override
        public List<String> schemaStatements() {
            return List.of(
                "CREATE TABLE IF NOT EXISTS companies ("
                    + "id UUID PRIMARY KEY, "
                    + "kind VARCHAR(20) NOT NULL CHECK (kind IN ('person', 'organization')), "
                    + "role VARCHAR(20) NOT NULL CHECK (role IN ('customer', 'supplier', 'subcontractor', 'investor')), "
                    + "name VARCHAR(255) NOT NULL, "
                    + "national_id VARCHAR(20), "
                    + "tax_office VARCHAR(100), "
                    + "tax_number VARCHAR(20), "
                    + "contact_person VARCHAR(255), "
                    + "phone VARCHAR(50), "
                    + "email VARCHAR(255), "
                    + "address VARCHAR(1000), "
                    + "bank_name VARCHAR(255), "
                    + "iban VARCHAR(50), "
                    + "notes VARCHAR(4000), "
                    + "active BOOLEAN DEFAULT TRUE NOT NULL, "
                    + "created_at TIMESTAMP NOT NULL, "
                    + "updated_at TIMESTAMP NOT NULL)",

                "CREATE TABLE IF NOT EXISTS projects ("
                    + "id UUID PRIMARY KEY, "
                    + "code VARCHAR(50) NOT NULL UNIQUE, "
                    + "name VARCHAR(255) NOT NULL, "
                    + "ownership VARCHAR(10) NOT NULL CHECK (ownership IN ('own', 'client')), "
                    + "client_company_id UUID, "
                    + "status VARCHAR(20) DEFAULT 'planned' NOT NULL "
                    + "CHECK (status IN ('planned', 'active', 'completed', 'cancelled')), "
                    + "location VARCHAR(255), "
                    + "estimated_budget DECIMAL(15, 2), "
                    + "planned_start DATE, "
                    + "planned_end DATE, "
                    + "actual_start DATE, "
                    + "actual_end DATE, "
                    + "description VARCHAR(4000), "
                    + "active BOOLEAN DEFAULT TRUE NOT NULL, "
                    + "created_at TIMESTAMP NOT NULL, "
                    + "updated_at TIMESTAMP NOT NULL, "
                    + "CONSTRAINT fk_projects_client FOREIGN KEY (client_company_id) REFERENCES companies(id), "
                    + "CONSTRAINT chk_projects_client CHECK ("
                    + "(ownership = 'client' AND client_company_id IS NOT NULL) "
                    + "OR (ownership = 'own' AND client_company_id IS NULL)))",

                "CREATE TABLE IF NOT EXISTS categories ("
                    + "id UUID PRIMARY KEY, "
                    + "name VARCHAR(100) NOT NULL, "
                    + "type VARCHAR(20) NOT NULL CHECK (type IN ('invoice_out', 'invoice_in', 'payment')), "
                    + "color VARCHAR(7) DEFAULT '" + DefaultCategories.DEFAULT_COLOR + "' NOT NULL, "
                    + "is_default BOOLEAN DEFAULT FALSE NOT NULL, "
                    + "created_at TIMESTAMP NOT NULL)",

                "CREATE TABLE IF NOT EXISTS transactions ("
                    + "id UUID PRIMARY KEY, "
                    + "sequence_number BIGINT NOT NULL, "
                    + "scope VARCHAR(10) NOT NULL CHECK (scope IN ('cari', 'project', 'company')), "
                    + "company_id UUID, "
                    + "project_id UUID, "
                    + "type VARCHAR(15) NOT NULL "
                    + "CHECK (type IN ('invoice_out', 'payment_in', 'invoice_in', 'payment_out')), "
                    + "category_id UUID, "
                    + "transaction_date DATE NOT NULL, "
                    + "description VARCHAR(1000) NOT NULL, "
                    + "amount DECIMAL(15, 2) NOT NULL CHECK (amount > 0), "
                    + "currency VARCHAR(3) DEFAULT 'TRY' NOT NULL CHECK (currency IN ('TRY', 'USD', 'EUR')), "
                    + "exchange_rate DECIMAL(10, 4) DEFAULT 1 NOT NULL CHECK (exchange_rate > 0), "
                    + "amount_in_base DECIMAL(15, 2) NOT NULL CHECK (amount_in_base > 0), "
                    + "document_no VARCHAR(100), "
                    + "notes VARCHAR(4000), "
                    + "linked_invoice_id UUID, "
                    + "created_at TIMESTAMP NOT NULL, "
                    + "updated_at TIMESTAMP NOT NULL, "
                    + "CONSTRAINT fk_transactions_company FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE, "
                    + "CONSTRAINT fk_transactions_project FOREIGN KEY (project_id) REFERENCES projects(id) ON DELETE CASCADE, "
                    + "CONSTRAINT fk_transactions_category FOREIGN KEY (category_id) REFERENCES categories(id) ON DELETE SET NULL, "
                    + "CONSTRAINT fk_transactions_linked_invoice FOREIGN KEY (linked_invoice_id) "
                    + "REFERENCES transactions(id) ON DELETE SET NULL, "
                    + "CONSTRAINT chk_transactions_scope CHECK ("
                    + "(scope = 'project' AND project_id IS NOT NULL) "
                    + "OR (scope = 'cari' AND company_id IS NOT NULL) "
                    + "OR (scope = 'company' AND project_id IS NULL)))",

                "CREATE INDEX IF NOT EXISTS idx_transactions_company ON transactions(company_id)",
                "CREATE INDEX IF NOT EXISTS idx_transactions_project ON transactions(project_id)",
                "CREATE INDEX IF NOT EXISTS idx_transactions_date ON transactions(transaction_date, sequence_number)",

                "CREATE TABLE IF NOT EXISTS trash ("
                    + "id UUID PRIMARY KEY, "
                    + "entry_type VARCHAR(20) NOT NULL CHECK (entry_type IN ('company', 'project', 'transaction')), "
                    + "label VARCHAR(255), "
                    + "data CLOB NOT NULL, "
                    + "deleted_at TIMESTAMP NOT NULL)"
            );
        }
    }

    /**
     * Replaces the single linked-invoice column with the allocation table. Existing links become
     * allocations, oldest payment first, each capped at what both sides still have free.
     */
    static final class PaymentAllocations implements Migration {

        @Override
        public int version() {
            return 2;
        }

        @Override
        public String name() {
            return "payment_allocations";
        }

        @Override
        public List<String> schemaStatements() {
            return List.of(
                "CREATE TABLE IF NOT EXISTS payment_allocations ("
                    + "id UUID PRIMARY KEY, "
                    + "payment_id UUID NOT NULL, "
                    + "invoice_id UUID NOT NULL, "
                    + "amount DECIMAL(15, 2) NOT NULL CHECK (amount > 0), "
                    + "created_at TIMESTAMP NOT NULL, "
                    + "CONSTRAINT uq_allocations_pair UNIQUE (payment_id, invoice_id), "
                    + "CONSTRAINT fk_allocations_payment FOREIGN KEY (payment_id) REFERENCES transactions(id) ON DELETE CASCADE, "
                    + "CONSTRAINT fk_allocations_invoice FOREIGN KEY (invoice_id) REFERENCES transactions(id) ON DELETE CASCADE)",
                "CREATE INDEX IF NOT EXISTS idx_allocations_invoice ON payment_allocations(invoice_id)"
            );
        }

        @Override
        public void migrateData(JdbcTemplate jdbcTemplate) {
            List<Map<String, Object>> links = jdbcTemplate.queryForList(
                "SELECT p.id AS payment_id, p.type AS payment_type, p.amount_in_base AS payment_amount, "
                    + "i.id AS invoice_id, i.type AS invoice_type, i.amount_in_base AS invoice_amount "
                    + "FROM transactions p JOIN transactions i ON i.id = p.linked_invoice_id "
                    + "ORDER BY p.transaction_date, p.sequence_number");

            int backfilled = 0;
            for (Map<String, Object> link : links) {
                TransactionType paymentType = TransactionType.fromCode((String) link.get("payment_type"));
                TransactionType invoiceType = TransactionType.fromCode((String) link.get("invoice_type"));
                if (!paymentType.isPayment() || paymentType.settledInvoiceType() != invoiceType) {
                    continue;
                }
                UUID paymentId = (UUID) link.get("payment_id");
                UUID invoiceId = (UUID) link.get("invoice_id");

                BigDecimal paymentFree = ((BigDecimal) link.get("payment_amount")).subtract(
                    sum(jdbcTemplate, "SELECT COALESCE(SUM(amount), 0) FROM payment_allocations WHERE payment_id = ?", paymentId));
                BigDecimal invoiceFree = ((BigDecimal) link.get("invoice_amount")).subtract(
                    sum(jdbcTemplate, "SELECT COALESCE(SUM(amount), 0) FROM payment_allocations WHERE invoice_id = ?", invoiceId));
                BigDecimal share = Money.round(paymentFree.min(invoiceFree));

                Integer existing = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM payment_allocations WHERE payment_id = ? AND invoice_id = ?",
                    Integer.class, paymentId, invoiceId);
                if (share.signum() <= 0 || (existing != null && existing > 0)) {
                    continue;
                }

                jdbcTemplate.update(
                    "INSERT INTO payment_allocations (id, payment_id, invoice_id, amount, created_at) VALUES (?, ?, ?, ?, ?)",
                    UUID.randomUUID(), paymentId, invoiceId, share, Timestamp.from(Instant.now()));
                backfilled++;
            }
            if (backfilled > 0) {
                log.info("Backfilled {} allocation(s) from legacy invoice links", backfilled);
            }
        }

        private static BigDecimal sum(JdbcTemplate jdbcTemplate, String sql, UUID id) {
            BigDecimal total = jdbcTemplate.queryForObject(sql, BigDecimal.class, id);
            return total != null ? total : BigDecimal.ZERO;
        }
    }

    static final class DefaultCategorySeed implements Migration {

        @Override
        public int version() {
            return 3;
        }

        @Override
        public String name() {
            return "default_categories";
        }

        @Override
        public List<String> schemaStatements() {
            return List.of();
        }

        @Override
        public void migrateData(JdbcTemplate jdbcTemplate) {
            Integer defaults = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM categories WHERE is_default = TRUE", Integer.class);
            if (defaults != null && defaults > 0) {
                return;
            }
            Timestamp now = Timestamp.from(Instant.now());
            for (DefaultCategories.Seed seed : DefaultCategories.all()) {
                jdbcTemplate.update(
                    "INSERT INTO categories (id, name, type, color, is_default, created_at) VALUES (?, ?, ?, ?, TRUE, ?)",
                    UUID.randomUUID(), seed.getName(), seed.getType().code(), seed.getColor(), now);
            }
            log.info("Seeded {} default categories", DefaultCategories.all().size());
        }
    }
}
