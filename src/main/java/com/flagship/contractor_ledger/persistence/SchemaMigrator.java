package com.flagship.contractor_ledger.persistence;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies the versioned migrations.
 *
 * Schema statements run on every startup. Data steps run at most once each and are recorded in
 * {@code schema_versions}, which is the applied-migrations log carried by snapshots.
 */
@Component
@Slf4j
public class SchemaMigrator {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final List<Migration> migrations;

    public SchemaMigrator(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.migrations = LedgerMigrations.all();
    }

    @PostConstruct
    public void migrate() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS schema_versions ("
            + "version INT PRIMARY KEY, "
            + "name VARCHAR(100) NOT NULL, "
            + "applied_at TIMESTAMP NOT NULL)");

        for (Migration migration : migrations) {
            migration.schemaStatements().forEach(jdbcTemplate::execute);
        }
        List<AppliedMigration> applied = transactionTemplate.execute(status -> applyPendingDataMigrations());
        log.info("Ledger schema at version {} ({} migration(s) applied now)",
            currentVersion(), applied != null ? applied.size() : 0);
    }

    /**
     * Runs the data step of every migration missing from the log, in version order.
     * The caller supplies the transaction.
     *
     * @return the migrations applied by this call
     */
    public List<AppliedMigration> applyPendingDataMigrations() {
        Set<Integer> done = new HashSet<>();
        for (AppliedMigration migration : appliedMigrations()) {
            done.add(migration.getVersion());
        }

        List<AppliedMigration> applied = new ArrayList<>();
        for (Migration migration : migrations) {
            if (done.contains(migration.version())) {
                continue;
            }
            migration.migrateData(jdbcTemplate);
            AppliedMigration entry = AppliedMigration.builder()
                .version(migration.version())
                .name(migration.name())
                .appliedAt(Instant.now())
                .build();
            insertLogEntry(entry);
            applied.add(entry);
            log.info("Applied migration {} ({})", migration.version(), migration.name());
        }
        return applied;
    }

    public List<AppliedMigration> appliedMigrations() {
        return jdbcTemplate.query(
            "SELECT version, name, applied_at FROM schema_versions ORDER BY version",
            (rs, rowNum) -> AppliedMigration.builder()
                .version(rs.getInt("version"))
                .name(rs.getString("name"))
                .appliedAt(rs.getTimestamp("applied_at").toInstant())
                .build());
    }

    /**
     * Replaces the log with the one read from a snapshot. The caller supplies the transaction.
     */
    public void replaceLog(List<AppliedMigration> entries) {
        jdbcTemplate.update("DELETE FROM schema_versions");
        entries.forEach(this::insertLogEntry);
    }

    public int currentVersion() {
        return migrations.get(migrations.size() - 1).version();
    }

    private void insertLogEntry(AppliedMigration entry) {
        jdbcTemplate.update("INSERT INTO schema_versions (version, name, applied_at) VALUES (?, ?, ?)",
            entry.getVersion(), entry.getName(), Timestamp.from(entry.getAppliedAt()));
    }
}
