package com.flagship.contractor_ledger.persistence;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * A versioned schema step.
 *
 * The schema statements must be idempotent ({@code IF NOT EXISTS}) because they run on every
 * startup. The data step runs at most once per ledger, tracked in the migrations log, and runs
 * again when a snapshot from before this version is loaded.
 */
public interface Migration {

    int version();

    String name();

    List<String> schemaStatements();

    /**
     * Runs inside the caller's transaction.
     */
    default void migrateData(JdbcTemplate jdbcTemplate) {
    }
}
