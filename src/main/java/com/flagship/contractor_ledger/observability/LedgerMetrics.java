package com.flagship.contractor_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions.committed: Counter of committed boundary transactions
 * - ledger.transactions.rolled_back: Counter of rolled back boundary transactions
 * - ledger.transaction.duration: Timer over the whole boundary call, tagged by mode
 * - ledger.allocations.replaced: Counter of payments whose allocation set was replaced
 * - ledger.backups: Counter of backup attempts, tagged by outcome
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter transactionsCommitted;
    private final Counter transactionsRolledBack;
    private final Counter allocationsReplaced;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.transactionsCommitted = Counter.builder("ledger.transactions.committed")
                .description("Number of committed ledger transactions")
                .register(registry);

        this.transactionsRolledBack = Counter.builder("ledger.transactions.rolled_back")
                .description("Number of ledger transactions rolled back after an error")
                .register(registry);

        this.allocationsReplaced = Counter.builder("ledger.allocations.replaced")
                .description("Number of payments whose allocation set was replaced")
                .register(registry);
    }

    public void recordCommit(boolean mutated, Duration duration) {
        transactionsCommitted.increment();
        transactionTimer(mutated ? "write" : "read").record(duration);
    }

    public void recordRollback(Duration duration) {
        transactionsRolledBack.increment();
        transactionTimer("rollback").record(duration);
    }

    public void recordAllocationsReplaced(int allocationCount) {
        allocationsReplaced.increment();
        registry.summary("ledger.allocations.batch_size").record(allocationCount);
    }

    /**
     * Records a backup attempt. Outcome is one of "stored", "skipped" or "failed".
     */
    public void recordBackup(String outcome) {
        registry.counter("ledger.backups", "outcome", outcome).increment();
    }

    private Timer transactionTimer(String mode) {
        return Timer.builder("ledger.transaction.duration")
                .description("Time spent inside the ledger transaction boundary")
                .tag("mode", mode)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public double committedCount() {
        return transactionsCommitted.count();
    }

    public double rolledBackCount() {
        return transactionsRolledBack.count();
    }
}
