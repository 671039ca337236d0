package com.flagship.contractor_ledger.persistence;

import com.flagship.contractor_ledger.exception.TransactionStateException;
import com.flagship.contractor_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The atomic boundary around every ledger write.
 *
 * A unit of work runs inside {@link #withTransaction(Supplier)}: it either commits as a whole,
 * after which the dirty flag is raised for the backup scheduler, or it rolls back as a whole and
 * the original exception is rethrown. Stores never open transactions themselves; they call
 * {@link #recordMutation()} so that a write outside the boundary fails fast.
 *
 * The ledger has a single writer. Work is serialized by one lock:
 * - a second begin on the thread that already holds the boundary is a {@link TransactionStateException}
 * - any other thread waits until the boundary is idle
 */
@Component
@Slf4j
public class LedgerTransactionBoundary {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final ObjectProvider<CommitListener> commitListeners;
    private final LedgerMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean dirty = new AtomicBoolean(false);

    // Guarded by lock
    private volatile BoundaryState state = BoundaryState.IDLE;
    private boolean writable;
    private boolean mutated;

    public LedgerTransactionBoundary(PlatformTransactionManager transactionManager,
                                     ObjectProvider<CommitListener> commitListeners,
                                     LedgerMetrics metrics) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.commitListeners = commitListeners;
        this.metrics = metrics;
    }

    /**
     * Runs the work as one atomic ledger transaction and returns its result.
     *
     * @throws TransactionStateException if called while this thread already has a transaction open
     */
    public <T> T withTransaction(Supplier<T> work) {
        return execute(work, writeTemplate, true);
    }

    /**
     * Void variant of {@link #withTransaction(Supplier)}.
     */
    public void inTransaction(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        }, writeTemplate, true);
    }

    /**
     * Runs read-only work under the same serialization as writes, so the reader never observes
     * a half-applied mutation. Never marks the ledger dirty.
     */
    public <T> T withReadTransaction(Supplier<T> work) {
        return execute(work, readTemplate, false);
    }

    /**
     * Called by every store before it writes.
     *
     * @throws TransactionStateException if no writable transaction is open on this thread
     */
    public void recordMutation() {
        if (!lock.isHeldByCurrentThread() || state != BoundaryState.BEGUN) {
            throw new TransactionStateException("Ledger mutations must run inside withTransaction");
        }
        if (!writable) {
            throw new TransactionStateException("Cannot mutate the ledger inside a read-only transaction");
        }
        mutated = true;
    }

    public boolean isInTransaction() {
        return lock.isHeldByCurrentThread() && state == BoundaryState.BEGUN;
    }

    public BoundaryState getState() {
        return state;
    }

    public boolean isDirty() {
        return dirty.get();
    }

    public void clearDirty() {
        dirty.set(false);
    }

    public void markDirty() {
        dirty.set(true);
    }

    private <T> T execute(Supplier<T> work, TransactionTemplate template, boolean allowWrites) {
        if (lock.isHeldByCurrentThread()) {
            throw new TransactionStateException(
                "A ledger transaction is already open on this thread; nested transactions are not supported");
        }

        lock.lock();
        long startTime = System.nanoTime();
        try {
            state = BoundaryState.BEGUN;
            writable = allowWrites;
            mutated = false;

            T result = template.execute(status -> {
                T value = work.get();
                if (mutated) {
                    notifyCommitListeners();
                }
                return value;
            });

            state = BoundaryState.COMMITTED;
            if (mutated) {
                dirty.set(true);
            }
            metrics.recordCommit(mutated, Duration.ofNanos(System.nanoTime() - startTime));
            return result;

        } catch (RuntimeException | Error e) {
            state = BoundaryState.ROLLED_BACK;
            metrics.recordRollback(Duration.ofNanos(System.nanoTime() - startTime));
            log.debug("Ledger transaction rolled back: {}", e.getMessage());
            throw e;

        } finally {
            mutated = false;
            writable = false;
            state = BoundaryState.IDLE;
            lock.unlock();
        }
    }

    private void notifyCommitListeners() {
        List<CommitListener> listeners = commitListeners.orderedStream().collect(Collectors.toList());
        for (CommitListener listener : listeners) {
            listener.beforeCommit();
        }
    }
}
