package com.flagship.contractor_ledger.backup;

import com.flagship.contractor_ledger.observability.LedgerMetrics;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import com.flagship.contractor_ledger.persistence.SnapshotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Scheduler tests with a mocked transport: when a backup is taken and what happens when storing fails.
 */
@ExtendWith(MockitoExtension.class)
class BackupSchedulerTest {

    @Mock
    private LedgerTransactionBoundary boundary;

    @Mock
    private SnapshotService snapshotService;

    @Mock
    private BackupTransport backupTransport;

    @Mock
    private LedgerMetrics metrics;

    private BackupScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new BackupScheduler(boundary, snapshotService, backupTransport, metrics);
    }

    private void runReadTransactionsInline() {
        when(boundary.withReadTransaction(any())).thenAnswer(invocation -> {
            Supplier<?> work = invocation.getArgument(0);
            return work.get();
        });
    }

    @Test
    @DisplayName("A clean ledger is not backed up")
    void skipsWhenClean() throws IOException {
        when(boundary.isDirty()).thenReturn(false);

        scheduler.backupIfDirty();

        verify(backupTransport, never()).store(any());
        verify(snapshotService, never()).exportSnapshotInTransaction();
        verify(metrics).recordBackup("skipped");
    }

    @Test
    @DisplayName("A dirty ledger is exported, stored and marked clean")
    void storesWhenDirty() throws IOException {
        byte[] snapshot = "{}".getBytes();
        when(boundary.isDirty()).thenReturn(true);
        runReadTransactionsInline();
        when(snapshotService.exportSnapshotInTransaction()).thenReturn(snapshot);

        scheduler.backupIfDirty();

        verify(backupTransport).store(snapshot);
        verify(boundary).clearDirty();
        verify(boundary, never()).markDirty();
        verify(metrics).recordBackup("stored");
    }

    @Test
    @DisplayName("A failed store restores the dirty flag for the next run")
    void restoresDirtyFlagOnFailure() throws IOException {
        byte[] snapshot = "{}".getBytes();
        when(boundary.isDirty()).thenReturn(true);
        runReadTransactionsInline();
        when(snapshotService.exportSnapshotInTransaction()).thenReturn(snapshot);
        doThrow(new IOException("disk full")).when(backupTransport).store(snapshot);

        scheduler.backupIfDirty();

        verify(boundary).clearDirty();
        verify(boundary).markDirty();
        verify(metrics).recordBackup("failed");
    }
}
