package com.flagship.contractor_ledger.backup;

import com.flagship.contractor_ledger.observability.LedgerMetrics;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import com.flagship.contractor_ledger.persistence.SnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Backs the ledger up after it changed, batching every commit since the last backup into one.
 *
 * Each run checks the dirty flag. If set, the snapshot is exported and the flag cleared inside the
 * same read transaction, so a commit landing right after the export raises the flag again and is
 * picked up by the next run. If the transport fails the flag is restored.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "ledger.backup.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BackupScheduler {

    private final LedgerTransactionBoundary boundary;
    private final SnapshotService snapshotService;
    private final BackupTransport backupTransport;
    private final LedgerMetrics metrics;

    @Scheduled(fixedDelayString = "${ledger.backup.interval-ms:300000}",
               initialDelayString = "${ledger.backup.interval-ms:300000}")
    public void backupIfDirty() {
        if (!boundary.isDirty()) {
            metrics.recordBackup("skipped");
            return;
        }

        byte[] snapshot = boundary.withReadTransaction(() -> {
            byte[] bytes = snapshotService.exportSnapshotInTransaction();
            boundary.clearDirty();
            return bytes;
        });

        try {
            backupTransport.store(snapshot);
            metrics.recordBackup("stored");
            log.info("Ledger backup stored ({} bytes)", snapshot.length);
        } catch (IOException | RuntimeException e) {
            boundary.markDirty();
            metrics.recordBackup("failed");
            log.error("Ledger backup failed, will retry on next run: {}", e.getMessage(), e);
        }
    }
}
